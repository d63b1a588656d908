package com.darfledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the ledger. {@code fatal} codes abort a whole recompute pass;
 * the others reject a single operation or request.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    INVALID_OPERATION("INVALID_OPERATION", false),
    UNKNOWN_ASSET_TYPE("UNKNOWN_ASSET_TYPE", false),
    UNKNOWN_TRADE_CATEGORY("UNKNOWN_TRADE_CATEGORY", false),
    UNKNOWN_OPERATION_TYPE("UNKNOWN_OPERATION_TYPE", false),
    NOT_FOUND("NOT_FOUND", false),
    INSUFFICIENT_POSITION("INSUFFICIENT_POSITION", true),
    ORDERING_VIOLATION("ORDERING_VIOLATION", true),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", true);

    private final String code;
    private final boolean fatal;
}
