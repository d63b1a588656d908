package com.darfledger.exception;

import java.util.Map;

/**
 * Thrown for a malformed operation: non-positive quantity or price, blank asset code,
 * missing date, or an enum value that does not exist. The operation never enters the ledger.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }

    public ValidationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
