package com.darfledger.exception;

import java.util.Map;

/**
 * A lane was folded out of chronological order. Always a programming error in the calling
 * sequence, never caused by user data.
 */
public class OrderingViolationException extends BaseException {

    public OrderingViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.ORDERING_VIOLATION, message, details);
    }
}
