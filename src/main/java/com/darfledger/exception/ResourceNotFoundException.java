package com.darfledger.exception;

import java.util.Map;

/**
 * Thrown when an operation looked up by id is not in the store. Not fatal: nothing has been
 * changed and the published ledger stays as it was.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String id) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %s does not exist", resourceType, id),
                Map.of("resourceType", resourceType, "id", id));
    }
}
