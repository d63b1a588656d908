package com.darfledger.ledger;

import com.darfledger.domain.model.Operation;
import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.ValidationException;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** An operation left out of a recompute pass, with the reason it was rejected. */
@Value
@Builder
public class OperationRejection {

    String operationId;
    String assetCode;
    ErrorCode errorCode;
    String message;
    Map<String, Object> details;

    public static OperationRejection of(Operation operation, ValidationException ex) {
        return OperationRejection.builder()
                .operationId(operation.getId())
                .assetCode(operation.getAssetCode())
                .errorCode(ex.getErrorCode())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .build();
    }
}
