package com.darfledger.domain.enums;

import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.ValidationException;
import java.util.Map;

/** Buy ({@code compra}) or sell ({@code venda}) side of a recorded operation. */
public enum OperationType {
    BUY("compra"),
    SELL("venda");

    private final String code;

    OperationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static OperationType fromCode(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (OperationType type : values()) {
                if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException(
                ErrorCode.UNKNOWN_OPERATION_TYPE,
                "Unknown operation type: " + value,
                Map.of("operationType", String.valueOf(value)));
    }
}
