package com.darfledger.domain.enums;

import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.ValidationException;
import java.util.Map;

/** Swing-trade (buy and sell on different dates) or day-trade (same date). */
public enum TradeCategory {
    SWING_TRADE("swing_trade"),
    DAY_TRADE("day_trade");

    private final String code;

    TradeCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a category from its code ({@code swing_trade}) or constant name, ignoring case.
     *
     * @throws ValidationException with {@link ErrorCode#UNKNOWN_TRADE_CATEGORY} if nothing matches
     */
    public static TradeCategory fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().replace('-', '_');
            for (TradeCategory category : values()) {
                if (category.code.equalsIgnoreCase(normalized) || category.name().equalsIgnoreCase(normalized)) {
                    return category;
                }
            }
        }
        throw new ValidationException(
                ErrorCode.UNKNOWN_TRADE_CATEGORY,
                "Unknown trade category: " + value,
                Map.of("tradeCategory", String.valueOf(value)));
    }
}
