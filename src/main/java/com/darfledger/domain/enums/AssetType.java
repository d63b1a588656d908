package com.darfledger.domain.enums;

import com.darfledger.exception.ErrorCode;
import com.darfledger.exception.ValidationException;
import java.util.Map;

/**
 * Asset class of a traded instrument on B3 or a crypto exchange.
 *
 * <p>Each constant carries the short code used by brokerage notes and the operation
 * registry ({@code acao}, {@code etf}, {@code fii}, {@code bdr}, {@code opcao}, {@code cripto}).
 */
public enum AssetType {
    STOCK("acao"),
    ETF("etf"),
    REAL_ESTATE_FUND("fii"),
    DEPOSITARY_RECEIPT("bdr"),
    OPTION("opcao"),
    CRYPTO("cripto");

    private final String code;

    AssetType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves an asset type from its short code or its constant name, ignoring case.
     *
     * @throws ValidationException with {@link ErrorCode#UNKNOWN_ASSET_TYPE} if nothing matches
     */
    public static AssetType fromCode(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (AssetType type : values()) {
                if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException(
                ErrorCode.UNKNOWN_ASSET_TYPE,
                "Unknown asset type: " + value,
                Map.of("assetType", String.valueOf(value)));
    }
}
