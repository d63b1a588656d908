package com.darfledger.domain.model;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.OperationType;
import com.darfledger.domain.enums.TradeCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * An immutable buy or sell record as stated on a brokerage note.
 *
 * <p>For buys, {@code totalCost} includes brokerage and exchange fees and is the amount added to
 * the cost basis. For sells, proceeds are always {@code quantity * unitPrice}; {@code totalCost}
 * is informational.
 *
 * <p>{@code irRetained} is the income tax withheld at source on a sell, when the note states it.
 * A null value lets the ledger derive it from the configured withholding rates.
 *
 * <p>The asset code is trimmed and upper-cased on construction, so "petr4 " and "PETR4" are the
 * same position.
 */
@Value
public class Operation {

    String id;

    @NotBlank
    String assetCode;

    @NotNull
    AssetType assetType;

    @NotNull
    TradeCategory tradeCategory;

    @NotNull
    OperationType operationType;

    @NotNull
    @Positive
    BigDecimal quantity;

    @NotNull
    @Positive
    BigDecimal unitPrice;

    @NotNull
    @PositiveOrZero
    BigDecimal totalCost;

    @NotNull
    LocalDate operationDate;

    @PositiveOrZero
    BigDecimal irRetained;

    LocalDateTime createdAt;

    @Builder(toBuilder = true)
    public Operation(
            String id,
            String assetCode,
            AssetType assetType,
            TradeCategory tradeCategory,
            OperationType operationType,
            BigDecimal quantity,
            BigDecimal unitPrice,
            BigDecimal totalCost,
            LocalDate operationDate,
            BigDecimal irRetained,
            LocalDateTime createdAt) {
        this.id = id;
        this.assetCode = normalizeAssetCode(assetCode);
        this.assetType = assetType;
        this.tradeCategory = tradeCategory;
        this.operationType = operationType;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.totalCost = totalCost;
        this.operationDate = operationDate;
        this.irRetained = irRetained;
        this.createdAt = createdAt;
    }

    public boolean isBuy() {
        return operationType == OperationType.BUY;
    }

    /** Gross sale value: quantity * unit price. Fees never reduce proceeds. */
    public BigDecimal grossValue() {
        return quantity.multiply(unitPrice);
    }

    public static String normalizeAssetCode(String assetCode) {
        return assetCode == null ? null : assetCode.trim().toUpperCase(Locale.ROOT);
    }
}
