package com.darfledger.fixtures;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.OperationType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.Operation;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Builders for operations used across ledger tests. Amounts are given as strings. */
public final class OperationFixtures {

    private OperationFixtures() {}

    public static Operation buy(
            String id,
            String assetCode,
            AssetType assetType,
            TradeCategory category,
            String quantity,
            String unitPrice,
            String totalCost,
            LocalDate date) {
        return Operation.builder()
                .id(id)
                .assetCode(assetCode)
                .assetType(assetType)
                .tradeCategory(category)
                .operationType(OperationType.BUY)
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(unitPrice))
                .totalCost(new BigDecimal(totalCost))
                .operationDate(date)
                .build();
    }

    public static Operation sell(
            String id,
            String assetCode,
            AssetType assetType,
            TradeCategory category,
            String quantity,
            String unitPrice,
            LocalDate date) {
        BigDecimal qty = new BigDecimal(quantity);
        BigDecimal price = new BigDecimal(unitPrice);
        return Operation.builder()
                .id(id)
                .assetCode(assetCode)
                .assetType(assetType)
                .tradeCategory(category)
                .operationType(OperationType.SELL)
                .quantity(qty)
                .unitPrice(price)
                .totalCost(qty.multiply(price))
                .operationDate(date)
                .build();
    }

    /** Swing-trade stock buy with no fees. */
    public static Operation stockBuy(String id, String assetCode, String quantity, String unitPrice, LocalDate date) {
        String totalCost = new BigDecimal(quantity).multiply(new BigDecimal(unitPrice)).toPlainString();
        return buy(id, assetCode, AssetType.STOCK, TradeCategory.SWING_TRADE, quantity, unitPrice, totalCost, date);
    }

    public static Operation stockSell(String id, String assetCode, String quantity, String unitPrice, LocalDate date) {
        return sell(id, assetCode, AssetType.STOCK, TradeCategory.SWING_TRADE, quantity, unitPrice, date);
    }
}
