package com.darfledger.domain.model;

import com.darfledger.domain.enums.AssetType;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running weighted-average cost position for one asset code.
 *
 * <p>Mutable, and owned by a single recompute pass of the PositionTracker. Published results
 * only ever contain copies made with {@link #copy()}.
 *
 * <p>{@code averageUnitCost} moves only on buys. A sell reduces {@code heldQuantity} and
 * leaves the average of the remaining units untouched. A position that is sold out stays in
 * the map with zero quantity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String assetCode;
    private AssetType assetType;

    @Builder.Default
    private BigDecimal heldQuantity = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal averageUnitCost = BigDecimal.ZERO;

    /** Sum of total cost over every buy, fees included. */
    @Builder.Default
    private BigDecimal totalInvested = BigDecimal.ZERO;

    /** Sum of gain/loss over every sell. */
    @Builder.Default
    private BigDecimal realizedGainLoss = BigDecimal.ZERO;

    public static Position open(String assetCode, AssetType assetType) {
        return Position.builder().assetCode(assetCode).assetType(assetType).build();
    }

    public boolean isOpen() {
        return heldQuantity.signum() > 0;
    }

    /** Held units valued at average cost. */
    public BigDecimal getCostValue() {
        return heldQuantity.multiply(averageUnitCost);
    }

    public Position copy() {
        return Position.builder()
                .assetCode(assetCode)
                .assetType(assetType)
                .heldQuantity(heldQuantity)
                .averageUnitCost(averageUnitCost)
                .totalInvested(totalInvested)
                .realizedGainLoss(realizedGainLoss)
                .build();
    }
}
