package com.darfledger.domain.vo;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import java.util.Comparator;
import lombok.Value;

/**
 * Tax lane: the (asset type, trade category) pair that owns a rate, an optional exemption
 * threshold and its own loss carryforward balance.
 */
@Value(staticConstructor = "of")
public class Lane implements Comparable<Lane> {

    private static final Comparator<Lane> ORDER =
            Comparator.comparing(Lane::getAssetType).thenComparing(Lane::getTradeCategory);

    AssetType assetType;
    TradeCategory tradeCategory;

    @Override
    public int compareTo(Lane other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return assetType.getCode() + "/" + tradeCategory.getCode();
    }
}
