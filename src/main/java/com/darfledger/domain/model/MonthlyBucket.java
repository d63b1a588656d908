package com.darfledger.domain.model;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.vo.Lane;
import java.math.BigDecimal;
import java.time.YearMonth;
import lombok.Builder;
import lombok.Value;

/**
 * Sells of one lane within one calendar month. Months without sells have no bucket, and
 * "no bucket" means "no obligation".
 */
@Value
@Builder
public class MonthlyBucket {

    YearMonth yearMonth;
    AssetType assetType;
    TradeCategory tradeCategory;

    /** Sum of sell proceeds. */
    BigDecimal totalSales;

    /** Sum of realized gain/loss; negative for a losing month. */
    BigDecimal netResult;

    BigDecimal irRetainedTotal;
    int salesCount;

    public Lane getLane() {
        return Lane.of(assetType, tradeCategory);
    }
}
