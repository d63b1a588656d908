package com.darfledger.domain.model;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.vo.Lane;
import java.math.BigDecimal;
import java.time.YearMonth;
import lombok.Builder;
import lombok.Value;

/**
 * Tax outcome for one monthly bucket.
 *
 * <ul>
 *   <li>taxableProfit: net result after loss carryforward, never negative</li>
 *   <li>taxDue: taxableProfit * taxRate, zero when the month is exempt</li>
 *   <li>netTaxDue: max(0, taxDue - irRetained), the amount payable through DARF</li>
 *   <li>lossCarryRemaining: lane loss balance after this month</li>
 * </ul>
 */
@Value
@Builder
public class TaxComputation {

    YearMonth yearMonth;
    AssetType assetType;
    TradeCategory tradeCategory;
    BigDecimal totalSales;
    BigDecimal netResult;
    BigDecimal taxableProfit;
    BigDecimal taxRate;
    BigDecimal taxDue;
    BigDecimal irRetained;
    BigDecimal netTaxDue;
    boolean exemptionApplied;
    BigDecimal lossCarryConsumed;
    BigDecimal lossCarryRemaining;

    public Lane getLane() {
        return Lane.of(assetType, tradeCategory);
    }
}
