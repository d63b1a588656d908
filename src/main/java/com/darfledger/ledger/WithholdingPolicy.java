package com.darfledger.ledger;

import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.Operation;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Income tax withheld at source on a sell ("dedo-duro").
 *
 * <p>A withheld amount stated on the operation always wins. Otherwise:
 * <ul>
 *   <li><b>Day-trade:</b> {@code dayTradeGainRate} of a positive gain, nothing on a loss</li>
 *   <li><b>Swing-trade:</b> {@code swingTradeSalesRate} of the sale value</li>
 * </ul>
 */
public class WithholdingPolicy {

    private final BigDecimal dayTradeGainRate;
    private final BigDecimal swingTradeSalesRate;

    public WithholdingPolicy(BigDecimal dayTradeGainRate, BigDecimal swingTradeSalesRate) {
        this.dayTradeGainRate = dayTradeGainRate != null ? dayTradeGainRate : BigDecimal.ZERO;
        this.swingTradeSalesRate = swingTradeSalesRate != null ? swingTradeSalesRate : BigDecimal.ZERO;
    }

    public static WithholdingPolicy none() {
        return new WithholdingPolicy(BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal retainedOn(Operation sell, BigDecimal proceeds, BigDecimal gainLoss) {
        if (sell.getIrRetained() != null) {
            return sell.getIrRetained();
        }
        BigDecimal retained;
        if (sell.getTradeCategory() == TradeCategory.DAY_TRADE) {
            retained = gainLoss.signum() > 0 ? gainLoss.multiply(dayTradeGainRate) : BigDecimal.ZERO;
        } else {
            retained = proceeds.multiply(swingTradeSalesRate);
        }
        return retained.setScale(2, RoundingMode.HALF_UP);
    }
}
