package com.darfledger.reporting;

import com.darfledger.domain.model.TaxComputation;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * DARF summary of one month.
 *
 * <p>Key fields:
 * <ul>
 *   <li>items: one computation per lane that had sells in the month</li>
 *   <li>totalDue: sum of netTaxDue, the amount to pay</li>
 *   <li>totalTaxDue: sum of taxDue before withheld tax</li>
 *   <li>totalIrRetained: sum of tax withheld at source</li>
 *   <li>computedAt: when the underlying ledger snapshot was computed; null if none exists yet</li>
 * </ul>
 */
@Value
@Builder
public class DarfReport {

    YearMonth yearMonth;
    List<TaxComputation> items;
    BigDecimal totalDue;
    BigDecimal totalTaxDue;
    BigDecimal totalIrRetained;
    Instant computedAt;

    public boolean hasObligation() {
        return totalDue.signum() > 0;
    }
}
