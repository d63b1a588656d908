package com.darfledger.tax;

import com.darfledger.exception.ConfigurationException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Dated history of tax regimes. A month is taxed under the latest regime whose
 * {@code effectiveFrom} is on or before the first day of that month, so a 2023 sale keeps the
 * rules of 2023 when the ledger is recomputed later.
 */
public class TaxRuleBook {

    private final NavigableMap<LocalDate, TaxRegime> regimes;

    public TaxRuleBook(Collection<TaxRegime> regimes) {
        if (regimes.isEmpty()) {
            throw new ConfigurationException("At least one tax regime must be configured");
        }
        TreeMap<LocalDate, TaxRegime> byDate = new TreeMap<>();
        for (TaxRegime regime : regimes) {
            if (byDate.put(regime.getEffectiveFrom(), regime) != null) {
                throw new ConfigurationException(
                        "Two tax regimes start on the same date",
                        Map.of("effectiveFrom", regime.getEffectiveFrom().toString()));
            }
        }
        this.regimes = byDate;
    }

    /**
     * @throws ConfigurationException if the month precedes every configured regime
     */
    public TaxRegime rulesFor(YearMonth month) {
        Map.Entry<LocalDate, TaxRegime> entry = regimes.floorEntry(month.atDay(1));
        if (entry == null) {
            throw new ConfigurationException(
                    "No tax regime in force for " + month, Map.of("month", month.toString()));
        }
        return entry.getValue();
    }

    public int size() {
        return regimes.size();
    }
}
