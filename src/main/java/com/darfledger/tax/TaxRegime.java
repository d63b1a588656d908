package com.darfledger.tax;

import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.vo.Lane;
import com.darfledger.exception.ConfigurationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Rates and exemption thresholds in force from {@code effectiveFrom} until the next regime.
 *
 * <p>Only lanes listed in {@code exemptionThresholds} can ever be exempt. Day-trade lanes are
 * rejected there: day-trade gains are always taxed.
 */
@Getter
public class TaxRegime {

    private final LocalDate effectiveFrom;
    private final Map<Lane, RateSchedule> rates;
    private final Map<Lane, BigDecimal> exemptionThresholds;

    public TaxRegime(
            LocalDate effectiveFrom, Map<Lane, RateSchedule> rates, Map<Lane, BigDecimal> exemptionThresholds) {
        if (effectiveFrom == null) {
            throw new ConfigurationException("Tax regime is missing its effective-from date");
        }
        exemptionThresholds.forEach((lane, threshold) -> {
            if (lane.getTradeCategory() == TradeCategory.DAY_TRADE) {
                throw new ConfigurationException(
                        "Day-trade lanes cannot have an exemption threshold",
                        Map.of("lane", lane.toString(), "effectiveFrom", effectiveFrom.toString()));
            }
            if (threshold == null || threshold.signum() < 0) {
                throw new ConfigurationException(
                        "Exemption threshold must be zero or positive",
                        Map.of("lane", lane.toString(), "effectiveFrom", effectiveFrom.toString()));
            }
        });
        this.effectiveFrom = effectiveFrom;
        this.rates = Collections.unmodifiableMap(new TreeMap<>(rates));
        this.exemptionThresholds = Collections.unmodifiableMap(new TreeMap<>(exemptionThresholds));
    }

    /**
     * @throws ConfigurationException if no rate is configured for the lane
     */
    public RateSchedule rateSchedule(Lane lane) {
        RateSchedule schedule = rates.get(lane);
        if (schedule == null) {
            throw new ConfigurationException(
                    "No tax rate configured for " + lane,
                    Map.of("lane", lane.toString(), "effectiveFrom", effectiveFrom.toString()));
        }
        return schedule;
    }

    public Optional<BigDecimal> exemptionThreshold(Lane lane) {
        return Optional.ofNullable(exemptionThresholds.get(lane));
    }
}
