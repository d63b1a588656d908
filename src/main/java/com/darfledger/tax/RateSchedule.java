package com.darfledger.tax;

import com.darfledger.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Tax rate of one lane. Either a flat rate, or progressive brackets selected by the month's
 * taxable profit and applied to the whole profit (crypto gains follow this scheme).
 */
@Value
public class RateSchedule {

    BigDecimal flatRate;
    List<Bracket> brackets;

    /** A rate that applies while taxable profit is at most {@code upTo}; null means no upper bound. */
    @Value
    @Builder
    public static class Bracket {
        BigDecimal upTo;
        BigDecimal rate;
    }

    private RateSchedule(BigDecimal flatRate, List<Bracket> brackets) {
        this.flatRate = flatRate;
        this.brackets = brackets;
    }

    public static RateSchedule flat(BigDecimal rate) {
        checkRate(rate);
        return new RateSchedule(rate, List.of());
    }

    /**
     * Builds a bracketed schedule. Brackets must be listed by ascending bound and the last one
     * must be open-ended, so every profit resolves to exactly one rate.
     */
    public static RateSchedule progressive(List<Bracket> brackets) {
        if (brackets.isEmpty()) {
            throw new ConfigurationException("Progressive rate schedule needs at least one bracket");
        }
        BigDecimal previousBound = null;
        for (int i = 0; i < brackets.size(); i++) {
            Bracket bracket = brackets.get(i);
            checkRate(bracket.getRate());
            boolean last = i == brackets.size() - 1;
            if (bracket.getUpTo() == null && !last) {
                throw new ConfigurationException("Only the last bracket may be open-ended");
            }
            if (last && bracket.getUpTo() != null) {
                throw new ConfigurationException("The last bracket must be open-ended");
            }
            if (bracket.getUpTo() != null) {
                if (previousBound != null && bracket.getUpTo().compareTo(previousBound) <= 0) {
                    throw new ConfigurationException("Bracket bounds must be strictly ascending");
                }
                previousBound = bracket.getUpTo();
            }
        }
        return new RateSchedule(null, List.copyOf(brackets));
    }

    public boolean isProgressive() {
        return !brackets.isEmpty();
    }

    /** Rate that applies to a month whose taxable profit is {@code taxableProfit}. */
    public BigDecimal rateFor(BigDecimal taxableProfit) {
        if (!isProgressive()) {
            return flatRate;
        }
        for (Bracket bracket : brackets) {
            if (bracket.getUpTo() == null || taxableProfit.compareTo(bracket.getUpTo()) <= 0) {
                return bracket.getRate();
            }
        }
        // unreachable: the last bracket is open-ended
        return brackets.get(brackets.size() - 1).getRate();
    }

    private static void checkRate(BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException("Tax rate must be between 0 and 1, got " + rate);
        }
    }
}
