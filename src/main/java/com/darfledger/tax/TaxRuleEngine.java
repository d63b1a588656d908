package com.darfledger.tax;

import com.darfledger.domain.model.LossCarryState;
import com.darfledger.domain.model.MonthlyBucket;
import com.darfledger.domain.model.TaxComputation;
import com.darfledger.domain.vo.Lane;
import com.darfledger.exception.ConfigurationException;
import com.darfledger.exception.OrderingViolationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies exemption, rate and loss carryforward rules to monthly buckets.
 *
 * <p>Each lane (asset type, trade category) is an independent fold over its months in
 * ascending order, threading an immutable {@link LossCarryState} from one month to the next.
 * Per bucket:
 * <ol>
 *   <li>Rate: the lane's schedule from the regime in force for the month. A missing rate is a
 *       {@link ConfigurationException}, never a zero rate.</li>
 *   <li>Exemption: a lane with a configured threshold is exempt in a month where total sales
 *       are at most the threshold and the net result is a gain. The whole gain is untaxed and
 *       carried losses stay untouched. Above the threshold the whole gain is taxed.</li>
 *   <li>Gain, not exempt: carried losses absorb up to the gain; the rest is taxable.</li>
 *   <li>Loss: added to the lane's carried losses, exempt lane or not.</li>
 *   <li>taxDue = taxableProfit * rate; netTaxDue = max(0, taxDue - irRetained).</li>
 * </ol>
 *
 * <p>Withheld tax above the liability is not refunded or carried.
 */
@Service
public class TaxRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(TaxRuleEngine.class);

    private static final int MONEY_SCALE = 2;

    private static final Comparator<TaxComputation> OUTPUT_ORDER =
            Comparator.comparing(TaxComputation::getYearMonth).thenComparing(TaxComputation::getLane);

    /** Result of folding one bucket: its computation and the loss carry state after it. */
    @Value
    public static class Step {
        TaxComputation computation;
        LossCarryState lossCarry;
    }

    public TaxRun computeTaxes(List<MonthlyBucket> buckets, TaxRuleBook ruleBook) {
        return computeTaxes(buckets, ruleBook, LossCarryState.empty());
    }

    /**
     * Computes every bucket, lane by lane with months ascending.
     *
     * @param buckets     buckets of one recompute pass, in any order
     * @param ruleBook    dated tax regimes
     * @param openingCarry loss balances carried in from before the first bucket
     * @return computations sorted by month then lane, plus the closing loss balances
     * @throws ConfigurationException if a bucket's lane has no rate or its month no regime
     * @throws OrderingViolationException if a lane holds two buckets for the same month
     */
    public TaxRun computeTaxes(List<MonthlyBucket> buckets, TaxRuleBook ruleBook, LossCarryState openingCarry) {
        Map<Lane, List<MonthlyBucket>> byLane = new TreeMap<>();
        for (MonthlyBucket bucket : buckets) {
            byLane.computeIfAbsent(bucket.getLane(), lane -> new ArrayList<>()).add(bucket);
        }

        LossCarryState carry = openingCarry;
        List<TaxComputation> computations = new ArrayList<>(buckets.size());

        for (Map.Entry<Lane, List<MonthlyBucket>> lane : byLane.entrySet()) {
            List<MonthlyBucket> months = new ArrayList<>(lane.getValue());
            months.sort(Comparator.comparing(MonthlyBucket::getYearMonth));
            for (MonthlyBucket bucket : months) {
                Step step = computeBucket(bucket, ruleBook.rulesFor(bucket.getYearMonth()), carry);
                computations.add(step.getComputation());
                carry = step.getLossCarry();
            }
        }

        computations.sort(OUTPUT_ORDER);

        log.info("Computed taxes for {} buckets across {} lanes", computations.size(), byLane.size());
        return TaxRun.builder()
                .computations(List.copyOf(computations))
                .closingLossCarry(carry)
                .build();
    }

    /**
     * Folds a single bucket into the lane's loss carry state.
     *
     * @throws OrderingViolationException if the bucket's month is not after the lane's last folded month
     */
    public Step computeBucket(MonthlyBucket bucket, TaxRegime rules, LossCarryState carry) {
        Lane lane = bucket.getLane();
        BigDecimal netResult = bucket.getNetResult();
        RateSchedule schedule = rules.rateSchedule(lane);

        boolean exempt = isExempt(bucket, rules.exemptionThreshold(lane));

        BigDecimal consumed = BigDecimal.ZERO;
        BigDecimal accrued = BigDecimal.ZERO;
        BigDecimal taxableProfit = BigDecimal.ZERO;

        if (!exempt) {
            if (netResult.signum() > 0) {
                consumed = carry.balance(lane).min(netResult);
                taxableProfit = netResult.subtract(consumed);
            } else if (netResult.signum() < 0) {
                accrued = netResult.negate();
            }
        }

        BigDecimal taxRate = schedule.rateFor(taxableProfit);
        BigDecimal taxDue = exempt
                ? BigDecimal.ZERO.setScale(MONEY_SCALE)
                : taxableProfit.multiply(taxRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal irRetained = bucket.getIrRetainedTotal().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal netTaxDue = taxDue.subtract(irRetained).max(BigDecimal.ZERO.setScale(MONEY_SCALE));

        LossCarryState next = carry.fold(lane, bucket.getYearMonth(), consumed, accrued);

        TaxComputation computation = TaxComputation.builder()
                .yearMonth(bucket.getYearMonth())
                .assetType(bucket.getAssetType())
                .tradeCategory(bucket.getTradeCategory())
                .totalSales(bucket.getTotalSales())
                .netResult(netResult)
                .taxableProfit(taxableProfit)
                .taxRate(taxRate)
                .taxDue(taxDue)
                .irRetained(irRetained)
                .netTaxDue(netTaxDue)
                .exemptionApplied(exempt)
                .lossCarryConsumed(consumed)
                .lossCarryRemaining(next.balance(lane))
                .build();

        log.debug(
                "{} {}: sales={}, net={}, exempt={}, taxable={}, rate={}, due={}, net due={}, carry={}",
                bucket.getYearMonth(),
                lane,
                bucket.getTotalSales(),
                netResult,
                exempt,
                taxableProfit,
                taxRate,
                taxDue,
                netTaxDue,
                computation.getLossCarryRemaining());

        return new Step(computation, next);
    }

    private boolean isExempt(MonthlyBucket bucket, Optional<BigDecimal> threshold) {
        return threshold.isPresent()
                && bucket.getTotalSales().compareTo(threshold.get()) <= 0
                && bucket.getNetResult().signum() > 0;
    }
}
