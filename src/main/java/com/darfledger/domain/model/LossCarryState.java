package com.darfledger.domain.model;

import com.darfledger.domain.vo.Lane;
import com.darfledger.exception.OrderingViolationException;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Unabsorbed losses per lane, carried from month to month.
 *
 * <p>Immutable: every {@link #fold} returns a new state, so one recompute pass threads an
 * explicit accumulator through its buckets and concurrent passes never share a balance.
 * Balances are never negative.
 *
 * <p>The state also remembers the last month folded for each lane. Folding a month that is
 * not strictly after it raises {@link OrderingViolationException}: loss carryforward is
 * sequential and a replayed or reordered month would double count.
 */
public final class LossCarryState {

    private static final LossCarryState EMPTY = new LossCarryState(new TreeMap<>(), new TreeMap<>());

    private final Map<Lane, BigDecimal> balances;
    private final Map<Lane, YearMonth> lastFolded;

    private LossCarryState(TreeMap<Lane, BigDecimal> balances, TreeMap<Lane, YearMonth> lastFolded) {
        this.balances = Collections.unmodifiableMap(balances);
        this.lastFolded = Collections.unmodifiableMap(lastFolded);
    }

    public static LossCarryState empty() {
        return EMPTY;
    }

    /** Seeds balances, e.g. losses declared before the first recorded operation. */
    public static LossCarryState of(Map<Lane, BigDecimal> openingBalances) {
        TreeMap<Lane, BigDecimal> balances = new TreeMap<>();
        openingBalances.forEach((lane, amount) -> {
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("Opening loss balance must not be negative for " + lane);
            }
            balances.put(lane, amount);
        });
        return new LossCarryState(balances, new TreeMap<>());
    }

    public BigDecimal balance(Lane lane) {
        return balances.getOrDefault(lane, BigDecimal.ZERO);
    }

    public Optional<YearMonth> lastFolded(Lane lane) {
        return Optional.ofNullable(lastFolded.get(lane));
    }

    /**
     * Records one month of a lane: {@code consumed} leaves the balance, {@code accrued} joins it.
     *
     * @throws OrderingViolationException if {@code month} is not after the lane's last folded month
     * @throws IllegalArgumentException if an amount is negative or more is consumed than carried
     */
    public LossCarryState fold(Lane lane, YearMonth month, BigDecimal consumed, BigDecimal accrued) {
        YearMonth previous = lastFolded.get(lane);
        if (previous != null && !month.isAfter(previous)) {
            throw new OrderingViolationException(
                    String.format("Lane %s folded out of order: %s after %s", lane, month, previous),
                    Map.of("lane", lane.toString(), "month", month.toString(), "lastFolded", previous.toString()));
        }
        if (consumed.signum() < 0 || accrued.signum() < 0) {
            throw new IllegalArgumentException("Loss carry movements must not be negative");
        }

        BigDecimal current = balance(lane);
        if (consumed.compareTo(current) > 0) {
            throw new IllegalArgumentException(
                    "Cannot consume " + consumed.toPlainString() + " from a balance of " + current.toPlainString());
        }

        TreeMap<Lane, BigDecimal> nextBalances = new TreeMap<>(balances);
        nextBalances.put(lane, current.subtract(consumed).add(accrued));
        TreeMap<Lane, YearMonth> nextFolded = new TreeMap<>(lastFolded);
        nextFolded.put(lane, month);
        return new LossCarryState(nextBalances, nextFolded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LossCarryState other)) {
            return false;
        }
        return balances.equals(other.balances) && lastFolded.equals(other.lastFolded);
    }

    @Override
    public int hashCode() {
        return balances.hashCode() * 31 + lastFolded.hashCode();
    }

    @Override
    public String toString() {
        return "LossCarryState" + balances;
    }
}
