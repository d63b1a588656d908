package com.darfledger.reporting;

import com.darfledger.domain.model.Position;
import com.darfledger.ledger.RecomputeResult;
import com.darfledger.repository.LedgerSnapshotRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Summarizes positions of a recompute pass into portfolio totals. */
@Service
public class PortfolioSummaryCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final LedgerSnapshotRepository snapshotRepository;

    public PortfolioSummaryCalculator(LedgerSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    /** Summary of the published snapshot; all zeros before the first recompute. */
    public PortfolioSummary currentSummary() {
        return snapshotRepository
                .current()
                .map(snapshot -> summarize(snapshot.getRecompute()))
                .orElseGet(PortfolioSummaryCalculator::empty);
    }

    public PortfolioSummary summarize(RecomputeResult result) {
        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal positionValue = BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;
        Map<String, BigDecimal> distribution = new LinkedHashMap<>();

        for (Position position : result.getPositions().values()) {
            invested = invested.add(position.getTotalInvested());
            realized = realized.add(position.getRealizedGainLoss());
            if (position.isOpen()) {
                BigDecimal value = position.getCostValue().setScale(2, RoundingMode.HALF_UP);
                positionValue = positionValue.add(value);
                distribution.put(position.getAssetCode(), value);
            }
        }

        BigDecimal percentage = invested.signum() > 0
                ? realized.multiply(HUNDRED).divide(invested, 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return PortfolioSummary.builder()
                .totalInvested(invested.setScale(2, RoundingMode.HALF_UP))
                .totalPositionValue(positionValue.setScale(2, RoundingMode.HALF_UP))
                .totalRealizedGainLoss(realized.setScale(2, RoundingMode.HALF_UP))
                .profitLossPercentage(percentage)
                .assetsDistribution(Collections.unmodifiableMap(distribution))
                .openPositions(distribution.size())
                .build();
    }

    private static PortfolioSummary empty() {
        return PortfolioSummary.builder()
                .totalInvested(BigDecimal.ZERO)
                .totalPositionValue(BigDecimal.ZERO)
                .totalRealizedGainLoss(BigDecimal.ZERO)
                .profitLossPercentage(BigDecimal.ZERO)
                .assetsDistribution(Map.of())
                .openPositions(0)
                .build();
    }
}
