package com.darfledger.reporting;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Portfolio totals for the dashboard. Open positions are valued at average cost; the ledger
 * has no market prices.
 */
@Value
@Builder
public class PortfolioSummary {

    /** Sum of total cost over every buy, fees included. */
    BigDecimal totalInvested;

    /** Held quantity times average cost, over open positions. */
    BigDecimal totalPositionValue;

    BigDecimal totalRealizedGainLoss;

    /** Realized gain/loss as a percentage of totalInvested; zero when nothing was invested. */
    BigDecimal profitLossPercentage;

    /** Asset code to position value at cost, open positions only, sorted by code. */
    Map<String, BigDecimal> assetsDistribution;

    int openPositions;
}
