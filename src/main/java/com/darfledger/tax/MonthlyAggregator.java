package com.darfledger.tax;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.MonthlyBucket;
import com.darfledger.domain.model.RealizedResult;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Groups realized sell results into one {@link MonthlyBucket} per
 * (year, month, asset type, trade category).
 *
 * <p>Buckets come out sorted by month, then asset type, then category. A lane with no sells in
 * a month has no bucket at all; it is never materialized with zero totals.
 */
@Service
public class MonthlyAggregator {

    private static final Logger log = LoggerFactory.getLogger(MonthlyAggregator.class);

    private static final Comparator<BucketKey> KEY_ORDER = Comparator.comparing(BucketKey::yearMonth)
            .thenComparing(BucketKey::assetType)
            .thenComparing(BucketKey::tradeCategory);

    public List<MonthlyBucket> aggregate(List<RealizedResult> realized) {
        Map<BucketKey, Totals> grouped = new TreeMap<>(KEY_ORDER);

        for (RealizedResult result : realized) {
            BucketKey key = new BucketKey(result.getYearMonth(), result.getAssetType(), result.getTradeCategory());
            grouped.computeIfAbsent(key, k -> new Totals()).add(result);
        }

        List<MonthlyBucket> buckets = grouped.entrySet().stream()
                .map(entry -> MonthlyBucket.builder()
                        .yearMonth(entry.getKey().yearMonth())
                        .assetType(entry.getKey().assetType())
                        .tradeCategory(entry.getKey().tradeCategory())
                        .totalSales(entry.getValue().totalSales)
                        .netResult(entry.getValue().netResult)
                        .irRetainedTotal(entry.getValue().irRetained)
                        .salesCount(entry.getValue().count)
                        .build())
                .toList();

        log.debug("Aggregated {} realized results into {} monthly buckets", realized.size(), buckets.size());
        return buckets;
    }

    private record BucketKey(YearMonth yearMonth, AssetType assetType, TradeCategory tradeCategory) {}

    private static final class Totals {
        private BigDecimal totalSales = BigDecimal.ZERO;
        private BigDecimal netResult = BigDecimal.ZERO;
        private BigDecimal irRetained = BigDecimal.ZERO;
        private int count;

        void add(RealizedResult result) {
            totalSales = totalSales.add(result.getProceeds());
            netResult = netResult.add(result.getGainLoss());
            if (result.getIrRetained() != null) {
                irRetained = irRetained.add(result.getIrRetained());
            }
            count++;
        }
    }
}
