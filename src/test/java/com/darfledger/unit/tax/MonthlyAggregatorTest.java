package com.darfledger.unit.tax;

import static org.assertj.core.api.Assertions.assertThat;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.model.MonthlyBucket;
import com.darfledger.domain.model.RealizedResult;
import com.darfledger.tax.MonthlyAggregator;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MonthlyAggregatorTest {

    private final MonthlyAggregator monthlyAggregator = new MonthlyAggregator();

    @Test
    @DisplayName("Sells of the same month and lane are summed into one bucket")
    void sumsWithinBucket() {
        List<MonthlyBucket> buckets = monthlyAggregator.aggregate(List.of(
                realized("PETR4", AssetType.STOCK, TradeCategory.SWING_TRADE, LocalDate.of(2025, 1, 5), "12000", "800", "0"),
                realized("VALE3", AssetType.STOCK, TradeCategory.SWING_TRADE, LocalDate.of(2025, 1, 28), "9000", "-300", "0.45")));

        assertThat(buckets).hasSize(1);
        MonthlyBucket bucket = buckets.get(0);
        assertThat(bucket.getYearMonth()).isEqualTo(YearMonth.of(2025, 1));
        assertThat(bucket.getTotalSales()).isEqualByComparingTo("21000");
        assertThat(bucket.getNetResult()).isEqualByComparingTo("500");
        assertThat(bucket.getIrRetainedTotal()).isEqualByComparingTo("0.45");
        assertThat(bucket.getSalesCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Months, asset types and categories split buckets and come out sorted")
    void splitsAndSorts() {
        List<MonthlyBucket> buckets = monthlyAggregator.aggregate(List.of(
                realized("HGLG11", AssetType.REAL_ESTATE_FUND, TradeCategory.SWING_TRADE, LocalDate.of(2025, 2, 3), "1000", "10", "0"),
                realized("PETR4", AssetType.STOCK, TradeCategory.DAY_TRADE, LocalDate.of(2025, 2, 3), "1000", "10", "0.10"),
                realized("PETR4", AssetType.STOCK, TradeCategory.SWING_TRADE, LocalDate.of(2025, 1, 30), "1000", "10", "0"),
                realized("PETR4", AssetType.STOCK, TradeCategory.SWING_TRADE, LocalDate.of(2025, 2, 1), "1000", "10", "0")));

        assertThat(buckets).extracting(MonthlyBucket::getYearMonth).containsExactly(
                YearMonth.of(2025, 1), YearMonth.of(2025, 2), YearMonth.of(2025, 2), YearMonth.of(2025, 2));
        assertThat(buckets.subList(1, 4))
                .extracting(b -> b.getLane().toString())
                .containsExactly("acao/swing_trade", "acao/day_trade", "fii/swing_trade");
    }

    @Test
    @DisplayName("No sells means no buckets")
    void empty() {
        assertThat(monthlyAggregator.aggregate(List.of())).isEmpty();
    }

    // ---- Helpers ----

    private static RealizedResult realized(
            String code, AssetType type, TradeCategory category, LocalDate date, String proceeds, String gain, String retained) {
        return RealizedResult.builder()
                .operationId(code + "-" + date)
                .assetCode(code)
                .assetType(type)
                .tradeCategory(category)
                .operationDate(date)
                .quantity(BigDecimal.ONE)
                .proceeds(new BigDecimal(proceeds))
                .costBasisConsumed(new BigDecimal(proceeds).subtract(new BigDecimal(gain)))
                .gainLoss(new BigDecimal(gain))
                .irRetained(new BigDecimal(retained))
                .build();
    }
}
