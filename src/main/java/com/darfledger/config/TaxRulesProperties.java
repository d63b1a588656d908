package com.darfledger.config;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

/**
 * Tax law as configuration, loaded from application.properties.
 *
 * <p>Properties prefix: {@code darf.tax.*}. Each regime is dated so historical months keep
 * the rules they were filed under:
 * <pre>
 * darf.tax.regimes[0].effective-from=2016-01-01
 * darf.tax.regimes[0].rates[0].asset-type=stock
 * darf.tax.regimes[0].rates[0].trade-category=swing-trade
 * darf.tax.regimes[0].rates[0].rate=0.15
 * darf.tax.regimes[0].exemptions[0].asset-type=stock
 * darf.tax.regimes[0].exemptions[0].trade-category=swing-trade
 * darf.tax.regimes[0].exemptions[0].monthly-threshold=20000.00
 * </pre>
 *
 * <p>No rate has a built-in default. A lane without a configured rate fails the computation.
 */
@Data
@ConfigurationProperties(prefix = "darf.tax")
public class TaxRulesProperties {

    private List<Regime> regimes = new ArrayList<>();

    private Withholding withholding = new Withholding();

    @Data
    public static class Regime {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate effectiveFrom;

        private List<RateEntry> rates = new ArrayList<>();

        private List<ExemptionEntry> exemptions = new ArrayList<>();
    }

    @Data
    public static class RateEntry {

        private AssetType assetType;
        private TradeCategory tradeCategory;

        /** Flat rate as a fraction (0.15 = 15%). Ignored when brackets are present. */
        private BigDecimal rate;

        private List<BracketEntry> brackets = new ArrayList<>();
    }

    @Data
    public static class BracketEntry {

        /** Upper bound of taxable profit for this bracket; leave unset on the last one. */
        private BigDecimal upTo;

        private BigDecimal rate;
    }

    @Data
    public static class ExemptionEntry {

        private AssetType assetType;
        private TradeCategory tradeCategory;
        private BigDecimal monthlyThreshold;
    }

    /**
     * Withholding applied to sells whose note does not state the retained tax.
     * Day-trade is withheld on the gain, swing-trade on the sale value.
     */
    @Data
    public static class Withholding {

        private BigDecimal dayTradeGainRate = BigDecimal.ZERO;
        private BigDecimal swingTradeSalesRate = BigDecimal.ZERO;
    }
}
