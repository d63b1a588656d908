package com.darfledger.config;

import com.darfledger.domain.enums.AssetType;
import com.darfledger.domain.enums.TradeCategory;
import com.darfledger.domain.vo.Lane;
import com.darfledger.exception.ConfigurationException;
import com.darfledger.ledger.WithholdingPolicy;
import com.darfledger.tax.RateSchedule;
import com.darfledger.tax.TaxRegime;
import com.darfledger.tax.TaxRuleBook;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns {@link TaxRulesProperties} into the validated {@link TaxRuleBook} and
 * {@link WithholdingPolicy} beans. Inconsistent configuration fails at startup with a
 * {@link ConfigurationException} rather than at the first DARF computation.
 */
@Configuration
@EnableConfigurationProperties(TaxRulesProperties.class)
public class TaxRuleConfig {

    private static final Logger log = LoggerFactory.getLogger(TaxRuleConfig.class);

    @Bean
    public TaxRuleBook taxRuleBook(TaxRulesProperties properties) {
        TaxRuleBook ruleBook = toRuleBook(properties);
        log.info("Loaded {} tax regime(s)", ruleBook.size());
        return ruleBook;
    }

    @Bean
    public WithholdingPolicy withholdingPolicy(TaxRulesProperties properties) {
        TaxRulesProperties.Withholding withholding = properties.getWithholding();
        return new WithholdingPolicy(withholding.getDayTradeGainRate(), withholding.getSwingTradeSalesRate());
    }

    public static TaxRuleBook toRuleBook(TaxRulesProperties properties) {
        List<TaxRegime> regimes = properties.getRegimes().stream()
                .map(TaxRuleConfig::toRegime)
                .toList();
        return new TaxRuleBook(regimes);
    }

    static TaxRegime toRegime(TaxRulesProperties.Regime regime) {
        Map<Lane, RateSchedule> rates = new HashMap<>();
        for (TaxRulesProperties.RateEntry entry : regime.getRates()) {
            Lane lane = laneOf(entry.getAssetType(), entry.getTradeCategory(), regime);
            if (rates.put(lane, toSchedule(entry)) != null) {
                throw new ConfigurationException(
                        "Duplicate rate entry for " + lane, Map.of("lane", lane.toString()));
            }
        }

        Map<Lane, BigDecimal> thresholds = new HashMap<>();
        for (TaxRulesProperties.ExemptionEntry entry : regime.getExemptions()) {
            Lane lane = laneOf(entry.getAssetType(), entry.getTradeCategory(), regime);
            if (thresholds.put(lane, entry.getMonthlyThreshold()) != null) {
                throw new ConfigurationException(
                        "Duplicate exemption entry for " + lane, Map.of("lane", lane.toString()));
            }
        }

        return new TaxRegime(regime.getEffectiveFrom(), rates, thresholds);
    }

    private static RateSchedule toSchedule(TaxRulesProperties.RateEntry entry) {
        if (entry.getBrackets().isEmpty()) {
            return RateSchedule.flat(entry.getRate());
        }
        List<RateSchedule.Bracket> brackets = entry.getBrackets().stream()
                .map(b -> RateSchedule.Bracket.builder()
                        .upTo(b.getUpTo())
                        .rate(b.getRate())
                        .build())
                .toList();
        return RateSchedule.progressive(brackets);
    }

    private static Lane laneOf(
            AssetType assetType, TradeCategory tradeCategory, TaxRulesProperties.Regime regime) {
        if (assetType == null || tradeCategory == null) {
            throw new ConfigurationException(
                    "Tax rule entry is missing its asset type or trade category",
                    Map.of("effectiveFrom", String.valueOf(regime.getEffectiveFrom())));
        }
        return Lane.of(assetType, tradeCategory);
    }
}
