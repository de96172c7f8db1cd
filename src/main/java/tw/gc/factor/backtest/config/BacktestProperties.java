package tw.gc.factor.backtest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.factor.backtest.enums.RebalanceCadence;
import tw.gc.factor.backtest.exceptions.BacktestConfigurationException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Externalized settings bound from {@code backtest.*}. Converted into an immutable
 * {@link BacktestConfig} through {@link #toConfig()}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    /**
     * Run a backtest on application startup
     */
    private boolean enabled = false;

    /**
     * ISO dates (yyyy-MM-dd)
     */
    private String startDate;
    private String endDate;

    private List<String> universe = new ArrayList<>();
    private String cadence = "monthly";
    private int topN = BacktestConfig.DEFAULT_TOP_N;
    private double initialCapital = BacktestConfig.DEFAULT_INITIAL_CAPITAL;
    private double transactionCostRate = BacktestConfig.DEFAULT_TRANSACTION_COST_RATE;
    private double cashReservePct = BacktestConfig.DEFAULT_CASH_RESERVE_PCT;
    private double scoreDeteriorationPoints = BacktestConfig.DEFAULT_SCORE_DETERIORATION_POINTS;
    private String benchmarkSymbol = BacktestConfig.DEFAULT_BENCHMARK;
    private double riskFreeRate = BacktestConfig.DEFAULT_RISK_FREE_RATE;
    private int periodsPerYear = BacktestConfig.DEFAULT_PERIODS_PER_YEAR;
    private int scoringParallelism = 4;
    private Duration scoringTimeout = Duration.ofSeconds(30);

    private Weights weights = new Weights();
    @Data
    public static class Weights {
        private boolean adaptive = false;
        private double fundamentals = 0.40;
        private double momentum = 0.30;
        private double quality = 0.20;
        private double sentiment = 0.10;
    }

    private Risk risk = new Risk();
    @Data
    public static class Risk {
        private boolean enabled = true;
        private double highQualityMinScore = 70.0;
        private double mediumQualityMinScore = 50.0;
        private double highQualityStopPct = 0.30;
        private double mediumQualityStopPct = 0.20;
        private double lowQualityStopPct = 0.10;
        private double trailingStopPct = 0.20;
        private double maxPortfolioDrawdownPct = 0.12;
        private double drawdownLiquidationFraction = 0.50;
        private double highVolatilityThreshold = 0.35;
        private double volatilityStopMultiplier = 1.2;
        private int volatilityLookbackTicks = 60;
    }

    private Veto veto = new Veto();
    @Data
    public static class Veto {
        private double hardFloor = 45.0;
        private double softMomentum = 50.0;
        private double softFundamentals = 45.0;
        private Set<String> exemptSymbols = new LinkedHashSet<>(MomentumVetoRules.MEGA_CAP_EXEMPTIONS);
    }

    private ReEntry reEntry = new ReEntry();
    @Data
    public static class ReEntry {
        private double fundamentalsThreshold = 65.0;
        private int lookbackDays = 90;
    }

    private Conviction conviction = new Conviction();
    @Data
    public static class Conviction {
        private double highScoreMin = 70.0;
        private double highQualityMin = 70.0;
        private double mediumScoreMin = 55.0;
        private double highWeight = 0.06;
        private double mediumWeight = 0.04;
        private double lowWeight = 0.02;
    }

    private DataFiles data = new DataFiles();
    @Data
    public static class DataFiles {
        /**
         * Directory holding one {@code <SYMBOL>.csv} price file per symbol
         */
        private String pricesDirectory = "data/prices";

        /**
         * CSV of precomputed factor scores (date,symbol,fundamentals,momentum,quality,sentiment)
         */
        private String scoresFile = "data/factor-scores.csv";

        /**
         * CSV of regime classifications (date,trend,volatility); optional
         */
        private String regimesFile;
    }

    private Output output = new Output();
    @Data
    public static class Output {
        private String resultFile = "backtest-result.json";
    }

    public BacktestConfig toConfig() {
        RiskLimits limits = new RiskLimits(
            risk.highQualityMinScore, risk.mediumQualityMinScore,
            risk.highQualityStopPct, risk.mediumQualityStopPct, risk.lowQualityStopPct,
            risk.trailingStopPct,
            risk.maxPortfolioDrawdownPct, risk.drawdownLiquidationFraction,
            risk.highVolatilityThreshold, risk.volatilityStopMultiplier, risk.volatilityLookbackTicks);

        return BacktestConfig.builder()
            .startDate(parseDate("startDate", startDate))
            .endDate(parseDate("endDate", endDate))
            .universe(universe)
            .cadence(parseCadence(cadence))
            .topN(topN)
            .initialCapital(initialCapital)
            .transactionCostRate(transactionCostRate)
            .cashReservePct(cashReservePct)
            .riskManagementEnabled(risk.enabled)
            .riskLimits(limits)
            .weights(new FactorWeights(weights.fundamentals, weights.momentum, weights.quality, weights.sentiment))
            .adaptiveWeights(weights.adaptive)
            .vetoRules(new MomentumVetoRules(veto.hardFloor, veto.softMomentum, veto.softFundamentals, veto.exemptSymbols))
            .reEntryRules(new ReEntryRules(reEntry.fundamentalsThreshold, reEntry.lookbackDays))
            .convictionTiers(new ConvictionTiers(conviction.highScoreMin, conviction.highQualityMin,
                conviction.mediumScoreMin, conviction.highWeight, conviction.mediumWeight, conviction.lowWeight))
            .scoreDeteriorationPoints(scoreDeteriorationPoints)
            .benchmarkSymbol(benchmarkSymbol)
            .riskFreeRate(riskFreeRate)
            .periodsPerYear(periodsPerYear)
            .scoringParallelism(scoringParallelism)
            .scoringTimeout(scoringTimeout)
            .dataSource("csv:" + data.pricesDirectory + "," + data.scoresFile)
            .build();
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new BacktestConfigurationException(field, "not an ISO date: " + value);
        }
    }

    private static RebalanceCadence parseCadence(String value) {
        try {
            return RebalanceCadence.fromStringIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            throw new BacktestConfigurationException("cadence", e.getMessage());
        }
    }
}
