package tw.gc.factor.backtest.config;

import tw.gc.factor.backtest.enums.RebalanceCadence;
import tw.gc.factor.backtest.exceptions.BacktestConfigurationException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable description of one backtest run.
 *
 * <p>Build through {@link #builder()}; every field has a documented default except the date
 * range and the universe. {@link #validate()} is called by the orchestrator before any simulation
 * work starts and rejects inconsistent settings with {@link BacktestConfigurationException}.
 */
public record BacktestConfig(
    LocalDate startDate,
    LocalDate endDate,
    List<String> universe,
    RebalanceCadence cadence,
    int topN,
    double initialCapital,
    double transactionCostRate,
    double cashReservePct,
    boolean riskManagementEnabled,
    RiskLimits riskLimits,
    FactorWeights weights,
    boolean adaptiveWeights,
    MomentumVetoRules vetoRules,
    ReEntryRules reEntryRules,
    ConvictionTiers convictionTiers,
    double scoreDeteriorationPoints,
    String benchmarkSymbol,
    double riskFreeRate,
    int periodsPerYear,
    int scoringParallelism,
    Duration scoringTimeout,
    String dataSource,
    List<String> biasCaveats
) {
    public static final int DEFAULT_TOP_N = 10;
    public static final double DEFAULT_INITIAL_CAPITAL = 100_000.0;
    public static final double DEFAULT_TRANSACTION_COST_RATE = 0.001;
    public static final double DEFAULT_CASH_RESERVE_PCT = 0.01;
    public static final double DEFAULT_SCORE_DETERIORATION_POINTS = 20.0;
    public static final double DEFAULT_RISK_FREE_RATE = 0.02;
    public static final int DEFAULT_PERIODS_PER_YEAR = 252;
    public static final String DEFAULT_BENCHMARK = "SPY";

    /** Known look-ahead limitations of typical historical factor data */
    public static final List<String> DEFAULT_BIAS_CAVEATS = List.of(
        "fundamentals: point-in-time history may be incomplete; current values can leak into past dates",
        "sentiment: historical sentiment is approximated from current data",
        "quality: partially reconstructed from historical statements",
        "momentum: computed from historical prices only",
        "results may be optimistic by roughly 5-10% where the above apply"
    );

    public BacktestConfig {
        universe = universe != null ? List.copyOf(universe) : List.of();
        biasCaveats = biasCaveats != null ? List.copyOf(biasCaveats) : List.of();
    }

    /**
     * Rejects settings the simulation cannot run with. Returns this config for chaining.
     *
     * @throws BacktestConfigurationException naming the offending field
     */
    public BacktestConfig validate() {
        if (startDate == null || endDate == null) {
            throw new BacktestConfigurationException("dateRange", "start and end dates are required");
        }
        if (!startDate.isBefore(endDate)) {
            throw new BacktestConfigurationException("dateRange",
                "start " + startDate + " must be before end " + endDate);
        }
        if (universe.isEmpty()) {
            throw new BacktestConfigurationException("universe", "must contain at least one symbol");
        }
        Set<String> seen = new HashSet<>();
        for (String symbol : universe) {
            if (symbol == null || symbol.isBlank()) {
                throw new BacktestConfigurationException("universe", "contains a blank symbol");
            }
            if (!seen.add(symbol)) {
                throw new BacktestConfigurationException("universe", "duplicate symbol " + symbol);
            }
        }
        if (cadence == null) {
            throw new BacktestConfigurationException("cadence", "is required");
        }
        if (topN < 1) {
            throw new BacktestConfigurationException("topN", "must be at least 1, got " + topN);
        }
        if (topN > universe.size()) {
            throw new BacktestConfigurationException("topN",
                topN + " exceeds universe size " + universe.size());
        }
        if (!(initialCapital > 0) || !Double.isFinite(initialCapital)) {
            throw new BacktestConfigurationException("initialCapital", "must be positive, got " + initialCapital);
        }
        requireFraction("transactionCostRate", transactionCostRate, true);
        requireFraction("cashReservePct", cashReservePct, true);

        if (weights == null) {
            throw new BacktestConfigurationException("weights", "are required");
        }
        if (!weights.isValid()) {
            throw new BacktestConfigurationException("weights",
                "must be non-negative and sum to 1.0, got " + weights.sum());
        }
        validateRiskLimits();
        validateVetoRules();

        if (reEntryRules == null) {
            throw new BacktestConfigurationException("reEntryRules", "are required");
        }
        requireScore("reEntryRules.fundamentalsThreshold", reEntryRules.fundamentalsThreshold());
        if (reEntryRules.lookbackDays() < 0) {
            throw new BacktestConfigurationException("reEntryRules.lookbackDays", "must not be negative");
        }
        validateConvictionTiers();

        if (benchmarkSymbol == null || benchmarkSymbol.isBlank()) {
            throw new BacktestConfigurationException("benchmarkSymbol", "is required");
        }
        if (!Double.isFinite(riskFreeRate)) {
            throw new BacktestConfigurationException("riskFreeRate", "must be finite");
        }
        if (periodsPerYear < 1) {
            throw new BacktestConfigurationException("periodsPerYear", "must be positive");
        }
        if (scoringParallelism < 1) {
            throw new BacktestConfigurationException("scoringParallelism", "must be at least 1");
        }
        if (scoringTimeout == null || scoringTimeout.isNegative() || scoringTimeout.isZero()) {
            throw new BacktestConfigurationException("scoringTimeout", "must be a positive duration");
        }
        return this;
    }

    private void validateRiskLimits() {
        if (riskLimits == null) {
            throw new BacktestConfigurationException("riskLimits", "are required");
        }
        requireScore("riskLimits.highQualityMinScore", riskLimits.highQualityMinScore());
        requireScore("riskLimits.mediumQualityMinScore", riskLimits.mediumQualityMinScore());
        if (riskLimits.mediumQualityMinScore() > riskLimits.highQualityMinScore()) {
            throw new BacktestConfigurationException("riskLimits",
                "medium quality threshold must not exceed the high quality threshold");
        }
        requireFraction("riskLimits.highQualityStopPct", riskLimits.highQualityStopPct(), false);
        requireFraction("riskLimits.mediumQualityStopPct", riskLimits.mediumQualityStopPct(), false);
        requireFraction("riskLimits.lowQualityStopPct", riskLimits.lowQualityStopPct(), false);
        requireFraction("riskLimits.trailingStopPct", riskLimits.trailingStopPct(), false);
        requireFraction("riskLimits.maxPortfolioDrawdownPct", riskLimits.maxPortfolioDrawdownPct(), false);
        double fraction = riskLimits.drawdownLiquidationFraction();
        if (!(fraction >= 0 && fraction <= 1)) {
            throw new BacktestConfigurationException("riskLimits.drawdownLiquidationFraction",
                "must be in [0, 1], got " + fraction);
        }
        if (!(riskLimits.volatilityStopMultiplier() >= 1.0)) {
            throw new BacktestConfigurationException("riskLimits.volatilityStopMultiplier", "must be at least 1.0");
        }
        if (riskLimits.volatilityLookbackTicks() < 2) {
            throw new BacktestConfigurationException("riskLimits.volatilityLookbackTicks", "must be at least 2");
        }
        if (riskLimits.staticStopPctFor(0) * riskLimits.volatilityStopMultiplier() >= 1.0
            || riskLimits.highQualityStopPct() * riskLimits.volatilityStopMultiplier() >= 1.0) {
            throw new BacktestConfigurationException("riskLimits",
                "volatility-adjusted stop must stay below 100%");
        }
    }

    private void validateVetoRules() {
        if (vetoRules == null) {
            throw new BacktestConfigurationException("vetoRules", "are required");
        }
        requireScore("vetoRules.hardFloor", vetoRules.hardFloor());
        requireScore("vetoRules.softMomentum", vetoRules.softMomentum());
        requireScore("vetoRules.softFundamentals", vetoRules.softFundamentals());
    }

    private void validateConvictionTiers() {
        if (convictionTiers == null) {
            throw new BacktestConfigurationException("convictionTiers", "are required");
        }
        requireScore("convictionTiers.highScoreMin", convictionTiers.highScoreMin());
        requireScore("convictionTiers.highQualityMin", convictionTiers.highQualityMin());
        requireScore("convictionTiers.mediumScoreMin", convictionTiers.mediumScoreMin());
        if (!(convictionTiers.highWeight() > 0 && convictionTiers.mediumWeight() > 0
            && convictionTiers.lowWeight() > 0)) {
            throw new BacktestConfigurationException("convictionTiers", "tier weights must be positive");
        }
    }

    private static void requireFraction(String field, double value, boolean zeroAllowed) {
        boolean lowerOk = zeroAllowed ? value >= 0 : value > 0;
        if (!lowerOk || !(value < 1.0)) {
            throw new BacktestConfigurationException(field,
                "must be in " + (zeroAllowed ? "[0, 1)" : "(0, 1)") + ", got " + value);
        }
    }

    private static void requireScore(String field, double value) {
        if (!(value >= 0 && value <= 100)) {
            throw new BacktestConfigurationException(field, "must be in [0, 100], got " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .startDate(startDate)
            .endDate(endDate)
            .universe(universe)
            .cadence(cadence)
            .topN(topN)
            .initialCapital(initialCapital)
            .transactionCostRate(transactionCostRate)
            .cashReservePct(cashReservePct)
            .riskManagementEnabled(riskManagementEnabled)
            .riskLimits(riskLimits)
            .weights(weights)
            .adaptiveWeights(adaptiveWeights)
            .vetoRules(vetoRules)
            .reEntryRules(reEntryRules)
            .convictionTiers(convictionTiers)
            .scoreDeteriorationPoints(scoreDeteriorationPoints)
            .benchmarkSymbol(benchmarkSymbol)
            .riskFreeRate(riskFreeRate)
            .periodsPerYear(periodsPerYear)
            .scoringParallelism(scoringParallelism)
            .scoringTimeout(scoringTimeout)
            .dataSource(dataSource)
            .biasCaveats(biasCaveats);
    }

    public static class Builder {
        private LocalDate startDate;
        private LocalDate endDate;
        private List<String> universe = List.of();
        private RebalanceCadence cadence = RebalanceCadence.MONTHLY;
        private int topN = DEFAULT_TOP_N;
        private double initialCapital = DEFAULT_INITIAL_CAPITAL;
        private double transactionCostRate = DEFAULT_TRANSACTION_COST_RATE;
        private double cashReservePct = DEFAULT_CASH_RESERVE_PCT;
        private boolean riskManagementEnabled = true;
        private RiskLimits riskLimits = RiskLimits.DEFAULT;
        private FactorWeights weights = FactorWeights.DEFAULT;
        private boolean adaptiveWeights = false;
        private MomentumVetoRules vetoRules = MomentumVetoRules.DEFAULT;
        private ReEntryRules reEntryRules = ReEntryRules.DEFAULT;
        private ConvictionTiers convictionTiers = ConvictionTiers.DEFAULT;
        private double scoreDeteriorationPoints = DEFAULT_SCORE_DETERIORATION_POINTS;
        private String benchmarkSymbol = DEFAULT_BENCHMARK;
        private double riskFreeRate = DEFAULT_RISK_FREE_RATE;
        private int periodsPerYear = DEFAULT_PERIODS_PER_YEAR;
        private int scoringParallelism = 4;
        private Duration scoringTimeout = Duration.ofSeconds(30);
        private String dataSource = "unspecified";
        private List<String> biasCaveats = DEFAULT_BIAS_CAVEATS;

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder universe(List<String> universe) {
            this.universe = universe;
            return this;
        }

        public Builder cadence(RebalanceCadence cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder topN(int topN) {
            this.topN = topN;
            return this;
        }

        public Builder initialCapital(double initialCapital) {
            this.initialCapital = initialCapital;
            return this;
        }

        public Builder transactionCostRate(double transactionCostRate) {
            this.transactionCostRate = transactionCostRate;
            return this;
        }

        public Builder cashReservePct(double cashReservePct) {
            this.cashReservePct = cashReservePct;
            return this;
        }

        public Builder riskManagementEnabled(boolean riskManagementEnabled) {
            this.riskManagementEnabled = riskManagementEnabled;
            return this;
        }

        public Builder riskLimits(RiskLimits riskLimits) {
            this.riskLimits = riskLimits;
            return this;
        }

        public Builder weights(FactorWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder adaptiveWeights(boolean adaptiveWeights) {
            this.adaptiveWeights = adaptiveWeights;
            return this;
        }

        public Builder vetoRules(MomentumVetoRules vetoRules) {
            this.vetoRules = vetoRules;
            return this;
        }

        public Builder reEntryRules(ReEntryRules reEntryRules) {
            this.reEntryRules = reEntryRules;
            return this;
        }

        public Builder convictionTiers(ConvictionTiers convictionTiers) {
            this.convictionTiers = convictionTiers;
            return this;
        }

        public Builder scoreDeteriorationPoints(double scoreDeteriorationPoints) {
            this.scoreDeteriorationPoints = scoreDeteriorationPoints;
            return this;
        }

        public Builder benchmarkSymbol(String benchmarkSymbol) {
            this.benchmarkSymbol = benchmarkSymbol;
            return this;
        }

        public Builder riskFreeRate(double riskFreeRate) {
            this.riskFreeRate = riskFreeRate;
            return this;
        }

        public Builder periodsPerYear(int periodsPerYear) {
            this.periodsPerYear = periodsPerYear;
            return this;
        }

        public Builder scoringParallelism(int scoringParallelism) {
            this.scoringParallelism = scoringParallelism;
            return this;
        }

        public Builder scoringTimeout(Duration scoringTimeout) {
            this.scoringTimeout = scoringTimeout;
            return this;
        }

        public Builder dataSource(String dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder biasCaveats(List<String> biasCaveats) {
            this.biasCaveats = biasCaveats;
            return this;
        }

        public BacktestConfig build() {
            return new BacktestConfig(startDate, endDate, universe, cadence, topN, initialCapital,
                transactionCostRate, cashReservePct, riskManagementEnabled, riskLimits, weights,
                adaptiveWeights, vetoRules, reEntryRules, convictionTiers, scoreDeteriorationPoints,
                benchmarkSymbol, riskFreeRate, periodsPerYear, scoringParallelism, scoringTimeout,
                dataSource, biasCaveats);
        }
    }
}
