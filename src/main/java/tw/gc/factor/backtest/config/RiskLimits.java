package tw.gc.factor.backtest.config;

/**
 * Stop-loss, trailing-stop and drawdown limits. Percentages are fractions (0.20 = 20%).
 *
 * @param highQualityMinScore quality strictly above this gets the widest static stop
 * @param mediumQualityMinScore quality at or above this (and not high) gets the medium stop
 * @param highQualityStopPct static stop from entry for high-quality names
 * @param mediumQualityStopPct static stop from entry for medium-quality names
 * @param lowQualityStopPct static stop from entry for low-quality names
 * @param trailingStopPct drop from the highest observed price that triggers the trailing stop
 * @param maxPortfolioDrawdownPct portfolio drawdown from peak that triggers de-risking
 * @param drawdownLiquidationFraction fraction of exposure moved to cash on a drawdown breach
 * @param highVolatilityThreshold annualized volatility above which static stops are widened
 * @param volatilityStopMultiplier multiplier applied to the static stop of high-volatility names
 * @param volatilityLookbackTicks number of observed price ticks used for realized volatility
 */
public record RiskLimits(
    double highQualityMinScore,
    double mediumQualityMinScore,
    double highQualityStopPct,
    double mediumQualityStopPct,
    double lowQualityStopPct,
    double trailingStopPct,
    double maxPortfolioDrawdownPct,
    double drawdownLiquidationFraction,
    double highVolatilityThreshold,
    double volatilityStopMultiplier,
    int volatilityLookbackTicks
) {
    public static final RiskLimits DEFAULT = new RiskLimits(
        70.0, 50.0,
        0.30, 0.20, 0.10,
        0.20,
        0.12, 0.50,
        0.35, 1.2, 60
    );

    /**
     * Static stop percentage for a quality score, before any volatility adjustment.
     */
    public double staticStopPctFor(double qualityScore) {
        if (qualityScore > highQualityMinScore) {
            return highQualityStopPct;
        }
        if (qualityScore >= mediumQualityMinScore) {
            return mediumQualityStopPct;
        }
        return lowQualityStopPct;
    }

    public RiskLimits withTrailingStopPct(double pct) {
        return new RiskLimits(highQualityMinScore, mediumQualityMinScore, highQualityStopPct,
            mediumQualityStopPct, lowQualityStopPct, pct, maxPortfolioDrawdownPct,
            drawdownLiquidationFraction, highVolatilityThreshold, volatilityStopMultiplier,
            volatilityLookbackTicks);
    }

    public RiskLimits withMaxPortfolioDrawdownPct(double pct) {
        return new RiskLimits(highQualityMinScore, mediumQualityMinScore, highQualityStopPct,
            mediumQualityStopPct, lowQualityStopPct, trailingStopPct, pct,
            drawdownLiquidationFraction, highVolatilityThreshold, volatilityStopMultiplier,
            volatilityLookbackTicks);
    }
}
