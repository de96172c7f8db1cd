package tw.gc.factor.backtest.config;

import tw.gc.factor.backtest.strategy.FactorScores;

import java.util.Locale;

/**
 * Weight vector applied to the four factor sub-scores. Weights are non-negative and sum to 1.0.
 */
public record FactorWeights(
    double fundamentals,
    double momentum,
    double quality,
    double sentiment
) {
    public static final double SUM_TOLERANCE = 1e-6;

    /** 40/30/20/10 split used when nothing else is configured */
    public static final FactorWeights DEFAULT = new FactorWeights(0.40, 0.30, 0.20, 0.10);

    public double sum() {
        return fundamentals + momentum + quality + sentiment;
    }

    public boolean isValid() {
        return fundamentals >= 0 && momentum >= 0 && quality >= 0 && sentiment >= 0
            && Math.abs(sum() - 1.0) <= SUM_TOLERANCE;
    }

    /**
     * Weighted sum of the sub-scores.
     */
    public double composite(FactorScores scores) {
        return scores.fundamentals() * fundamentals
            + scores.momentum() * momentum
            + scores.quality() * quality
            + scores.sentiment() * sentiment;
    }

    public String describe() {
        return String.format(Locale.US, "F:%.0f%% M:%.0f%% Q:%.0f%% S:%.0f%%",
            fundamentals * 100, momentum * 100, quality * 100, sentiment * 100);
    }
}
