package tw.gc.factor.backtest.config;

import tw.gc.factor.backtest.enums.ConvictionTier;

/**
 * Conviction tier thresholds and base weights used by position sizing.
 *
 * <p>HIGH requires composite &gt; {@code highScoreMin} and quality &gt; {@code highQualityMin};
 * MEDIUM requires composite &gt; {@code mediumScoreMin}; everything else is LOW.
 */
public record ConvictionTiers(
    double highScoreMin,
    double highQualityMin,
    double mediumScoreMin,
    double highWeight,
    double mediumWeight,
    double lowWeight
) {
    public static final ConvictionTiers DEFAULT = new ConvictionTiers(70.0, 70.0, 55.0, 0.06, 0.04, 0.02);

    public ConvictionTier classify(double compositeScore, double qualityScore) {
        if (compositeScore > highScoreMin && qualityScore > highQualityMin) {
            return ConvictionTier.HIGH;
        }
        if (compositeScore > mediumScoreMin) {
            return ConvictionTier.MEDIUM;
        }
        return ConvictionTier.LOW;
    }

    public double baseWeight(ConvictionTier tier) {
        return switch (tier) {
            case HIGH -> highWeight;
            case MEDIUM -> mediumWeight;
            case LOW -> lowWeight;
        };
    }
}
