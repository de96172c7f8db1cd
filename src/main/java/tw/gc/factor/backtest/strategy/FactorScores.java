package tw.gc.factor.backtest.strategy;

/**
 * Point-in-time factor sub-scores for one symbol on one date, each in [0, 100].
 */
public record FactorScores(
    double fundamentals,
    double momentum,
    double quality,
    double sentiment
) {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    public FactorScores {
        requireInRange("fundamentals", fundamentals);
        requireInRange("momentum", momentum);
        requireInRange("quality", quality);
        requireInRange("sentiment", sentiment);
    }

    private static void requireInRange(String name, double value) {
        if (!Double.isFinite(value) || value < MIN_SCORE || value > MAX_SCORE) {
            throw new IllegalArgumentException(name + " score must be in [0, 100], got: " + value);
        }
    }
}
