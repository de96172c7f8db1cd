package tw.gc.factor.backtest.enums;

/**
 * Conviction bucket derived from composite and quality scores.
 */
public enum ConvictionTier {
    HIGH,
    MEDIUM,
    LOW
}
