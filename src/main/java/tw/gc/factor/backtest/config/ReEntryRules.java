package tw.gc.factor.backtest.config;

/**
 * Re-entry gate for symbols that were stopped out.
 *
 * @param fundamentalsThreshold fundamentals must be strictly above this to re-buy inside the window
 * @param lookbackDays calendar days a stop record stays active
 */
public record ReEntryRules(
    double fundamentalsThreshold,
    int lookbackDays
) {
    public static final ReEntryRules DEFAULT = new ReEntryRules(65.0, 90);
}
