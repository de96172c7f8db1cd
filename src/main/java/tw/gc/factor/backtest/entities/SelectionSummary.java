package tw.gc.factor.backtest.entities;

/**
 * How often a symbol was selected and the average score of the rebalances that selected it.
 */
public record SelectionSummary(String symbol, int timesSelected, double averageScore) {
}
