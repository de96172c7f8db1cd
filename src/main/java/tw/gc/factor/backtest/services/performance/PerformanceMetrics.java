package tw.gc.factor.backtest.services.performance;

import lombok.Builder;

/**
 * Summary statistics of a simulated equity curve. Returns and drawdowns are fractions.
 * Benchmark-relative fields are null when the corresponding benchmark curve is unavailable.
 */
@Builder
public record PerformanceMetrics(
    double initialValue,
    double finalValue,
    double totalReturn,
    double cagr,
    double annualizedVolatility,
    double sharpeRatio,
    double sortinoRatio,
    double maxDrawdown,
    int maxDrawdownDurationTicks,
    double calmarRatio,
    Double alpha,
    Double beta,
    Double informationRatio,
    Double trackingError,
    Double benchmarkReturn,
    Double buyAndHoldReturn,
    Double outperformanceVsBenchmark,
    Double outperformanceVsBuyAndHold,
    int totalTrades,
    int closedTrades,
    double winRate,
    double profitFactor,
    double totalTransactionCosts,
    int periods
) {
}
