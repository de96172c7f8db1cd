package tw.gc.factor.backtest.entities;

import lombok.Builder;
import tw.gc.factor.backtest.config.BacktestConfig;
import tw.gc.factor.backtest.services.performance.BenchmarkCurve;
import tw.gc.factor.backtest.services.performance.PerformanceMetrics;

import java.util.List;

/**
 * Outcome of one backtest run. Built once when the run finishes; all collections are immutable.
 *
 * @param bestPerformers most favourably scored selections, best first
 * @param worstPerformers least favourably scored selections, in the same order
 * @param truncated true when the run stopped early on cancellation or deadline
 * @param truncationReason why the run stopped early, null otherwise
 */
@Builder
public record BacktestResult(
    BacktestConfig config,
    List<EquityPoint> equityCurve,
    List<TradeLogEntry> tradeLog,
    List<ClosedTrade> closedTrades,
    List<RebalanceEvent> rebalances,
    BenchmarkCurve marketIndex,
    BenchmarkCurve buyAndHold,
    PerformanceMetrics metrics,
    ExitStatistics exitStatistics,
    List<SelectionSummary> bestPerformers,
    List<SelectionSummary> worstPerformers,
    ResultMetadata metadata,
    boolean truncated,
    String truncationReason
) {
    public BacktestResult {
        equityCurve = equityCurve != null ? List.copyOf(equityCurve) : List.of();
        tradeLog = tradeLog != null ? List.copyOf(tradeLog) : List.of();
        closedTrades = closedTrades != null ? List.copyOf(closedTrades) : List.of();
        rebalances = rebalances != null ? List.copyOf(rebalances) : List.of();
        bestPerformers = bestPerformers != null ? List.copyOf(bestPerformers) : List.of();
        worstPerformers = worstPerformers != null ? List.copyOf(worstPerformers) : List.of();
    }
}
