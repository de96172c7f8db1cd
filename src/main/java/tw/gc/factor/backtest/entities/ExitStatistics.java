package tw.gc.factor.backtest.entities;

import lombok.Builder;
import tw.gc.factor.backtest.enums.ExitReason;

import java.util.Map;

/**
 * Exit counts and stop-loss quality.
 *
 * @param stopsRecovered stopped symbols whose price later regained the entry price within the lookback
 * @param falsePositiveStops recoveries that happened within thirty days of the stop
 */
@Builder
public record ExitStatistics(
    Map<ExitReason, Integer> exitsByReason,
    int stopsRecorded,
    int stopsRecovered,
    int falsePositiveStops
) {
    public ExitStatistics {
        exitsByReason = exitsByReason != null ? Map.copyOf(exitsByReason) : Map.of();
    }

    public double falsePositiveRate() {
        return stopsRecorded > 0 ? (double) falsePositiveStops / stopsRecorded : 0.0;
    }
}
