package tw.gc.factor.backtest.entities;

import lombok.Builder;
import tw.gc.factor.backtest.enums.ExitReason;

import java.time.LocalDate;

/**
 * Full or partial exit of a position. Partial exits (drawdown trims) report the shares sold.
 */
@Builder
public record ClosedTrade(
    String symbol,
    LocalDate entryDate,
    double entryPrice,
    LocalDate exitDate,
    double exitPrice,
    double shares,
    ExitReason exitReason,
    double pnl,
    double pnlPct,
    long holdingDays
) {
    public boolean isWin() {
        return pnl > 0;
    }
}
