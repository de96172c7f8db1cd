package tw.gc.factor.backtest.entities;

import lombok.Builder;
import tw.gc.factor.backtest.enums.ExitReason;
import tw.gc.factor.backtest.enums.TradeAction;

import java.time.LocalDate;

/**
 * One executed order. Sell-only fields are null on buys.
 *
 * @param notional shares x price, before costs
 * @param transactionCost cost charged on the notional
 * @param compositeScore composite score at the time of the order, when known
 * @param rank rank in the target list for rebalance orders
 * @param scaledDown true when a buy was shrunk to fit available cash
 */
@Builder
public record TradeLogEntry(
    LocalDate date,
    TradeAction action,
    String symbol,
    double shares,
    double price,
    double notional,
    double transactionCost,
    Double compositeScore,
    Integer rank,
    Double entryPrice,
    LocalDate entryDate,
    Long holdingDays,
    Double pnl,
    Double pnlPct,
    ExitReason exitReason,
    boolean scaledDown
) {
}
