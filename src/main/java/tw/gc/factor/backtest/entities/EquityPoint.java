package tw.gc.factor.backtest.entities;

import java.time.LocalDate;

/**
 * Portfolio valuation on a tick. {@code totalValue == cash + positionsValue}.
 */
public record EquityPoint(
    LocalDate date,
    double totalValue,
    double cash,
    double positionsValue
) {
}
