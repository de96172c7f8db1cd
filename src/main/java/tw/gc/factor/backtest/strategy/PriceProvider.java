package tw.gc.factor.backtest.strategy;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Point-in-time close prices.
 */
@FunctionalInterface
public interface PriceProvider {

    /**
     * Last known close on or before {@code date}, or empty if the symbol has no quote yet.
     */
    OptionalDouble priceAt(String symbol, LocalDate date);
}
