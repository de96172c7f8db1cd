package tw.gc.factor.backtest.strategy;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Market regime classifier, consulted only when adaptive weighting is enabled.
 */
@FunctionalInterface
public interface RegimeProvider {

    Optional<RegimeSnapshot> regimeAt(LocalDate date);
}
