package tw.gc.factor.backtest.strategy;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Scoring oracle combining the fundamentals, momentum, quality and sentiment factors.
 *
 * <p>Implementations must only use information knowable on {@code asOf}. Missing data is
 * reported as {@link Optional#empty()}, never as a neutral placeholder score. Calls for
 * different symbols on the same date may run concurrently.
 */
@FunctionalInterface
public interface FactorScorer {

    Optional<FactorScores> score(String symbol, LocalDate asOf);
}
