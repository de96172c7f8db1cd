package tw.gc.factor.backtest.services.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.config.FactorWeights;
import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.FactorScores;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores every symbol of a universe on one date.
 *
 * <p>Per-symbol scoring runs on a fixed worker pool; results are gathered in universe order and
 * then ranked, so the outcome never depends on completion order. A symbol whose scorer returns
 * nothing, throws, or is still running when the timeout for the whole batch expires is left out for
 * this date only.
 */
@Service
@Slf4j
public class UniverseScoringService {

    public ScoringOutcome scoreUniverse(List<String> universe,
                                        LocalDate asOf,
                                        FactorWeights weights,
                                        FactorScorer scorer,
                                        int parallelism,
                                        Duration timeout) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, universe.size())));
        try {
            Map<String, Future<Optional<FactorScores>>> futures = new LinkedHashMap<>();
            for (String symbol : universe) {
                futures.put(symbol, executor.submit(() -> scorer.score(symbol, asOf)));
            }

            // one deadline for the whole batch, not per symbol
            long deadline = System.nanoTime() + timeout.toNanos();
            List<ScoredSymbol> ranked = new ArrayList<>();
            List<String> unavailable = new ArrayList<>();
            List<String> failures = new ArrayList<>();
            for (Map.Entry<String, Future<Optional<FactorScores>>> entry : futures.entrySet()) {
                String symbol = entry.getKey();
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    Optional<FactorScores> scores = entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                    if (scores == null || scores.isEmpty()) {
                        unavailable.add(symbol);
                        continue;
                    }
                    // weights are passed explicitly on every call
                    ranked.add(new ScoredSymbol(symbol, scores.get(), weights.composite(scores.get())));
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    log.warn("⏱️ Scoring {} on {} timed out after {} ms", symbol, asOf, timeout.toMillis());
                    failures.add(symbol + " on " + asOf + ": scoring timed out");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("⚠️ Scoring {} on {} failed: {}", symbol, asOf, cause.getMessage());
                    failures.add(symbol + " on " + asOf + ": " + cause.getClass().getSimpleName()
                        + ": " + cause.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while scoring universe on " + asOf, e);
                }
            }
            ranked.sort(ScoredSymbol.RANKING);
            log.debug("Scored {}/{} symbols on {} ({} unavailable, {} failed)", ranked.size(), universe.size(),
                asOf, unavailable.size(), failures.size());
            return new ScoringOutcome(ranked, unavailable, failures);
        } finally {
            executor.shutdownNow();
        }
    }
}
