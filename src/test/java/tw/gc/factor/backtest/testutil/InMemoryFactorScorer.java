package tw.gc.factor.backtest.testutil;

import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.FactorScores;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scoring collaborator with scores effective from a date onward. Symbols can be made to fail.
 */
public class InMemoryFactorScorer implements FactorScorer {

    private final Map<String, NavigableMap<LocalDate, FactorScores>> scores = new HashMap<>();
    private final Set<String> failing = new HashSet<>();

    public InMemoryFactorScorer always(String symbol, FactorScores value) {
        return from(symbol, LocalDate.MIN, value);
    }

    public InMemoryFactorScorer always(String symbol, double allScores) {
        return always(symbol, uniform(allScores));
    }

    public InMemoryFactorScorer from(String symbol, LocalDate effective, FactorScores value) {
        scores.computeIfAbsent(symbol, s -> new TreeMap<>()).put(effective, value);
        return this;
    }

    public InMemoryFactorScorer failing(String symbol) {
        failing.add(symbol);
        return this;
    }

    public static FactorScores uniform(double value) {
        return new FactorScores(value, value, value, value);
    }

    @Override
    public Optional<FactorScores> score(String symbol, LocalDate asOf) {
        if (failing.contains(symbol)) {
            throw new IllegalStateException("scorer unavailable for " + symbol);
        }
        NavigableMap<LocalDate, FactorScores> history = scores.get(symbol);
        if (history == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, FactorScores> entry = history.floorEntry(asOf);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }
}
