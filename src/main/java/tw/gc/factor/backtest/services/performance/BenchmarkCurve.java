package tw.gc.factor.backtest.services.performance;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Comparison value series keyed by tick date.
 */
public record BenchmarkCurve(String name, SortedMap<LocalDate, Double> values) {

    public BenchmarkCurve {
        values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    public boolean isEmpty() {
        return values.size() < 2;
    }

    public double totalReturn() {
        if (values.isEmpty()) {
            return 0.0;
        }
        double first = values.get(values.firstKey());
        double last = values.get(values.lastKey());
        return first > 0 ? last / first - 1.0 : 0.0;
    }
}
