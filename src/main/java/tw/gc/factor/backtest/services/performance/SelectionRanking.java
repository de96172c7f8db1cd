package tw.gc.factor.backtest.services.performance;

import tw.gc.factor.backtest.entities.RebalanceEvent;
import tw.gc.factor.backtest.entities.SelectionSummary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranks every symbol ever selected by the average score of the rebalances that picked it.
 * Each rebalance credits its average selected score to all of its selected symbols.
 */
public final class SelectionRanking {

    public static final int DEFAULT_LIMIT = 10;

    private static final Comparator<SelectionSummary> BEST_FIRST =
        Comparator.comparingDouble(SelectionSummary::averageScore).reversed()
            .thenComparing(SelectionSummary::symbol);

    private final List<SelectionSummary> ranked;

    private SelectionRanking(List<SelectionSummary> ranked) {
        this.ranked = ranked;
    }

    public static SelectionRanking of(List<RebalanceEvent> rebalances) {
        Map<String, double[]> totals = new TreeMap<>();
        for (RebalanceEvent event : rebalances) {
            for (String symbol : event.selected()) {
                double[] total = totals.computeIfAbsent(symbol, s -> new double[2]);
                total[0]++;
                total[1] += event.averageScore();
            }
        }
        List<SelectionSummary> ranked = new ArrayList<>();
        totals.forEach((symbol, total) ->
            ranked.add(new SelectionSummary(symbol, (int) total[0], total[1] / total[0])));
        ranked.sort(BEST_FIRST);
        return new SelectionRanking(List.copyOf(ranked));
    }

    /**
     * Highest-scoring symbols, best first.
     */
    public List<SelectionSummary> best(int limit) {
        return ranked.subList(0, Math.min(limit, ranked.size()));
    }

    /**
     * Lowest-scoring symbols, still in best-first order.
     */
    public List<SelectionSummary> worst(int limit) {
        return ranked.subList(Math.max(0, ranked.size() - limit), ranked.size());
    }
}
