package tw.gc.factor.backtest.entities;

import lombok.Builder;
import tw.gc.factor.backtest.config.FactorWeights;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one rebalance cycle.
 */
@Builder
public record RebalanceEvent(
    LocalDate date,
    List<String> selected,
    Map<String, Double> targetWeights,
    double averageScore,
    FactorWeights weights,
    String regime,
    double investedFraction,
    int candidates,
    int vetoed,
    int reEntryBlocked,
    int buys,
    int sells,
    double transactionCosts,
    double portfolioValue
) {
    public RebalanceEvent {
        selected = selected != null ? List.copyOf(selected) : List.of();
        targetWeights = targetWeights != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(targetWeights))
            : Map.of();
    }
}
