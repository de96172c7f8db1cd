package tw.gc.factor.backtest.services.regime;

import tw.gc.factor.backtest.config.FactorWeights;

import java.util.Optional;

/**
 * Weights chosen for one rebalance date.
 *
 * @param regime regime label, or "STATIC" when no regime was applied
 * @param cashAllocation fraction of portfolio value the regime asks to keep in cash
 * @param note explanation when the decision fell back to static weights
 */
public record WeightDecision(FactorWeights weights, String regime, double cashAllocation, Optional<String> note) {

    public static final String STATIC = "STATIC";

    public static WeightDecision staticWeights(FactorWeights weights) {
        return new WeightDecision(weights, STATIC, 0.0, Optional.empty());
    }

    public static WeightDecision fallback(FactorWeights weights, String note) {
        return new WeightDecision(weights, STATIC, 0.0, Optional.of(note));
    }
}
