package tw.gc.factor.backtest.strategy;

import tw.gc.factor.backtest.config.FactorWeights;
import tw.gc.factor.backtest.enums.MarketTrend;
import tw.gc.factor.backtest.enums.VolatilityRegime;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Market regime classification on a given date.
 *
 * @param trend prevailing market trend
 * @param volatility volatility bucket
 * @param weights factor weights recommended for this regime, if the classifier supplies them
 * @param cashAllocation recommended fraction of value to hold in cash, if any
 */
public record RegimeSnapshot(
    MarketTrend trend,
    VolatilityRegime volatility,
    Optional<FactorWeights> weights,
    OptionalDouble cashAllocation
) {
    public RegimeSnapshot {
        if (trend == null || volatility == null) {
            throw new IllegalArgumentException("trend and volatility are required");
        }
        weights = weights != null ? weights : Optional.empty();
        cashAllocation = cashAllocation != null ? cashAllocation : OptionalDouble.empty();
    }

    public static RegimeSnapshot of(MarketTrend trend, VolatilityRegime volatility) {
        return new RegimeSnapshot(trend, volatility, Optional.empty(), OptionalDouble.empty());
    }

    public String label() {
        return trend.name() + "_" + volatility.name() + "_VOL";
    }
}
