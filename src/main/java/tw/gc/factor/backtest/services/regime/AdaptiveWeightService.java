package tw.gc.factor.backtest.services.regime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.config.FactorWeights;
import tw.gc.factor.backtest.enums.MarketTrend;
import tw.gc.factor.backtest.enums.VolatilityRegime;
import tw.gc.factor.backtest.strategy.RegimeProvider;
import tw.gc.factor.backtest.strategy.RegimeSnapshot;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses factor weights per rebalance date.
 *
 * <p>With adaptive weighting off the static weights are used as-is. With it on, the regime on the
 * date decides: weights supplied by the regime classifier win, otherwise the trend/volatility
 * table below applies.
 *
 * <pre>
 *              HIGH vol          NORMAL vol        LOW vol
 *   BULL       F30 M40 Q20 S10   F40 M30 Q20 S10   F50 M20 Q20 S10
 *   BEAR       F20 M20 Q40 S20   F30 M20 Q30 S20   F40 M20 Q30 S10
 *   SIDEWAYS   F20 M30 Q30 S20   F40 M30 Q20 S10   F50 M20 Q20 S10
 * </pre>
 * A date without a regime falls back to the static weights.
 */
@Service
@Slf4j
public class AdaptiveWeightService {

    private static final Map<MarketTrend, Map<VolatilityRegime, FactorWeights>> REGIME_WEIGHTS =
        new EnumMap<>(MarketTrend.class);

    static {
        Map<VolatilityRegime, FactorWeights> bull = new EnumMap<>(VolatilityRegime.class);
        bull.put(VolatilityRegime.HIGH, new FactorWeights(0.30, 0.40, 0.20, 0.10));
        bull.put(VolatilityRegime.NORMAL, new FactorWeights(0.40, 0.30, 0.20, 0.10));
        bull.put(VolatilityRegime.LOW, new FactorWeights(0.50, 0.20, 0.20, 0.10));
        REGIME_WEIGHTS.put(MarketTrend.BULL, bull);

        Map<VolatilityRegime, FactorWeights> bear = new EnumMap<>(VolatilityRegime.class);
        bear.put(VolatilityRegime.HIGH, new FactorWeights(0.20, 0.20, 0.40, 0.20));
        bear.put(VolatilityRegime.NORMAL, new FactorWeights(0.30, 0.20, 0.30, 0.20));
        bear.put(VolatilityRegime.LOW, new FactorWeights(0.40, 0.20, 0.30, 0.10));
        REGIME_WEIGHTS.put(MarketTrend.BEAR, bear);

        Map<VolatilityRegime, FactorWeights> sideways = new EnumMap<>(VolatilityRegime.class);
        sideways.put(VolatilityRegime.HIGH, new FactorWeights(0.20, 0.30, 0.30, 0.20));
        sideways.put(VolatilityRegime.NORMAL, new FactorWeights(0.40, 0.30, 0.20, 0.10));
        sideways.put(VolatilityRegime.LOW, new FactorWeights(0.50, 0.20, 0.20, 0.10));
        REGIME_WEIGHTS.put(MarketTrend.SIDEWAYS, sideways);
    }

    public FactorWeights weightsFor(MarketTrend trend, VolatilityRegime volatility) {
        return REGIME_WEIGHTS.get(trend).get(volatility);
    }

    public WeightDecision resolve(LocalDate date,
                                  FactorWeights staticWeights,
                                  boolean adaptive,
                                  Optional<RegimeProvider> regimeProvider) {
        if (!adaptive) {
            return WeightDecision.staticWeights(staticWeights);
        }
        if (regimeProvider.isEmpty()) {
            throw new IllegalStateException("Adaptive weighting requires a regime provider");
        }

        Optional<RegimeSnapshot> snapshot;
        try {
            snapshot = regimeProvider.get().regimeAt(date);
        } catch (RuntimeException e) {
            log.warn("⚠️ Regime lookup failed on {}: {}", date, e.getMessage());
            return WeightDecision.fallback(staticWeights, "regime lookup failed on " + date + ": " + e.getMessage());
        }
        if (snapshot == null || snapshot.isEmpty()) {
            log.info("No regime available on {}, using static weights {}", date, staticWeights.describe());
            return WeightDecision.fallback(staticWeights, "no regime on " + date + ", static weights used");
        }

        RegimeSnapshot regime = snapshot.get();
        FactorWeights weights = regime.weights().orElseGet(() -> weightsFor(regime.trend(), regime.volatility()));
        if (!weights.isValid()) {
            log.warn("⚠️ Regime {} supplied invalid weights (sum {}), using static weights", regime.label(), weights.sum());
            return WeightDecision.fallback(staticWeights,
                "invalid regime weights on " + date + ", static weights used");
        }

        double cash = 0.0;
        if (regime.cashAllocation().isPresent()) {
            double requested = regime.cashAllocation().getAsDouble();
            if (requested >= 0 && requested < 1) {
                cash = requested;
            } else {
                log.warn("⚠️ Ignoring out-of-range cash allocation {} for regime {}", requested, regime.label());
            }
        }
        log.info("📊 Regime {} on {}: weights {} cash {}%", regime.label(), date, weights.describe(),
            String.format("%.0f", cash * 100));
        return new WeightDecision(weights, regime.label(), cash, Optional.empty());
    }
}
