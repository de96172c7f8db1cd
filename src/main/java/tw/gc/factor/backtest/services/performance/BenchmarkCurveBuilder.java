package tw.gc.factor.backtest.services.performance;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.strategy.PriceProvider;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Builds the two comparison curves of a run, one tick at a time:
 * <ul>
 *   <li>market index: the benchmark symbol's price scaled to the initial capital</li>
 *   <li>buy-and-hold: equal-weight purchase of every universe symbol quoted on the first tick,
 *       held to the end</li>
 * </ul>
 * Missing quotes are carried forward from the last observation. A failing price lookup counts as
 * a missing quote and is tallied in {@link #lookupFailures()}.
 */
@Slf4j
public class BenchmarkCurveBuilder {

    private final PriceProvider priceProvider;
    private final String benchmarkSymbol;
    private final List<String> universe;
    private final double initialCapital;
    private final double transactionCostRate;

    private final TreeMap<LocalDate, Double> marketValues = new TreeMap<>();
    private final TreeMap<LocalDate, Double> buyAndHoldValues = new TreeMap<>();

    private Double benchmarkBasePrice;
    private final Map<String, Double> holdings = new LinkedHashMap<>();
    private final Map<String, Double> lastPrices = new LinkedHashMap<>();
    private double leftoverCash;
    private boolean buyAndHoldStarted;
    private int lookupFailures;

    public BenchmarkCurveBuilder(PriceProvider priceProvider, String benchmarkSymbol, List<String> universe,
                                 double initialCapital, double transactionCostRate) {
        this.priceProvider = priceProvider;
        this.benchmarkSymbol = benchmarkSymbol;
        this.universe = List.copyOf(universe);
        this.initialCapital = initialCapital;
        this.transactionCostRate = transactionCostRate;
    }

    public void observe(LocalDate date) {
        observeMarket(date);
        observeBuyAndHold(date);
    }

    private void observeMarket(LocalDate date) {
        OptionalDouble price = quote(benchmarkSymbol, date);
        if (price.isPresent()) {
            if (benchmarkBasePrice == null) {
                benchmarkBasePrice = price.getAsDouble();
            }
            marketValues.put(date, initialCapital * price.getAsDouble() / benchmarkBasePrice);
        } else if (!marketValues.isEmpty()) {
            marketValues.put(date, marketValues.lastEntry().getValue());
        }
    }

    private void observeBuyAndHold(LocalDate date) {
        for (String symbol : universe) {
            OptionalDouble price = quote(symbol, date);
            if (price.isPresent()) {
                lastPrices.put(symbol, price.getAsDouble());
            }
        }
        if (!buyAndHoldStarted) {
            if (lastPrices.isEmpty()) {
                return;
            }
            double perSymbol = initialCapital / lastPrices.size();
            double notional = perSymbol / (1 + transactionCostRate);
            for (Map.Entry<String, Double> entry : lastPrices.entrySet()) {
                holdings.put(entry.getKey(), notional / entry.getValue());
            }
            leftoverCash = initialCapital - notional * (1 + transactionCostRate) * lastPrices.size();
            buyAndHoldStarted = true;
            log.debug("Buy-and-hold benchmark opened {} positions on {}", holdings.size(), date);
        }
        double value = leftoverCash;
        for (Map.Entry<String, Double> holding : holdings.entrySet()) {
            value += holding.getValue() * lastPrices.get(holding.getKey());
        }
        buyAndHoldValues.put(date, value);
    }

    private OptionalDouble quote(String symbol, LocalDate date) {
        try {
            OptionalDouble price = priceProvider.priceAt(symbol, date);
            return price.isPresent() && price.getAsDouble() > 0 ? price : OptionalDouble.empty();
        } catch (RuntimeException e) {
            lookupFailures++;
            log.warn("⚠️ Benchmark price lookup for {} on {} failed: {}", symbol, date, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public int lookupFailures() {
        return lookupFailures;
    }

    public BenchmarkCurve marketIndex() {
        return new BenchmarkCurve(benchmarkSymbol, marketValues);
    }

    public BenchmarkCurve buyAndHold() {
        return new BenchmarkCurve("EQUAL_WEIGHT_BUY_AND_HOLD", buyAndHoldValues);
    }
}
