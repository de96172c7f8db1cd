package tw.gc.factor.backtest.services.risk;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.config.RiskLimits;
import tw.gc.factor.backtest.entities.Position;
import tw.gc.factor.backtest.enums.ExitReason;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-position exit rules evaluated on every price tick.
 *
 * <ul>
 *   <li><b>Static stop</b>: price at or below {@code entry * (1 - tierPct)}, where the tier comes
 *       from the quality score at entry. High-volatility names get the tier widened.</li>
 *   <li><b>Trailing stop</b>: armed once the position has traded above its entry price; fires at
 *       or below {@code peak * (1 - trailingPct)}. The trailing percentage never exceeds the
 *       static one, so the trailing trigger is never below the static trigger.</li>
 * </ul>
 * The static stop is checked first; the first rule breached wins.
 *
 * <p>One instance per run: it keeps a short price history per symbol for the volatility check.
 */
@Slf4j
public class RiskManager {

    private final RiskLimits limits;
    private final int periodsPerYear;
    private final Map<String, Deque<Double>> priceHistory = new HashMap<>();

    public RiskManager(RiskLimits limits, int periodsPerYear) {
        this.limits = limits;
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * Exit reason if a stop is breached at {@code currentPrice}, empty if the position is held.
     */
    public Optional<ExitReason> evaluate(Position position, double currentPrice) {
        if (currentPrice <= staticStopPrice(position)) {
            log.warn("🛑 {} static stop: price {} <= {} (entry {}, quality {})",
                position.getSymbol(), fmt(currentPrice), fmt(staticStopPrice(position)),
                fmt(position.getEntryPrice()), fmt(position.getEntryQuality()));
            return Optional.of(ExitReason.STOP_LOSS);
        }
        double peak = Math.max(position.getHighestPrice(), currentPrice);
        if (peak > position.getEntryPrice()) {
            double trigger = peak * (1.0 - trailingStopPct(position));
            if (currentPrice <= trigger) {
                log.warn("🛑 {} trailing stop: price {} <= {} (peak {})",
                    position.getSymbol(), fmt(currentPrice), fmt(trigger), fmt(peak));
                return Optional.of(ExitReason.TRAILING_STOP);
            }
        }
        return Optional.empty();
    }

    /**
     * Static stop percentage for the position, including any volatility widening.
     */
    public double staticStopPct(Position position) {
        double pct = limits.staticStopPctFor(position.getEntryQuality());
        if (isHighVolatility(position.getSymbol())) {
            pct *= limits.volatilityStopMultiplier();
        }
        return pct;
    }

    public double staticStopPrice(Position position) {
        return position.getEntryPrice() * (1.0 - staticStopPct(position));
    }

    public double trailingStopPct(Position position) {
        return Math.min(limits.trailingStopPct(), staticStopPct(position));
    }

    /**
     * Trailing trigger price given the current peak, or empty while the trailing stop is not armed.
     */
    public Optional<Double> trailingStopPrice(Position position) {
        if (position.getHighestPrice() <= position.getEntryPrice()) {
            return Optional.empty();
        }
        return Optional.of(position.getHighestPrice() * (1.0 - trailingStopPct(position)));
    }

    /**
     * Adds a price observation to the symbol's volatility window.
     */
    public void observePrice(String symbol, double price) {
        Deque<Double> window = priceHistory.computeIfAbsent(symbol, s -> new ArrayDeque<>());
        window.addLast(price);
        while (window.size() > limits.volatilityLookbackTicks()) {
            window.removeFirst();
        }
    }

    public void forget(String symbol) {
        priceHistory.remove(symbol);
    }

    /**
     * Annualized volatility of log returns over the observed window, 0 when fewer than three prices.
     */
    public double realizedVolatility(String symbol) {
        Deque<Double> window = priceHistory.get(symbol);
        if (window == null || window.size() < 3) {
            return 0.0;
        }
        double[] returns = new double[window.size() - 1];
        Double previous = null;
        int i = 0;
        for (Double price : window) {
            if (previous != null) {
                returns[i++] = previous > 0 && price > 0 ? Math.log(price / previous) : 0.0;
            }
            previous = price;
        }
        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double sum = 0;
        for (double r : returns) {
            sum += (r - mean) * (r - mean);
        }
        return Math.sqrt(sum / (returns.length - 1)) * Math.sqrt(periodsPerYear);
    }

    public boolean isHighVolatility(String symbol) {
        return realizedVolatility(symbol) > limits.highVolatilityThreshold();
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
