package tw.gc.factor.backtest.services.risk;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.config.RiskLimits;

import java.time.LocalDate;

/**
 * Portfolio-level drawdown monitor.
 *
 * <p>Tracks the running peak of recorded portfolio values. Crossing the maximum drawdown switches
 * the run into defensive mode and reports a breach exactly once; the caller then moves the
 * configured fraction of exposure to cash. Defensive mode ends when drawdown is back within the
 * limit, after which a new breach can fire again.
 */
@Slf4j
public class DrawdownGuard {

    private final RiskLimits limits;

    private double peakValue;

    @Getter
    private boolean defensive;

    @Getter
    private double currentDrawdown;

    public DrawdownGuard(RiskLimits limits) {
        this.limits = limits;
    }

    /**
     * Updates the peak with {@code value} and returns true if this observation starts a new breach.
     */
    public boolean update(LocalDate date, double value) {
        peakValue = Math.max(peakValue, value);
        currentDrawdown = peakValue > 0 ? (peakValue - value) / peakValue : 0.0;

        if (currentDrawdown > limits.maxPortfolioDrawdownPct()) {
            if (!defensive) {
                defensive = true;
                log.warn("🚨 DRAWDOWN BREACH on {}: {}% from peak {} (limit {}%)", date,
                    String.format("%.2f", currentDrawdown * 100), String.format("%.2f", peakValue),
                    String.format("%.2f", limits.maxPortfolioDrawdownPct() * 100));
                return true;
            }
            return false;
        }
        if (defensive) {
            defensive = false;
            log.info("✅ Drawdown back within limit on {} ({}%), leaving defensive mode", date,
                String.format("%.2f", currentDrawdown * 100));
        }
        return false;
    }

    /**
     * Fraction of portfolio value rebalances may invest while in the current mode.
     */
    public double investedFraction() {
        return defensive ? 1.0 - limits.drawdownLiquidationFraction() : 1.0;
    }
}
