package tw.gc.factor.backtest.config;

import java.util.Set;

/**
 * Momentum veto thresholds.
 *
 * <p>A symbol is vetoed when momentum is below {@code hardFloor}, or when momentum is below
 * {@code softMomentum} while fundamentals are below {@code softFundamentals}. Symbols in
 * {@code exemptSymbols} are never vetoed.
 */
public record MomentumVetoRules(
    double hardFloor,
    double softMomentum,
    double softFundamentals,
    Set<String> exemptSymbols
) {
    public static final Set<String> MEGA_CAP_EXEMPTIONS =
        Set.of("AAPL", "MSFT", "GOOGL", "NVDA", "AMZN", "META", "TSLA");

    public static final MomentumVetoRules DEFAULT =
        new MomentumVetoRules(45.0, 50.0, 45.0, MEGA_CAP_EXEMPTIONS);

    public MomentumVetoRules {
        exemptSymbols = exemptSymbols != null ? Set.copyOf(exemptSymbols) : Set.of();
    }

    public boolean isExempt(String symbol) {
        return exemptSymbols.contains(symbol);
    }

    public MomentumVetoRules withExemptSymbols(Set<String> symbols) {
        return new MomentumVetoRules(hardFloor, softMomentum, softFundamentals, symbols);
    }
}
