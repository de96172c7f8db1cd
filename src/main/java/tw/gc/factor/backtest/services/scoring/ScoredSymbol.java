package tw.gc.factor.backtest.services.scoring;

import tw.gc.factor.backtest.strategy.FactorScores;

import java.util.Comparator;

/**
 * A symbol with its sub-scores and the composite computed under one weight vector.
 */
public record ScoredSymbol(String symbol, FactorScores scores, double compositeScore) {

    /** composite descending, then symbol ascending */
    public static final Comparator<ScoredSymbol> RANKING = Comparator
        .comparingDouble(ScoredSymbol::compositeScore).reversed()
        .thenComparing(ScoredSymbol::symbol);

    public double quality() {
        return scores.quality();
    }

    public double fundamentals() {
        return scores.fundamentals();
    }

    public double momentum() {
        return scores.momentum();
    }
}
