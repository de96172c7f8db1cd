package tw.gc.factor.backtest.services.scoring;

import java.util.List;

/**
 * Result of scoring a universe on one date.
 *
 * @param ranked successfully scored symbols, best first
 * @param unavailable symbols the scorer had no data for
 * @param failures one note per symbol whose scoring threw or timed out
 */
public record ScoringOutcome(List<ScoredSymbol> ranked, List<String> unavailable, List<String> failures) {

    public ScoringOutcome {
        ranked = List.copyOf(ranked);
        unavailable = List.copyOf(unavailable);
        failures = List.copyOf(failures);
    }
}
