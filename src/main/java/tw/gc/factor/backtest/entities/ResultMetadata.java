package tw.gc.factor.backtest.entities;

import lombok.Builder;

import java.util.List;

/**
 * Provenance of a run: where the data came from and what it cannot be trusted for.
 *
 * @param priceLookupFailures price collaborator calls that threw, portfolio and benchmark side combined
 */
@Builder
public record ResultMetadata(
    String dataSource,
    List<String> biasCaveats,
    List<String> notes,
    int unavailableScores,
    int scoringFailures,
    int missingPrices,
    int priceLookupFailures
) {
    public ResultMetadata {
        biasCaveats = biasCaveats != null ? List.copyOf(biasCaveats) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
    }
}
