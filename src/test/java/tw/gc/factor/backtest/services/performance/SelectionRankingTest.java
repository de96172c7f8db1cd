package tw.gc.factor.backtest.services.performance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.factor.backtest.entities.RebalanceEvent;
import tw.gc.factor.backtest.entities.SelectionSummary;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SelectionRanking")
class SelectionRankingTest {

    private static RebalanceEvent event(LocalDate date, double averageScore, String... selected) {
        return RebalanceEvent.builder()
            .date(date)
            .selected(List.of(selected))
            .averageScore(averageScore)
            .build();
    }

    @Test
    @DisplayName("should average the scores of the rebalances that selected each symbol")
    void averagesAcrossRebalances() {
        List<RebalanceEvent> events = List.of(
            event(LocalDate.of(2024, 1, 2), 80, "AAA", "BBB"),
            event(LocalDate.of(2024, 2, 1), 60, "AAA", "CCC"),
            event(LocalDate.of(2024, 3, 1), 50, "DDD"));

        SelectionRanking ranking = SelectionRanking.of(events);

        assertThat(ranking.best(10)).containsExactly(
            new SelectionSummary("BBB", 1, 80.0),
            new SelectionSummary("AAA", 2, 70.0),
            new SelectionSummary("CCC", 1, 60.0),
            new SelectionSummary("DDD", 1, 50.0));
        assertThat(ranking.worst(2)).extracting(SelectionSummary::symbol).containsExactly("CCC", "DDD");
    }

    @Test
    @DisplayName("should cap both lists and break score ties by symbol")
    void capsAndTieBreaks() {
        List<RebalanceEvent> events = new ArrayList<>();
        String[] symbols = new String[12];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = String.format("S%02d", 11 - i);
        }
        events.add(event(LocalDate.of(2024, 1, 2), 70, symbols));

        SelectionRanking ranking = SelectionRanking.of(events);

        assertThat(ranking.best(SelectionRanking.DEFAULT_LIMIT)).hasSize(10)
            .first().extracting(SelectionSummary::symbol).isEqualTo("S00");
        assertThat(ranking.worst(SelectionRanking.DEFAULT_LIMIT)).hasSize(10)
            .last().extracting(SelectionSummary::symbol).isEqualTo("S11");
    }

    @Test
    @DisplayName("should be empty when nothing was ever selected")
    void emptyWhenNothingSelected() {
        SelectionRanking ranking = SelectionRanking.of(List.of(event(LocalDate.of(2024, 1, 2), 0)));

        assertThat(ranking.best(10)).isEmpty();
        assertThat(ranking.worst(10)).isEmpty();
    }
}
