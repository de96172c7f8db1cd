package tw.gc.factor.backtest.services.risk;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.config.ReEntryRules;
import tw.gc.factor.backtest.entities.StopRecord;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a stopped-out symbol may be bought again.
 *
 * <p>The most recent stop per symbol governs: inside its lookback window the symbol is only
 * eligible when current fundamentals are strictly above the configured threshold. After the
 * window it is eligible unconditionally.
 *
 * <p>Every stop is also followed for the length of the window to see whether the price came
 * back to the entry price; recoveries within {@value #FALSE_POSITIVE_DAYS} days count as
 * false-positive stops.
 */
@Slf4j
public class ReEntryTracker {

    static final int FALSE_POSITIVE_DAYS = 30;

    private final ReEntryRules rules;
    private final Map<String, StopRecord> latestStops = new HashMap<>();
    private final List<StopRecord> history = new ArrayList<>();

    public ReEntryTracker(ReEntryRules rules) {
        this.rules = rules;
    }

    public StopRecord recordStop(String symbol, LocalDate date, double fundamentalsScore) {
        return recordStop(symbol, date, fundamentalsScore, 0.0, 0.0);
    }

    public StopRecord recordStop(String symbol, LocalDate date, double fundamentalsScore,
                                 double exitPrice, double entryPrice) {
        StopRecord record = StopRecord.builder()
            .symbol(symbol)
            .stopDate(date)
            .fundamentalsScore(fundamentalsScore)
            .exitPrice(exitPrice)
            .entryPrice(entryPrice)
            .maxPriceAfterExit(exitPrice)
            .build();
        latestStops.put(symbol, record);
        history.add(record);
        log.info("📝 Stop recorded for {} on {} (fundamentals {})", symbol, date,
            String.format("%.1f", fundamentalsScore));
        return record;
    }

    public boolean canRebuy(String symbol, double currentFundamentals, LocalDate asOf) {
        StopRecord record = latestStops.get(symbol);
        if (record == null || !record.isActiveOn(asOf, rules.lookbackDays())) {
            return true;
        }
        boolean eligible = currentFundamentals > rules.fundamentalsThreshold();
        if (!eligible) {
            log.debug("{} blocked for re-entry until {} (fundamentals {} <= {})", symbol,
                record.getStopDate().plusDays(rules.lookbackDays()), currentFundamentals,
                rules.fundamentalsThreshold());
        }
        return eligible;
    }

    public boolean hasActiveStop(String symbol, LocalDate asOf) {
        StopRecord record = latestStops.get(symbol);
        return record != null && record.isActiveOn(asOf, rules.lookbackDays());
    }

    /**
     * Follows post-stop prices of the symbol for recovery statistics.
     */
    public void observePrice(String symbol, LocalDate date, double price) {
        for (StopRecord record : history) {
            if (!record.getSymbol().equals(symbol) || !date.isAfter(record.getStopDate())
                || !record.isActiveOn(date, rules.lookbackDays())) {
                continue;
            }
            record.setMaxPriceAfterExit(Math.max(record.getMaxPriceAfterExit(), price));
            if (!record.isRecovered() && record.getEntryPrice() > 0 && price >= record.getEntryPrice()) {
                record.setRecovered(true);
                record.setRecoveryDate(date);
                log.debug("{} recovered to entry price {} on {}", symbol, record.getEntryPrice(), date);
            }
        }
    }

    /**
     * Symbols with a stop still inside its lookback window on {@code date}, in stop order.
     */
    public Set<String> trackedSymbols(LocalDate date) {
        Set<String> symbols = new LinkedHashSet<>();
        for (StopRecord record : history) {
            if (record.isActiveOn(date, rules.lookbackDays())) {
                symbols.add(record.getSymbol());
            }
        }
        return symbols;
    }

    public List<StopRecord> history() {
        return Collections.unmodifiableList(history);
    }

    public int recoveredCount() {
        return (int) history.stream().filter(StopRecord::isRecovered).count();
    }

    public int falsePositiveCount() {
        return (int) history.stream()
            .filter(StopRecord::isRecovered)
            .filter(r -> ChronoUnit.DAYS.between(r.getStopDate(), r.getRecoveryDate()) <= FALSE_POSITIVE_DAYS)
            .count();
    }
}
