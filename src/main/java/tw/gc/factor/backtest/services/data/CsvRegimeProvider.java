package tw.gc.factor.backtest.services.data;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.enums.MarketTrend;
import tw.gc.factor.backtest.enums.VolatilityRegime;
import tw.gc.factor.backtest.strategy.RegimeProvider;
import tw.gc.factor.backtest.strategy.RegimeSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Regime classifications from a CSV with columns {@code date,trend,volatility} and an optional
 * {@code cash_allocation}. The latest classification on or before a date applies.
 */
@Slf4j
public class CsvRegimeProvider implements RegimeProvider {

    private final NavigableMap<LocalDate, RegimeSnapshot> regimes;

    public CsvRegimeProvider(Path file) {
        this.regimes = load(file);
    }

    @Override
    public Optional<RegimeSnapshot> regimeAt(LocalDate date) {
        Map.Entry<LocalDate, RegimeSnapshot> entry = regimes.floorEntry(date);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    private static NavigableMap<LocalDate, RegimeSnapshot> load(Path file) {
        try {
            CsvFiles.Table table = CsvFiles.read(file);
            int date = table.requireColumn("date", file);
            int trend = table.requireColumn("trend", file);
            int volatility = table.requireColumn("volatility", file);
            int cash = table.column("cash_allocation");

            NavigableMap<LocalDate, RegimeSnapshot> byDate = new TreeMap<>();
            CsvFiles.parseRows(table, file, row -> {
                OptionalDouble cashAllocation = cash >= 0 && cash < row.length && !row[cash].isEmpty()
                    ? OptionalDouble.of(Double.parseDouble(row[cash]))
                    : OptionalDouble.empty();
                RegimeSnapshot snapshot = new RegimeSnapshot(
                    MarketTrend.valueOf(row[trend].toUpperCase(Locale.ROOT)),
                    VolatilityRegime.valueOf(row[volatility].toUpperCase(Locale.ROOT)),
                    Optional.empty(),
                    cashAllocation);
                byDate.put(LocalDate.parse(row[date]), snapshot);
                return snapshot;
            });
            log.info("📥 Loaded {} regime classifications from {}", byDate.size(), file);
            return byDate;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read regimes from " + file, e);
        }
    }
}
