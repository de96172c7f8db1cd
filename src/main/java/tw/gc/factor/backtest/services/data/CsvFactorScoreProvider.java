package tw.gc.factor.backtest.services.data;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.FactorScores;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Precomputed factor scores from a single CSV with columns
 * {@code date,symbol,fundamentals,momentum,quality,sentiment}.
 *
 * <p>A lookup returns the most recent row on or before the requested date, never a later one.
 */
@Slf4j
public class CsvFactorScoreProvider implements FactorScorer {

    private final Path file;
    private volatile Map<String, NavigableMap<LocalDate, FactorScores>> scores;

    public CsvFactorScoreProvider(Path file) {
        this.file = file;
    }

    @Override
    public Optional<FactorScores> score(String symbol, LocalDate asOf) {
        NavigableMap<LocalDate, FactorScores> history = scores().get(symbol);
        if (history == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, FactorScores> entry = history.floorEntry(asOf);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    private Map<String, NavigableMap<LocalDate, FactorScores>> scores() {
        Map<String, NavigableMap<LocalDate, FactorScores>> loaded = scores;
        if (loaded == null) {
            synchronized (this) {
                loaded = scores;
                if (loaded == null) {
                    loaded = load();
                    scores = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, NavigableMap<LocalDate, FactorScores>> load() {
        try {
            CsvFiles.Table table = CsvFiles.read(file);
            int date = table.requireColumn("date", file);
            int symbol = table.requireColumn("symbol", file);
            int fundamentals = table.requireColumn("fundamentals", file);
            int momentum = table.requireColumn("momentum", file);
            int quality = table.requireColumn("quality", file);
            int sentiment = table.requireColumn("sentiment", file);

            Map<String, NavigableMap<LocalDate, FactorScores>> bySymbol = new HashMap<>();
            CsvFiles.parseRows(table, file, row -> {
                FactorScores parsed = new FactorScores(
                    Double.parseDouble(row[fundamentals]),
                    Double.parseDouble(row[momentum]),
                    Double.parseDouble(row[quality]),
                    Double.parseDouble(row[sentiment]));
                bySymbol.computeIfAbsent(row[symbol], s -> new TreeMap<>()).put(LocalDate.parse(row[date]), parsed);
                return parsed;
            });
            log.info("📥 Loaded factor scores for {} symbols from {}", bySymbol.size(), file);
            return bySymbol;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read factor scores from " + file, e);
        }
    }
}
