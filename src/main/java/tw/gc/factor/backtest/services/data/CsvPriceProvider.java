package tw.gc.factor.backtest.services.data;

import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.strategy.PriceProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Daily closing prices from one {@code <SYMBOL>.csv} file per symbol.
 *
 * <p>Files need a {@code date} column (ISO) and a {@code close} column; {@code adj_close} is
 * preferred when present. Files are loaded on first request and kept in memory. Only exact date
 * matches are returned, so weekends and holidays have no quote.
 */
@Slf4j
public class CsvPriceProvider implements PriceProvider {

    private final Path directory;
    private final Map<String, NavigableMap<LocalDate, Double>> cache = new ConcurrentHashMap<>();

    public CsvPriceProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public OptionalDouble priceAt(String symbol, LocalDate date) {
        Double price = cache.computeIfAbsent(symbol, this::load).get(date);
        return price != null ? OptionalDouble.of(price) : OptionalDouble.empty();
    }

    private NavigableMap<LocalDate, Double> load(String symbol) {
        Path file = directory.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            log.warn("⚠️ No price file for {} at {}", symbol, file);
            return Collections.emptyNavigableMap();
        }
        try {
            CsvFiles.Table table = CsvFiles.read(file);
            int dateColumn = table.requireColumn("date", file);
            int priceColumn = table.column("adj_close") >= 0 ? table.column("adj_close") : table.requireColumn("close", file);

            NavigableMap<LocalDate, Double> prices = new TreeMap<>();
            CsvFiles.parseRows(table, file, row -> {
                double close = Double.parseDouble(row[priceColumn]);
                if (!(close > 0)) {
                    throw new IllegalArgumentException("non-positive price " + close);
                }
                prices.put(LocalDate.parse(row[dateColumn]), close);
                return close;
            });
            log.debug("Loaded {} prices for {} from {}", prices.size(), symbol, file);
            return Collections.unmodifiableNavigableMap(prices);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prices for " + symbol + " from " + file, e);
        }
    }
}
