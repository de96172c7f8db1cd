package tw.gc.factor.backtest.services.data;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Shared CSV reading for the file-backed data collaborators.
 */
@Slf4j
final class CsvFiles {

    private CsvFiles() {
    }

    /**
     * Parsed rows of a comma-separated file whose first non-blank line is a header.
     */
    record Table(List<String> header, List<String[]> rows) {

        int column(String name) {
            return header.indexOf(name.toLowerCase(Locale.ROOT));
        }

        int requireColumn(String name, Path file) {
            int index = column(name);
            if (index < 0) {
                throw new IllegalStateException("Column '" + name + "' missing in " + file + ", header: " + header);
            }
            return index;
        }
    }

    static Table read(Path file) throws IOException {
        List<String> header = null;
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] cells = line.split(",", -1);
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = cells[i].trim();
                }
                if (header == null) {
                    List<String> names = new ArrayList<>();
                    for (String cell : cells) {
                        names.add(cell.toLowerCase(Locale.ROOT));
                    }
                    header = names;
                    continue;
                }
                rows.add(cells);
            }
        }
        return new Table(header != null ? header : List.of(), rows);
    }

    /**
     * Applies {@code parser} to every row, logging and skipping rows it rejects.
     */
    static <T> List<T> parseRows(Table table, Path file, Function<String[], T> parser) {
        List<T> items = new ArrayList<>();
        int skipped = 0;
        for (String[] row : table.rows()) {
            try {
                T item = parser.apply(row);
                if (item != null) {
                    items.add(item);
                }
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Failed to parse CSV line in {}: {} ({})", file.getFileName(), String.join(",", row),
                    e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("{} unparseable lines skipped in {}", skipped, file);
        }
        return items;
    }
}
