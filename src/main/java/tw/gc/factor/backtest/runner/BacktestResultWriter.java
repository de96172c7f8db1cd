package tw.gc.factor.backtest.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.factor.backtest.entities.BacktestResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link BacktestResult} to pretty-printed JSON with ISO dates.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BacktestResultWriter {

    private final ObjectMapper objectMapper;

    public String toJson(BacktestResult result) {
        try {
            return objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backtest result", e);
        }
    }

    public Path write(BacktestResult result, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(result));
            log.info("💾 Backtest result written to {}", target.toAbsolutePath());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write backtest result to " + target, e);
        }
    }
}
