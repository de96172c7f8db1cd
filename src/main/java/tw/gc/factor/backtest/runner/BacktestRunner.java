package tw.gc.factor.backtest.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tw.gc.factor.backtest.config.BacktestConfig;
import tw.gc.factor.backtest.config.BacktestProperties;
import tw.gc.factor.backtest.entities.BacktestResult;
import tw.gc.factor.backtest.entities.RebalanceEvent;
import tw.gc.factor.backtest.entities.SelectionSummary;
import tw.gc.factor.backtest.exceptions.BacktestConfigurationException;
import tw.gc.factor.backtest.services.BacktestService;
import tw.gc.factor.backtest.services.performance.PerformanceMetrics;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Runs one backtest from {@code backtest.*} properties at startup and writes the result as JSON.
 * Enable with {@code --backtest.enabled=true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "backtest", name = "enabled", havingValue = "true")
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties properties;
    private final BacktestService backtestService;
    private final BacktestResultWriter resultWriter;

    @Override
    public void run(ApplicationArguments args) {
        Path prices = Path.of(properties.getData().getPricesDirectory());
        Path scores = Path.of(properties.getData().getScoresFile());
        if (!Files.isDirectory(prices)) {
            throw new BacktestConfigurationException("data.pricesDirectory", "not a directory: " + prices);
        }
        if (!Files.isRegularFile(scores)) {
            throw new BacktestConfigurationException("data.scoresFile", "not a file: " + scores);
        }

        BacktestConfig config = properties.toConfig();
        logSection("BACKTEST START");
        log.info("[Overview] universe={} from={} to={} cadence={} topN={} weights={} adaptive={}",
            config.universe(), config.startDate(), config.endDate(), config.cadence().getCode(),
            config.topN(), config.weights().describe(), config.adaptiveWeights());

        BacktestResult result = backtestService.run(config);

        logSection("REBALANCES");
        for (RebalanceEvent event : result.rebalances()) {
            log.info("[Rebalance] {} regime={} selected={} avgScore={} invested={}", event.date(), event.regime(),
                event.selected(), String.format(Locale.US, "%.1f", event.averageScore()),
                formatPercent(event.investedFraction()));
        }

        logSection("SELECTIONS");
        for (SelectionSummary best : result.bestPerformers()) {
            log.info("[Best] {} selected={} avgScore={}", best.symbol(), best.timesSelected(),
                String.format(Locale.US, "%.1f", best.averageScore()));
        }
        for (SelectionSummary worst : result.worstPerformers()) {
            log.info("[Worst] {} selected={} avgScore={}", worst.symbol(), worst.timesSelected(),
                String.format(Locale.US, "%.1f", worst.averageScore()));
        }

        logSection("SUMMARY");
        PerformanceMetrics m = result.metrics();
        log.info("[Summary] final={} totalReturn={} cagr={} vol={} sharpe={} sortino={} maxDD={} calmar={}",
            String.format(Locale.US, "%.2f", m.finalValue()), formatPercent(m.totalReturn()), formatPercent(m.cagr()),
            formatPercent(m.annualizedVolatility()), String.format(Locale.US, "%.2f", m.sharpeRatio()),
            String.format(Locale.US, "%.2f", m.sortinoRatio()), formatPercent(m.maxDrawdown()),
            String.format(Locale.US, "%.2f", m.calmarRatio()));
        log.info("[Summary] trades={} winRate={} benchmark={} buyAndHold={} alpha={} beta={}",
            m.totalTrades(), formatPercent(m.winRate()), formatNullablePercent(m.benchmarkReturn()),
            formatNullablePercent(m.buyAndHoldReturn()), formatNullablePercent(m.alpha()), m.beta());
        for (String caveat : result.metadata().biasCaveats()) {
            log.info("[Caveat] {}", caveat);
        }

        resultWriter.write(result, Path.of(properties.getOutput().getResultFile()));
        logSection("BACKTEST END");
    }

    private static void logSection(String title) {
        log.info("==================== {} ====================", title);
    }

    private static String formatPercent(double value) {
        return String.format(Locale.US, "%.2f%%", value * 100);
    }

    private static String formatNullablePercent(Double value) {
        return value != null ? formatPercent(value) : "n/a";
    }
}
