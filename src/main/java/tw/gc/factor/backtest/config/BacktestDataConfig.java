package tw.gc.factor.backtest.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.factor.backtest.services.data.CsvFactorScoreProvider;
import tw.gc.factor.backtest.services.data.CsvPriceProvider;
import tw.gc.factor.backtest.services.data.CsvRegimeProvider;
import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.PriceProvider;
import tw.gc.factor.backtest.strategy.RegimeProvider;

import java.nio.file.Path;

/**
 * File-backed data collaborators for the batch runner.
 */
@Configuration
@Slf4j
public class BacktestDataConfig {

    @Bean
    public PriceProvider priceProvider(BacktestProperties properties) {
        return new CsvPriceProvider(Path.of(properties.getData().getPricesDirectory()));
    }

    @Bean
    public FactorScorer factorScorer(BacktestProperties properties) {
        return new CsvFactorScoreProvider(Path.of(properties.getData().getScoresFile()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "backtest.data", name = "regimes-file")
    public RegimeProvider regimeProvider(BacktestProperties properties) {
        log.info("Regime classifications from {}", properties.getData().getRegimesFile());
        return new CsvRegimeProvider(Path.of(properties.getData().getRegimesFile()));
    }
}
