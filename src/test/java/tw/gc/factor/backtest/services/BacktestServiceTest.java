package tw.gc.factor.backtest.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.factor.backtest.config.BacktestConfig;
import tw.gc.factor.backtest.config.FactorWeights;
import tw.gc.factor.backtest.config.RiskLimits;
import tw.gc.factor.backtest.entities.BacktestResult;
import tw.gc.factor.backtest.entities.ClosedTrade;
import tw.gc.factor.backtest.entities.EquityPoint;
import tw.gc.factor.backtest.entities.RebalanceEvent;
import tw.gc.factor.backtest.entities.SelectionSummary;
import tw.gc.factor.backtest.entities.TradeLogEntry;
import tw.gc.factor.backtest.enums.ExitReason;
import tw.gc.factor.backtest.enums.MarketTrend;
import tw.gc.factor.backtest.enums.TradeAction;
import tw.gc.factor.backtest.enums.VolatilityRegime;
import tw.gc.factor.backtest.exceptions.BacktestConfigurationException;
import tw.gc.factor.backtest.services.performance.PerformanceAnalyzer;
import tw.gc.factor.backtest.services.positionsizing.ConvictionPositionSizer;
import tw.gc.factor.backtest.services.regime.AdaptiveWeightService;
import tw.gc.factor.backtest.services.scoring.MomentumVetoFilter;
import tw.gc.factor.backtest.services.scoring.UniverseScoringService;
import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.FactorScores;
import tw.gc.factor.backtest.strategy.PriceProvider;
import tw.gc.factor.backtest.strategy.RegimeProvider;
import tw.gc.factor.backtest.strategy.RegimeSnapshot;
import tw.gc.factor.backtest.testutil.InMemoryFactorScorer;
import tw.gc.factor.backtest.testutil.InMemoryPriceProvider;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static tw.gc.factor.backtest.testutil.BacktestTestFactory.config;

@ExtendWith(MockitoExtension.class)
@DisplayName("BacktestService")
class BacktestServiceTest {

    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_15 = LocalDate.of(2024, 1, 15);
    private static final LocalDate JAN_16 = LocalDate.of(2024, 1, 16);
    private static final LocalDate JAN_19 = LocalDate.of(2024, 1, 19);
    private static final LocalDate FEB_1 = LocalDate.of(2024, 2, 1);
    private static final LocalDate FEB_2 = LocalDate.of(2024, 2, 2);
    private static final LocalDate FEB_29 = LocalDate.of(2024, 2, 29);

    @Mock
    private PriceProvider mockPrices;

    @Mock
    private FactorScorer mockScorer;

    @Mock
    private RegimeProvider regimeProvider;

    private static BacktestService service(PriceProvider prices, FactorScorer scorer, Optional<RegimeProvider> regimes) {
        return new BacktestService(prices, scorer, regimes, new UniverseScoringService(), new MomentumVetoFilter(),
            new ConvictionPositionSizer(), new AdaptiveWeightService(), new PerformanceAnalyzer());
    }

    private static BacktestService service(PriceProvider prices, FactorScorer scorer) {
        return service(prices, scorer, Optional.empty());
    }

    private static List<TradeLogEntry> buys(BacktestResult result) {
        return result.tradeLog().stream().filter(t -> t.action() == TradeAction.BUY).toList();
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("should buy only the top-ranked symbol when top N is one")
        void buysOnlyTopRanked() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, JAN_19, 100)
                .flat("Y", JAN_2, JAN_19, 100);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90).always("Y", 10);

            BacktestResult result = service(prices, scorer).run(config(JAN_2, JAN_19, List.of("X", "Y"), 1).build());

            assertThat(result.rebalances()).hasSize(1);
            assertThat(result.rebalances().get(0).selected()).containsExactly("X");
            assertThat(result.tradeLog()).singleElement().satisfies(trade -> {
                assertThat(trade.action()).isEqualTo(TradeAction.BUY);
                assertThat(trade.symbol()).isEqualTo("X");
                assertThat(trade.rank()).isEqualTo(1);
                assertThat(trade.compositeScore()).isCloseTo(90.0, within(1e-9));
            });
            assertThat(result.truncated()).isFalse();
        }

        @Test
        @DisplayName("should never veto an exempt symbol with weak momentum")
        void exemptSymbolSelected() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("AAPL", JAN_2, JAN_19, 180)
                .flat("ZZZ", JAN_2, JAN_19, 20);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer()
                .always("AAPL", new FactorScores(80, 30, 80, 80))
                .always("ZZZ", new FactorScores(60, 30, 60, 60));

            BacktestResult result = service(prices, scorer).run(config(JAN_2, JAN_19, List.of("AAPL", "ZZZ"), 2).build());

            RebalanceEvent event = result.rebalances().get(0);
            assertThat(event.selected()).containsExactly("AAPL");
            assertThat(event.vetoed()).isEqualTo(1);
            assertThat(buys(result)).extracting(TradeLogEntry::symbol).containsExactly("AAPL");
        }

        @Test
        @DisplayName("should skip symbols whose scoring fails and note the failure")
        void scoringFailureSkipsSymbol() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, JAN_19, 100)
                .flat("BAD", JAN_2, JAN_19, 100)
                .flat("Y", JAN_2, JAN_19, 100);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90).always("Y", 70).failing("BAD");

            BacktestResult result = service(prices, scorer).run(config(JAN_2, JAN_19, List.of("X", "BAD", "Y"), 2).build());

            assertThat(buys(result)).extracting(TradeLogEntry::symbol).containsExactly("X", "Y");
            assertThat(result.metadata().scoringFailures()).isEqualTo(1);
            assertThat(result.metadata().notes()).anyMatch(note -> note.contains("BAD"));
        }
    }

    @Nested
    @DisplayName("Cash and costs")
    class CashAndCosts {

        @Test
        @DisplayName("should keep shares x price x (1 + cost) within capital less the reserve")
        void buyFitsCapitalAfterReserve() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider().flat("X", JAN_2, JAN_19, 100);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90);
            BacktestConfig cfg = config(JAN_2, JAN_19, List.of("X"), 1)
                .initialCapital(10_000)
                .transactionCostRate(0.001)
                .cashReservePct(0.01)
                .build();

            BacktestResult result = service(prices, scorer).run(cfg);

            TradeLogEntry buy = result.tradeLog().get(0);
            double spent = buy.shares() * buy.price() * (1 + 0.001);
            assertThat(spent).isLessThanOrEqualTo(10_000 * (1 - 0.01) + 1e-6);
            assertThat(spent).isCloseTo(9_900, within(1e-6));
            assertThat(buy.transactionCost()).isCloseTo(buy.notional() * 0.001, within(1e-9));
            assertThat(buy.scaledDown()).isTrue();
            assertThat(result.equityCurve().get(0).cash()).isCloseTo(100, within(1e-6));
        }

        @Test
        @DisplayName("should invest only what the regime leaves after its cash allocation")
        void regimeCashAllocation() {
            when(regimeProvider.regimeAt(any())).thenReturn(Optional.of(new RegimeSnapshot(
                MarketTrend.BULL, VolatilityRegime.NORMAL, Optional.empty(), OptionalDouble.of(0.3))));
            InMemoryPriceProvider prices = new InMemoryPriceProvider().flat("X", JAN_2, JAN_19, 100);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90);

            BacktestResult result = service(prices, scorer, Optional.of(regimeProvider))
                .run(config(JAN_2, JAN_19, List.of("X"), 1).adaptiveWeights(true).build());

            RebalanceEvent event = result.rebalances().get(0);
            assertThat(event.regime()).isEqualTo("BULL_NORMAL_VOL");
            assertThat(event.weights()).isEqualTo(new FactorWeights(0.40, 0.30, 0.20, 0.10));
            assertThat(event.investedFraction()).isCloseTo(0.7, within(1e-9));
            TradeLogEntry buy = result.tradeLog().get(0);
            assertThat(buy.notional() + buy.transactionCost()).isCloseTo(70_000, within(1e-6));
            assertThat(buy.scaledDown()).isFalse();
        }
    }

    @Nested
    @DisplayName("Risk overlays")
    class RiskOverlays {

        @Test
        @DisplayName("should stop out a falling position and block its re-entry while fundamentals stay weak")
        void stopLossThenReEntryBlocked() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, JAN_15, 100)
                .flat("X", JAN_16, FEB_29, 85)
                .flat("Y", JAN_2, FEB_29, 50);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer()
                .always("X", new FactorScores(50, 80, 40, 50))
                .always("Y", new FactorScores(55, 55, 55, 20));
            BacktestConfig cfg = config(JAN_2, FEB_29, List.of("X", "Y"), 1)
                .riskLimits(RiskLimits.DEFAULT.withMaxPortfolioDrawdownPct(0.5))
                .build();

            BacktestResult result = service(prices, scorer).run(cfg);

            assertThat(result.closedTrades()).singleElement().satisfies(trade -> {
                assertThat(trade.symbol()).isEqualTo("X");
                assertThat(trade.exitReason()).isEqualTo(ExitReason.STOP_LOSS);
                assertThat(trade.exitDate()).isEqualTo(JAN_16);
                assertThat(trade.pnl()).isNegative();
            });
            RebalanceEvent february = result.rebalances().get(1);
            assertThat(february.date()).isEqualTo(FEB_2);
            assertThat(february.reEntryBlocked()).isEqualTo(1);
            assertThat(february.selected()).containsExactly("Y");
            assertThat(buys(result)).extracting(TradeLogEntry::symbol).containsExactly("X", "Y");
            assertThat(result.exitStatistics().stopsRecorded()).isEqualTo(1);
            assertThat(result.exitStatistics().exitsByReason()).containsEntry(ExitReason.STOP_LOSS, 1);
        }

        @Test
        @DisplayName("should trim exposure on a drawdown breach and invest less while defensive")
        void drawdownBreachTrimsExposure() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, JAN_15, 100)
                .flat("X", JAN_16, FEB_29, 80);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", new FactorScores(80, 80, 90, 80));

            BacktestResult result = service(prices, scorer).run(config(JAN_2, FEB_29, List.of("X"), 1).build());

            double bought = result.tradeLog().get(0).shares();
            assertThat(result.closedTrades()).singleElement().satisfies(trade -> {
                assertThat(trade.exitReason()).isEqualTo(ExitReason.REGIME_REDUCTION);
                assertThat(trade.exitDate()).isEqualTo(JAN_16);
                assertThat(trade.shares()).isCloseTo(bought / 2, within(1e-9));
            });
            assertThat(result.rebalances().get(1).investedFraction()).isEqualTo(0.5);
            assertThat(buys(result)).hasSize(1);
            assertThat(result.metadata().notes()).anyMatch(note -> note.contains("drawdown"));
        }

        @Test
        @DisplayName("should not apply stops when risk management is off")
        void riskManagementOff() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, JAN_15, 100)
                .flat("X", JAN_16, JAN_19, 50);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90);

            BacktestResult result = service(prices, scorer)
                .run(config(JAN_2, JAN_19, List.of("X"), 1).riskManagementEnabled(false).build());

            assertThat(result.closedTrades()).isEmpty();
            assertThat(result.metrics().maxDrawdown()).isGreaterThan(0.4);
        }

        @Test
        @DisplayName("should sell a held name whose score deteriorated and keep it out of the cycle")
        void scoreDeterioration() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .flat("X", JAN_2, FEB_29, 100)
                .flat("Y", JAN_2, FEB_29, 50);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer()
                .always("X", 90)
                .from("X", FEB_1, InMemoryFactorScorer.uniform(60))
                .always("Y", 55);

            BacktestResult result = service(prices, scorer).run(config(JAN_2, FEB_29, List.of("X", "Y"), 1).build());

            assertThat(result.closedTrades()).singleElement().satisfies(trade -> {
                assertThat(trade.symbol()).isEqualTo("X");
                assertThat(trade.exitReason()).isEqualTo(ExitReason.SCORE_DETERIORATION);
                assertThat(trade.exitDate()).isEqualTo(FEB_2);
            });
            assertThat(result.rebalances().get(1).selected()).containsExactly("Y");
        }
    }

    @Nested
    @DisplayName("Ledger and reproducibility")
    class LedgerAndReproducibility {

        private final LocalDate end = LocalDate.of(2024, 6, 28);

        private BacktestResult richRun() {
            InMemoryPriceProvider prices = new InMemoryPriceProvider()
                .trending("AAA", JAN_2, end, 50, 0.004)
                .trending("BBB", JAN_2, end, 80, -0.01)
                .trending("CCC", JAN_2, end, 120, 0.001)
                .trending("DDD", JAN_2, end, 30, -0.002)
                .trending("EEE", JAN_2, end, 200, 0.002)
                .trending("SPY", JAN_2, end, 470, 0.0015);
            InMemoryFactorScorer scorer = new InMemoryFactorScorer()
                .always("AAA", new FactorScores(70, 75, 80, 60))
                .always("BBB", new FactorScores(85, 70, 45, 70))
                .from("BBB", LocalDate.of(2024, 3, 1), new FactorScores(60, 55, 45, 50))
                .always("CCC", new FactorScores(60, 60, 60, 60))
                .always("DDD", new FactorScores(50, 40, 50, 50))
                .always("EEE", new FactorScores(66, 66, 72, 40));
            BacktestConfig cfg = config(JAN_2, end, List.of("AAA", "BBB", "CCC", "DDD", "EEE"), 3)
                .scoringParallelism(4)
                .build();
            return service(prices, scorer).run(cfg);
        }

        @Test
        @DisplayName("identical inputs should produce identical results")
        void deterministic() {
            BacktestResult first = richRun();
            BacktestResult second = richRun();

            assertThat(second).isEqualTo(first);
            assertThat(first.tradeLog()).isNotEmpty();
        }

        @Test
        @DisplayName("every recorded value should equal cash plus marked positions and cash should replay from trades")
        void ledgerIdentity() {
            BacktestResult result = richRun();

            for (EquityPoint point : result.equityCurve()) {
                assertThat(point.totalValue()).isCloseTo(point.cash() + point.positionsValue(), within(1e-6));
                assertThat(point.cash()).isGreaterThanOrEqualTo(-1e-6);
            }

            double cash = result.config().initialCapital();
            Map<String, Double> open = new HashMap<>();
            for (TradeLogEntry trade : result.tradeLog()) {
                if (trade.action() == TradeAction.BUY) {
                    assertThat(open).as("second open position in %s", trade.symbol()).doesNotContainKey(trade.symbol());
                    open.put(trade.symbol(), trade.shares());
                    cash -= trade.notional() + trade.transactionCost();
                } else {
                    assertThat(open).containsKey(trade.symbol());
                    double remaining = open.get(trade.symbol()) - trade.shares();
                    assertThat(remaining).isGreaterThanOrEqualTo(-1e-9);
                    if (remaining <= 1e-9) {
                        open.remove(trade.symbol());
                    } else {
                        open.put(trade.symbol(), remaining);
                    }
                    cash += trade.notional() - trade.transactionCost();
                }
            }
            EquityPoint last = result.equityCurve().get(result.equityCurve().size() - 1);
            assertThat(last.cash()).isCloseTo(cash, within(1e-6));
            assertThat(result.rebalances()).allSatisfy(event -> assertThat(event.selected()).hasSizeLessThanOrEqualTo(3));
        }

        @Test
        @DisplayName("should stop the falling name and report benchmark-relative metrics")
        void richRunMetrics() {
            BacktestResult result = richRun();

            assertThat(result.closedTrades()).extracting(ClosedTrade::symbol).contains("BBB");
            assertThat(result.metrics().benchmarkReturn()).isNotNull();
            assertThat(result.metrics().beta()).isNotNull();
            assertThat(result.metrics().buyAndHoldReturn()).isNotNull();
            assertThat(result.metadata().biasCaveats()).isNotEmpty();
            assertThat(result.metadata().dataSource()).isEqualTo("in-memory");
            assertThat(result.bestPerformers()).isNotEmpty().hasSizeLessThanOrEqualTo(10);
            assertThat(result.bestPerformers()).extracting(SelectionSummary::symbol).contains("AAA");
            assertThat(result.worstPerformers()).hasSameSizeAs(result.bestPerformers());
        }
    }

    @Nested
    @DisplayName("Data failures")
    class DataFailures {

        @Test
        @DisplayName("should finish the run when price lookups throw for a held symbol and the benchmark")
        void priceLookupFailuresDoNotAbort() {
            LocalDate jan10 = LocalDate.of(2024, 1, 10);
            InMemoryPriceProvider quotes = new InMemoryPriceProvider().flat("X", JAN_2, JAN_19, 100);
            PriceProvider flaky = (symbol, date) -> {
                if (symbol.equals("SPY")) {
                    throw new IllegalStateException("benchmark feed down");
                }
                if (symbol.equals("X") && date.equals(jan10)) {
                    throw new IllegalStateException("quote service timeout");
                }
                return quotes.priceAt(symbol, date);
            };
            InMemoryFactorScorer scorer = new InMemoryFactorScorer().always("X", 90);
            BacktestService service = service(flaky, scorer);
            BacktestConfig cfg = config(JAN_2, JAN_19, List.of("X"), 1).build();

            assertThatCode(() -> service.run(cfg)).doesNotThrowAnyException();
            BacktestResult result = service.run(cfg);

            assertThat(result.equityCurve()).hasSize(14);
            EquityPoint jan9 = result.equityCurve().get(5);
            EquityPoint tenth = result.equityCurve().get(6);
            assertThat(tenth.date()).isEqualTo(jan10);
            assertThat(tenth.totalValue()).isCloseTo(jan9.totalValue(), within(1e-9));
            assertThat(result.closedTrades()).isEmpty();
            assertThat(result.metrics().benchmarkReturn()).isNull();
            assertThat(result.metadata().priceLookupFailures()).isGreaterThanOrEqualTo(14 + 2);
            assertThat(result.metadata().notes())
                .anyMatch(note -> note.contains("price lookup for X failed"))
                .anyMatch(note -> note.contains("benchmark SPY has no price history"));
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationErrors {

        @Test
        @DisplayName("should fail before touching collaborators when weights do not sum to one")
        void invalidWeights() {
            BacktestConfig cfg = config(JAN_2, JAN_19, List.of("X"), 1)
                .weights(new FactorWeights(0.5, 0.3, 0.2, 0.1))
                .build();

            assertThatThrownBy(() -> service(mockPrices, mockScorer).run(cfg))
                .isInstanceOf(BacktestConfigurationException.class)
                .hasMessageContaining("weights");
            verifyNoInteractions(mockPrices, mockScorer);
        }

        @Test
        @DisplayName("should reject top N above universe size and inverted ranges")
        void invalidShape() {
            BacktestService service = service(mockPrices, mockScorer);

            assertThatThrownBy(() -> service.run(config(JAN_2, JAN_19, List.of("X"), 2).build()))
                .isInstanceOf(BacktestConfigurationException.class);
            assertThatThrownBy(() -> service.run(config(JAN_19, JAN_2, List.of("X"), 1).build()))
                .isInstanceOf(BacktestConfigurationException.class);
            verifyNoInteractions(mockPrices, mockScorer);
        }

        @Test
        @DisplayName("should require a regime provider for adaptive weighting")
        void adaptiveWithoutProvider() {
            BacktestConfig cfg = config(JAN_2, JAN_19, List.of("X"), 1).adaptiveWeights(true).build();

            assertThatThrownBy(() -> service(mockPrices, mockScorer).run(cfg))
                .isInstanceOf(BacktestConfigurationException.class)
                .hasMessageContaining("adaptiveWeights");
        }
    }

    @Test
    @DisplayName("should return a truncated result for the completed prefix when cancelled")
    void cancellationTruncates() {
        LocalDate end = LocalDate.of(2024, 4, 30);
        BacktestCancellation cancellation = BacktestCancellation.none();
        InMemoryPriceProvider prices = new InMemoryPriceProvider().flat("X", JAN_2, end, 100);
        InMemoryFactorScorer base = new InMemoryFactorScorer().always("X", 90);
        FactorScorer cancelling = (symbol, asOf) -> {
            if (!asOf.isBefore(FEB_1)) {
                cancellation.cancel("stop requested");
            }
            return base.score(symbol, asOf);
        };

        BacktestResult result = service(prices, cancelling).run(config(JAN_2, end, List.of("X"), 1).build(), cancellation);

        assertThat(result.truncated()).isTrue();
        assertThat(result.truncationReason()).isEqualTo("stop requested");
        assertThat(result.rebalances()).hasSize(2);
        EquityPoint last = result.equityCurve().get(result.equityCurve().size() - 1);
        assertThat(last.date()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(result.metrics().finalValue()).isEqualTo(last.totalValue());
    }
}
