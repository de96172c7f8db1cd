package tw.gc.factor.backtest.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.config.BacktestConfig;
import tw.gc.factor.backtest.entities.BacktestResult;
import tw.gc.factor.backtest.entities.ClosedTrade;
import tw.gc.factor.backtest.entities.EquityPoint;
import tw.gc.factor.backtest.entities.ExitStatistics;
import tw.gc.factor.backtest.entities.Position;
import tw.gc.factor.backtest.entities.RebalanceEvent;
import tw.gc.factor.backtest.entities.ResultMetadata;
import tw.gc.factor.backtest.entities.TradeLogEntry;
import tw.gc.factor.backtest.enums.ExitReason;
import tw.gc.factor.backtest.enums.TradeAction;
import tw.gc.factor.backtest.exceptions.BacktestConfigurationException;
import tw.gc.factor.backtest.services.performance.BenchmarkCurve;
import tw.gc.factor.backtest.services.performance.BenchmarkCurveBuilder;
import tw.gc.factor.backtest.services.performance.PerformanceAnalyzer;
import tw.gc.factor.backtest.services.performance.PerformanceMetrics;
import tw.gc.factor.backtest.services.performance.SelectionRanking;
import tw.gc.factor.backtest.services.positionsizing.ConvictionPositionSizer;
import tw.gc.factor.backtest.services.regime.AdaptiveWeightService;
import tw.gc.factor.backtest.services.regime.WeightDecision;
import tw.gc.factor.backtest.services.risk.DrawdownGuard;
import tw.gc.factor.backtest.services.risk.ReEntryTracker;
import tw.gc.factor.backtest.services.risk.RiskManager;
import tw.gc.factor.backtest.services.scoring.MomentumVetoFilter;
import tw.gc.factor.backtest.services.scoring.ScoredSymbol;
import tw.gc.factor.backtest.services.scoring.ScoringOutcome;
import tw.gc.factor.backtest.services.scoring.UniverseScoringService;
import tw.gc.factor.backtest.strategy.FactorScorer;
import tw.gc.factor.backtest.strategy.FactorScores;
import tw.gc.factor.backtest.strategy.PriceProvider;
import tw.gc.factor.backtest.strategy.RegimeProvider;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Chronological backtest of the multi-factor rebalancing strategy.
 *
 * <p>Every weekday between start and end is a tick. On each tick, in order:
 * <ol>
 *   <li>held positions are marked to the day's quotes</li>
 *   <li>stop-loss and trailing-stop exits (risk management on)</li>
 *   <li>portfolio drawdown check, trimming exposure on a new breach (risk management on)</li>
 *   <li>rebalance, when the tick is a rebalance date</li>
 *   <li>the portfolio value is recorded</li>
 * </ol>
 *
 * <p>A rebalance picks weights, scores the universe, drops symbols whose score deteriorated,
 * applies the momentum veto and the re-entry gate, ranks and keeps the top N, sizes them by
 * conviction, sells held names that fell out, and buys new names. Names held and still selected
 * are left as they are.
 *
 * <p>Runs are independent: all mutable state lives in a per-run {@link Simulation}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestService {

    private final PriceProvider priceProvider;
    private final FactorScorer factorScorer;
    private final Optional<RegimeProvider> regimeProvider;
    private final UniverseScoringService scoringService;
    private final MomentumVetoFilter vetoFilter;
    private final ConvictionPositionSizer positionSizer;
    private final AdaptiveWeightService adaptiveWeightService;
    private final PerformanceAnalyzer performanceAnalyzer;

    public BacktestResult run(BacktestConfig config) {
        return run(config, BacktestCancellation.none());
    }

    /**
     * Runs a backtest. A cancelled run returns the result of the completed prefix, marked truncated.
     *
     * @throws BacktestConfigurationException when the configuration cannot be simulated
     */
    public BacktestResult run(BacktestConfig config, BacktestCancellation cancellation) {
        config.validate();
        if (config.adaptiveWeights() && regimeProvider.isEmpty()) {
            throw new BacktestConfigurationException("adaptiveWeights",
                "adaptive weighting is enabled but no regime provider is available");
        }

        log.info("🚀 Backtest {} → {} | {} symbols | top {} | {} | capital {}",
            config.startDate(), config.endDate(), config.universe().size(), config.topN(),
            config.cadence().getCode(), String.format("%.2f", config.initialCapital()));
        long started = System.currentTimeMillis();

        BacktestResult result = new Simulation(config, cancellation).execute();

        PerformanceMetrics metrics = result.metrics();
        log.info("🏁 Backtest finished in {} ms{}: return {}%, CAGR {}%, Sharpe {}, max DD {}%, {} trades",
            System.currentTimeMillis() - started, result.truncated() ? " (truncated)" : "",
            String.format("%.2f", metrics.totalReturn() * 100), String.format("%.2f", metrics.cagr() * 100),
            String.format("%.2f", metrics.sharpeRatio()), String.format("%.2f", metrics.maxDrawdown() * 100),
            metrics.totalTrades());
        return result;
    }

    /**
     * State and loop of one run.
     */
    private class Simulation {

        private final BacktestConfig config;
        private final BacktestCancellation cancellation;
        private final RebalanceCalendar calendar;
        private final PortfolioLedger ledger;
        private final RiskManager riskManager;
        private final ReEntryTracker reEntryTracker;
        private final DrawdownGuard drawdownGuard;
        private final BenchmarkCurveBuilder benchmarks;

        private final List<RebalanceEvent> rebalances = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private int unavailableScores;
        private int scoringFailures;
        private int missingPrices;
        private int priceFailures;
        private String truncationReason;

        Simulation(BacktestConfig config, BacktestCancellation cancellation) {
            this.config = config;
            this.cancellation = cancellation;
            this.calendar = new RebalanceCalendar(config.startDate(), config.endDate(), config.cadence());
            this.ledger = new PortfolioLedger(config.initialCapital(), config.transactionCostRate());
            this.riskManager = new RiskManager(config.riskLimits(), config.periodsPerYear());
            this.reEntryTracker = new ReEntryTracker(config.reEntryRules());
            this.drawdownGuard = new DrawdownGuard(config.riskLimits());
            this.benchmarks = new BenchmarkCurveBuilder(priceProvider, config.benchmarkSymbol(),
                config.universe(), config.initialCapital(), config.transactionCostRate());
        }

        BacktestResult execute() {
            for (LocalDate date : calendar.tradingDays()) {
                boolean rebalanceDay = calendar.isRebalanceDate(date);
                if (rebalanceDay && cancellation.isCancelled()) {
                    truncationReason = cancellation.reason();
                    log.warn("⏹️ Backtest stopped before {}: {}", date, truncationReason);
                    break;
                }

                Map<String, Double> quotes = markPrices(date);
                benchmarks.observe(date);
                if (config.riskManagementEnabled()) {
                    applyStops(date, quotes);
                    checkDrawdown(date);
                }
                if (rebalanceDay) {
                    rebalance(date, quotes);
                }
                ledger.recordValue(date);
            }
            return buildResult();
        }

        /**
         * Marks held positions and stop-tracked symbols to the day's quotes. Returns the quotes seen.
         */
        private Map<String, Double> markPrices(LocalDate date) {
            Map<String, Double> quotes = new HashMap<>();
            for (Position position : ledger.positions()) {
                OptionalDouble price = quote(position.getSymbol(), date);
                if (price.isPresent()) {
                    quotes.put(position.getSymbol(), price.getAsDouble());
                    position.observePrice(price.getAsDouble());
                    riskManager.observePrice(position.getSymbol(), price.getAsDouble());
                }
            }
            for (String symbol : reEntryTracker.trackedSymbols(date)) {
                Double price = quotes.get(symbol);
                if (price == null) {
                    OptionalDouble fresh = quote(symbol, date);
                    if (fresh.isEmpty()) {
                        continue;
                    }
                    price = fresh.getAsDouble();
                    quotes.put(symbol, price);
                }
                reEntryTracker.observePrice(symbol, date, price);
            }
            return quotes;
        }

        private OptionalDouble quote(String symbol, LocalDate date) {
            try {
                OptionalDouble price = priceProvider.priceAt(symbol, date);
                if (price.isPresent() && !(price.getAsDouble() > 0)) {
                    log.warn("⚠️ Ignoring non-positive price {} for {} on {}", price.getAsDouble(), symbol, date);
                    return OptionalDouble.empty();
                }
                return price;
            } catch (RuntimeException e) {
                log.warn("⚠️ Price lookup for {} on {} failed: {}", symbol, date, e.getMessage());
                priceFailures++;
                notes.add(date + ": price lookup for " + symbol + " failed: " + e.getMessage());
                return OptionalDouble.empty();
            }
        }

        private void applyStops(LocalDate date, Map<String, Double> quotes) {
            for (Position position : ledger.positions()) {
                Double price = quotes.get(position.getSymbol());
                if (price == null) {
                    continue;
                }
                Optional<ExitReason> exit = riskManager.evaluate(position, price);
                if (exit.isEmpty()) {
                    continue;
                }
                String symbol = position.getSymbol();
                ledger.sell(date, symbol, position.getShares(), price, exit.get(), null);
                double fundamentals = fundamentalsAt(symbol, date).orElse(position.getEntryFundamentals());
                reEntryTracker.recordStop(symbol, date, fundamentals, price, position.getEntryPrice());
                riskManager.forget(symbol);
            }
        }

        private OptionalDouble fundamentalsAt(String symbol, LocalDate date) {
            try {
                return factorScorer.score(symbol, date)
                    .map(scores -> OptionalDouble.of(scores.fundamentals()))
                    .orElse(OptionalDouble.empty());
            } catch (RuntimeException e) {
                log.warn("⚠️ Could not score {} at stop time {}: {}", symbol, date, e.getMessage());
                return OptionalDouble.empty();
            }
        }

        private void checkDrawdown(LocalDate date) {
            if (!drawdownGuard.update(date, ledger.totalValue())) {
                return;
            }
            double fraction = config.riskLimits().drawdownLiquidationFraction();
            if (fraction <= 0) {
                return;
            }
            for (Position position : ledger.positions()) {
                ledger.sell(date, position.getSymbol(), position.getShares() * fraction,
                    position.getLastPrice(), ExitReason.REGIME_REDUCTION, null);
                if (!ledger.holds(position.getSymbol())) {
                    riskManager.forget(position.getSymbol());
                }
            }
            notes.add(String.format("%s: drawdown %.2f%% breached limit, %.0f%% of exposure moved to cash",
                date, drawdownGuard.getCurrentDrawdown() * 100, fraction * 100));
        }

        private void rebalance(LocalDate date, Map<String, Double> quotes) {
            int tradesBefore = ledger.tradeLog().size();

            WeightDecision decision = adaptiveWeightService.resolve(date, config.weights(),
                config.adaptiveWeights(), regimeProvider);
            decision.note().ifPresent(notes::add);

            ScoringOutcome outcome = scoringService.scoreUniverse(config.universe(), date, decision.weights(),
                factorScorer, config.scoringParallelism(), config.scoringTimeout());
            unavailableScores += outcome.unavailable().size();
            scoringFailures += outcome.failures().size();
            notes.addAll(outcome.failures());

            Map<String, ScoredSymbol> fresh = new HashMap<>();
            for (ScoredSymbol scored : outcome.ranked()) {
                fresh.put(scored.symbol(), scored);
            }

            Set<String> excluded = sellDeteriorated(date, fresh, quotes);

            List<ScoredSymbol> selected = new ArrayList<>();
            int vetoed = 0;
            int reEntryBlocked = 0;
            for (ScoredSymbol candidate : outcome.ranked()) {
                if (selected.size() >= config.topN()) {
                    break;
                }
                if (excluded.contains(candidate.symbol())) {
                    continue;
                }
                if (vetoFilter.isVetoed(candidate, config.vetoRules())) {
                    vetoed++;
                    continue;
                }
                if (!reEntryTracker.canRebuy(candidate.symbol(), candidate.fundamentals(), date)) {
                    reEntryBlocked++;
                    continue;
                }
                selected.add(candidate);
            }

            double investedFraction = (1.0 - decision.cashAllocation())
                * (config.riskManagementEnabled() ? drawdownGuard.investedFraction() : 1.0);
            Map<String, Double> targetWeights = positionSizer.weightsFor(selected, config.convictionTiers(),
                investedFraction);

            for (Position position : ledger.positions()) {
                if (!targetWeights.containsKey(position.getSymbol())) {
                    ScoredSymbol score = fresh.get(position.getSymbol());
                    exit(date, position, quotes, ExitReason.REBALANCE_EXIT,
                        score != null ? score.compositeScore() : null);
                }
            }

            double portfolioValue = ledger.totalValue();
            double reservedCash = config.cashReservePct() * portfolioValue;
            int rank = 0;
            for (ScoredSymbol candidate : selected) {
                rank++;
                if (ledger.holds(candidate.symbol())) {
                    continue;
                }
                OptionalDouble price = quote(candidate.symbol(), date);
                if (price.isEmpty()) {
                    missingPrices++;
                    notes.add(date + ": no price for " + candidate.symbol() + ", buy skipped");
                    continue;
                }
                double budget = targetWeights.get(candidate.symbol()) * portfolioValue;
                ledger.buy(date, candidate.symbol(), price.getAsDouble(), budget, reservedCash,
                    candidate.compositeScore(), candidate.quality(), candidate.fundamentals(), rank)
                    .ifPresent(entry -> riskManager.observePrice(candidate.symbol(), entry.price()));
            }

            List<TradeLogEntry> executed = ledger.tradeLog().subList(tradesBefore, ledger.tradeLog().size());
            int buys = (int) executed.stream().filter(t -> t.action() == TradeAction.BUY).count();
            double costs = executed.stream().mapToDouble(TradeLogEntry::transactionCost).sum();
            double averageScore = selected.stream().mapToDouble(ScoredSymbol::compositeScore).average().orElse(0.0);

            List<String> selectedSymbols = new ArrayList<>();
            selected.forEach(s -> selectedSymbols.add(s.symbol()));
            rebalances.add(RebalanceEvent.builder()
                .date(date)
                .selected(selectedSymbols)
                .targetWeights(new LinkedHashMap<>(targetWeights))
                .averageScore(averageScore)
                .weights(decision.weights())
                .regime(decision.regime())
                .investedFraction(investedFraction)
                .candidates(outcome.ranked().size())
                .vetoed(vetoed)
                .reEntryBlocked(reEntryBlocked)
                .buys(buys)
                .sells(executed.size() - buys)
                .transactionCosts(costs)
                .portfolioValue(ledger.totalValue())
                .build());

            log.info("📊 Rebalance {} | regime {} | {} scored, {} vetoed, {} blocked | selected {} | {} buys, {} sells | value {}",
                date, decision.regime(), outcome.ranked().size(), vetoed, reEntryBlocked, selectedSymbols,
                buys, executed.size() - buys, String.format("%.2f", ledger.totalValue()));
        }

        /**
         * Sells positions whose composite fell too far below the entry composite. Returns the sold symbols.
         */
        private Set<String> sellDeteriorated(LocalDate date, Map<String, ScoredSymbol> fresh,
                                             Map<String, Double> quotes) {
            Set<String> sold = new HashSet<>();
            if (config.scoreDeteriorationPoints() <= 0) {
                return sold;
            }
            for (Position position : ledger.positions()) {
                ScoredSymbol score = fresh.get(position.getSymbol());
                if (score == null) {
                    continue;
                }
                double drop = position.getEntryScore() - score.compositeScore();
                if (drop > config.scoreDeteriorationPoints()) {
                    log.warn("📉 {} score fell {} points since entry ({} → {})", position.getSymbol(),
                        String.format("%.1f", drop), String.format("%.1f", position.getEntryScore()),
                        String.format("%.1f", score.compositeScore()));
                    exit(date, position, quotes, ExitReason.SCORE_DETERIORATION, score.compositeScore());
                    sold.add(position.getSymbol());
                }
            }
            return sold;
        }

        private void exit(LocalDate date, Position position, Map<String, Double> quotes,
                          ExitReason reason, Double compositeScore) {
            Double price = quotes.get(position.getSymbol());
            if (price == null) {
                price = position.getLastPrice();
                notes.add(date + ": no quote for " + position.getSymbol() + ", sold at last price " + price);
            }
            ledger.sell(date, position.getSymbol(), position.getShares(), price, reason, compositeScore);
            riskManager.forget(position.getSymbol());
        }

        private BacktestResult buildResult() {
            List<EquityPoint> equityCurve = ledger.valueHistory();
            BenchmarkCurve market = benchmarks.marketIndex();
            BenchmarkCurve buyAndHold = benchmarks.buyAndHold();
            if (market.isEmpty()) {
                notes.add("benchmark " + config.benchmarkSymbol() + " has no price history, relative metrics omitted");
            }
            if (benchmarks.lookupFailures() > 0) {
                notes.add(benchmarks.lookupFailures() + " benchmark price lookups failed and were carried forward");
            }

            PerformanceMetrics metrics = performanceAnalyzer.analyze(equityCurve, ledger.tradeLog(),
                ledger.closedTrades(), market, buyAndHold,
                config.riskFreeRate(), config.periodsPerYear());

            Map<ExitReason, Integer> exits = new EnumMap<>(ExitReason.class);
            for (ClosedTrade trade : ledger.closedTrades()) {
                exits.merge(trade.exitReason(), 1, Integer::sum);
            }
            ExitStatistics exitStatistics = ExitStatistics.builder()
                .exitsByReason(exits)
                .stopsRecorded(reEntryTracker.history().size())
                .stopsRecovered(reEntryTracker.recoveredCount())
                .falsePositiveStops(reEntryTracker.falsePositiveCount())
                .build();

            ResultMetadata metadata = ResultMetadata.builder()
                .dataSource(config.dataSource())
                .biasCaveats(config.biasCaveats())
                .notes(notes)
                .unavailableScores(unavailableScores)
                .scoringFailures(scoringFailures)
                .missingPrices(missingPrices)
                .priceLookupFailures(priceFailures + benchmarks.lookupFailures())
                .build();

            SelectionRanking selections = SelectionRanking.of(rebalances);

            return BacktestResult.builder()
                .config(config)
                .equityCurve(equityCurve)
                .tradeLog(ledger.tradeLog())
                .closedTrades(ledger.closedTrades())
                .rebalances(rebalances)
                .marketIndex(market)
                .buyAndHold(buyAndHold)
                .metrics(metrics)
                .exitStatistics(exitStatistics)
                .bestPerformers(selections.best(SelectionRanking.DEFAULT_LIMIT))
                .worstPerformers(selections.worst(SelectionRanking.DEFAULT_LIMIT))
                .metadata(metadata)
                .truncated(truncationReason != null)
                .truncationReason(truncationReason)
                .build();
        }
    }
}
