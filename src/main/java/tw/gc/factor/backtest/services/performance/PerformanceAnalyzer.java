package tw.gc.factor.backtest.services.performance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.entities.ClosedTrade;
import tw.gc.factor.backtest.entities.EquityPoint;
import tw.gc.factor.backtest.entities.TradeLogEntry;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an equity curve and its trade history into summary statistics.
 *
 * <p>Periodic returns are simple returns between consecutive equity points. Volatility, Sharpe and
 * Sortino are annualized with the supplied number of periods per year; CAGR uses the calendar days
 * between the first and last point over 365.25. Standard deviations are sample deviations (n - 1).
 *
 * <p>Alpha and beta come from an ordinary least squares fit of the portfolio's periodic excess
 * returns on the market index's periodic excess returns:
 * <pre>
 *   beta  = cov(Rp - rf, Rm - rf) / var(Rm - rf)
 *   alpha = (mean(Rp - rf) - beta * mean(Rm - rf)) * periodsPerYear
 * </pre>
 */
@Service
@Slf4j
public class PerformanceAnalyzer {

    private static final int MIN_REGRESSION_POINTS = 3;
    private static final double DAYS_PER_YEAR = 365.25;

    /**
     * @param marketIndex market index curve, or null when there is none
     * @param buyAndHold buy-and-hold curve, or null when there is none
     */
    public PerformanceMetrics analyze(List<EquityPoint> equityCurve,
                                      List<TradeLogEntry> tradeLog,
                                      List<ClosedTrade> closedTrades,
                                      BenchmarkCurve marketIndex,
                                      BenchmarkCurve buyAndHold,
                                      double riskFreeRate,
                                      int periodsPerYear) {
        if (periodsPerYear <= 0) {
            throw new IllegalArgumentException("periodsPerYear must be positive");
        }
        PerformanceMetrics.PerformanceMetricsBuilder builder = PerformanceMetrics.builder()
            .totalTrades(tradeLog.size())
            .closedTrades(closedTrades.size())
            .totalTransactionCosts(tradeLog.stream().mapToDouble(TradeLogEntry::transactionCost).sum());
        applyTradeStatistics(builder, closedTrades);

        if (equityCurve.isEmpty()) {
            return builder.build();
        }

        EquityPoint first = equityCurve.get(0);
        EquityPoint lastPoint = equityCurve.get(equityCurve.size() - 1);
        double initial = first.totalValue();
        double last = lastPoint.totalValue();
        List<Double> returns = periodicReturns(equityCurve);
        double periodRf = riskFreeRate / periodsPerYear;
        double sqrtPeriods = Math.sqrt(periodsPerYear);

        double totalReturn = initial > 0 ? last / initial - 1.0 : 0.0;
        double years = ChronoUnit.DAYS.between(first.date(), lastPoint.date()) / DAYS_PER_YEAR;
        double cagr = 0.0;
        if (years > 0 && initial > 0) {
            cagr = last > 0 ? Math.pow(last / initial, 1.0 / years) - 1.0 : -1.0;
        }

        double mean = mean(returns);
        double std = sampleStdDev(returns);
        double sharpe = std > 0 ? (mean - periodRf) * periodsPerYear / (std * sqrtPeriods) : 0.0;
        double downside = downsideDeviation(returns, periodRf);
        double sortino = downside > 0 ? (mean - periodRf) * periodsPerYear / (downside * sqrtPeriods) : 0.0;

        double[] drawdown = maxDrawdown(equityCurve);
        double maxDrawdown = drawdown[0];
        double calmar = maxDrawdown > 0 ? cagr / maxDrawdown : 0.0;

        builder.initialValue(initial)
            .finalValue(last)
            .totalReturn(totalReturn)
            .cagr(cagr)
            .annualizedVolatility(std * sqrtPeriods)
            .sharpeRatio(sharpe)
            .sortinoRatio(sortino)
            .maxDrawdown(maxDrawdown)
            .maxDrawdownDurationTicks((int) drawdown[1])
            .calmarRatio(calmar)
            .periods(returns.size());

        if (marketIndex != null && !marketIndex.isEmpty()) {
            applyMarketComparison(builder, equityCurve, marketIndex, totalReturn, periodRf, periodsPerYear);
        }
        if (buyAndHold != null && !buyAndHold.isEmpty()) {
            builder.buyAndHoldReturn(buyAndHold.totalReturn())
                .outperformanceVsBuyAndHold(totalReturn - buyAndHold.totalReturn());
        }

        return builder.build();
    }

    private void applyTradeStatistics(PerformanceMetrics.PerformanceMetricsBuilder builder,
                                      List<ClosedTrade> closedTrades) {
        if (closedTrades.isEmpty()) {
            return;
        }
        long wins = closedTrades.stream().filter(ClosedTrade::isWin).count();
        double grossProfit = closedTrades.stream().mapToDouble(ClosedTrade::pnl).filter(p -> p > 0).sum();
        double grossLoss = -closedTrades.stream().mapToDouble(ClosedTrade::pnl).filter(p -> p < 0).sum();
        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossProfit / grossLoss;
        } else {
            profitFactor = grossProfit > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        builder.winRate((double) wins / closedTrades.size()).profitFactor(profitFactor);
    }

    private void applyMarketComparison(PerformanceMetrics.PerformanceMetricsBuilder builder,
                                       List<EquityPoint> equityCurve,
                                       BenchmarkCurve market,
                                       double totalReturn,
                                       double periodRf,
                                       int periodsPerYear) {
        builder.benchmarkReturn(market.totalReturn())
            .outperformanceVsBenchmark(totalReturn - market.totalReturn());

        // Align on dates quoted in both series
        List<Double> portfolioReturns = new ArrayList<>();
        List<Double> marketReturns = new ArrayList<>();
        EquityPoint previous = null;
        for (EquityPoint point : equityCurve) {
            if (!market.values().containsKey(point.date())) {
                continue;
            }
            if (previous != null && previous.totalValue() > 0) {
                double prevMarket = market.values().get(previous.date());
                double curMarket = market.values().get(point.date());
                if (prevMarket > 0) {
                    portfolioReturns.add(point.totalValue() / previous.totalValue() - 1.0);
                    marketReturns.add(curMarket / prevMarket - 1.0);
                }
            }
            previous = point;
        }
        if (portfolioReturns.size() < MIN_REGRESSION_POINTS) {
            log.debug("Only {} aligned benchmark returns, skipping regression", portfolioReturns.size());
            return;
        }

        int n = portfolioReturns.size();
        double meanP = 0;
        double meanM = 0;
        for (int i = 0; i < n; i++) {
            meanP += portfolioReturns.get(i) - periodRf;
            meanM += marketReturns.get(i) - periodRf;
        }
        meanP /= n;
        meanM /= n;

        double covariance = 0;
        double marketVariance = 0;
        List<Double> active = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double pDev = portfolioReturns.get(i) - periodRf - meanP;
            double mDev = marketReturns.get(i) - periodRf - meanM;
            covariance += pDev * mDev;
            marketVariance += mDev * mDev;
            active.add(portfolioReturns.get(i) - marketReturns.get(i));
        }
        covariance /= (n - 1);
        marketVariance /= (n - 1);

        if (marketVariance > 0) {
            double beta = covariance / marketVariance;
            double alpha = (meanP - beta * meanM) * periodsPerYear;
            builder.beta(beta).alpha(alpha);
        } else {
            log.debug("Market variance is zero, cannot calculate beta");
        }

        double activeStd = sampleStdDev(active);
        double trackingError = activeStd * Math.sqrt(periodsPerYear);
        builder.trackingError(trackingError);
        if (trackingError > 0) {
            builder.informationRatio(mean(active) * periodsPerYear / trackingError);
        }
    }

    static List<Double> periodicReturns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double prev = equityCurve.get(i - 1).totalValue();
            if (prev > 0) {
                returns.add(equityCurve.get(i).totalValue() / prev - 1.0);
            }
        }
        return returns;
    }

    /**
     * Largest peak-to-trough decline as a fraction, and the longest run of ticks spent below a
     * prior peak.
     */
    static double[] maxDrawdown(List<EquityPoint> equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0.0;
        int underwater = 0;
        int longest = 0;
        for (EquityPoint point : equityCurve) {
            double value = point.totalValue();
            if (value >= peak) {
                peak = value;
                underwater = 0;
            } else {
                underwater++;
                longest = Math.max(longest, underwater);
                if (peak > 0) {
                    maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
                }
            }
        }
        return new double[] {maxDrawdown, longest};
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / (values.size() - 1));
    }

    private static double downsideDeviation(List<Double> values, double target) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            double shortfall = Math.min(0.0, v - target);
            sum += shortfall * shortfall;
        }
        return Math.sqrt(sum / values.size());
    }
}
