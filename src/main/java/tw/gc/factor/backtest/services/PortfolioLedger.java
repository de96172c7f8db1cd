package tw.gc.factor.backtest.services;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.factor.backtest.entities.ClosedTrade;
import tw.gc.factor.backtest.entities.EquityPoint;
import tw.gc.factor.backtest.entities.Position;
import tw.gc.factor.backtest.entities.TradeLogEntry;
import tw.gc.factor.backtest.enums.ExitReason;
import tw.gc.factor.backtest.enums.TradeAction;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cash and positions of the simulated portfolio plus everything executed against them.
 *
 * <p>Only the orchestrator thread mutates a ledger. Buys debit {@code notional * (1 + costRate)},
 * sells credit {@code notional * (1 - costRate)}. Realized P&amp;L of a sale includes the sale cost
 * and the buy cost attributable to the shares sold.
 */
@Slf4j
public class PortfolioLedger {

    static final double SHARE_EPSILON = 1e-9;
    static final double MIN_ORDER_NOTIONAL = 0.01;
    static final double CASH_TOLERANCE = 1e-6;

    private final double transactionCostRate;

    @Getter
    private double cash;

    private final Map<String, Position> positions = new TreeMap<>();
    private final List<EquityPoint> valueHistory = new ArrayList<>();
    private final List<TradeLogEntry> tradeLog = new ArrayList<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();

    public PortfolioLedger(double initialCash, double transactionCostRate) {
        if (initialCash < 0) {
            throw new IllegalArgumentException("initial cash must not be negative");
        }
        this.cash = initialCash;
        this.transactionCostRate = transactionCostRate;
    }

    /**
     * Buys {@code symbol} spending at most {@code budget} including costs, without letting cash fall
     * below {@code reservedCash}. The order is scaled down when cash is short and skipped when
     * nothing can be spent.
     */
    public Optional<TradeLogEntry> buy(LocalDate date, String symbol, double price, double budget,
                                       double reservedCash, double compositeScore, double quality,
                                       double fundamentals, int rank) {
        if (positions.containsKey(symbol)) {
            throw new IllegalStateException("Already holding " + symbol);
        }
        if (!(price > 0)) {
            throw new IllegalArgumentException("Price must be positive for " + symbol + ", got " + price);
        }
        double available = cash - reservedCash;
        double spend = budget;
        boolean scaledDown = false;
        if (spend > available) {
            spend = available;
            scaledDown = true;
            log.debug("Insufficient cash for {}: wanted {}, {} available", symbol,
                String.format("%.2f", budget), String.format("%.2f", available));
        }
        double notional = spend / (1 + transactionCostRate);
        if (notional < MIN_ORDER_NOTIONAL) {
            log.debug("Skipping {} buy on {}: order of {} too small", symbol, date, String.format("%.4f", notional));
            return Optional.empty();
        }
        double shares = notional / price;
        double cost = notional * transactionCostRate;
        cash -= notional + cost;
        if (cash < 0 && cash > -CASH_TOLERANCE) {
            cash = 0;
        }

        positions.put(symbol, Position.builder()
            .symbol(symbol)
            .shares(shares)
            .entryPrice(price)
            .entryDate(date)
            .entryScore(compositeScore)
            .entryQuality(quality)
            .entryFundamentals(fundamentals)
            .highestPrice(price)
            .lastPrice(price)
            .entryRank(rank)
            .build());

        TradeLogEntry entry = TradeLogEntry.builder()
            .date(date)
            .action(TradeAction.BUY)
            .symbol(symbol)
            .shares(shares)
            .price(price)
            .notional(notional)
            .transactionCost(cost)
            .compositeScore(compositeScore)
            .rank(rank)
            .scaledDown(scaledDown)
            .build();
        tradeLog.add(entry);
        log.info("🟢 BUY {} {} @ {} ({}{})", String.format("%.4f", shares), symbol, String.format("%.2f", price),
            String.format("%.2f", notional), scaledDown ? ", scaled down" : "");
        return Optional.of(entry);
    }

    /**
     * Sells {@code shares} of a held symbol. Selling everything closes the position.
     */
    public ClosedTrade sell(LocalDate date, String symbol, double shares, double price,
                            ExitReason reason, Double compositeScore) {
        Position position = positions.get(symbol);
        if (position == null) {
            throw new IllegalStateException("No open position in " + symbol);
        }
        if (shares <= 0 || shares > position.getShares() + SHARE_EPSILON) {
            throw new IllegalArgumentException("Cannot sell " + shares + " of " + position.getShares()
                + " shares of " + symbol);
        }
        double sold = Math.min(shares, position.getShares());
        double notional = sold * price;
        double cost = notional * transactionCostRate;
        cash += notional - cost;

        double basis = sold * position.getEntryPrice() * (1 + transactionCostRate);
        double pnl = notional - cost - basis;
        double pnlPct = basis > 0 ? pnl / basis : 0.0;
        long holdingDays = ChronoUnit.DAYS.between(position.getEntryDate(), date);

        double remaining = position.getShares() - sold;
        if (remaining <= SHARE_EPSILON) {
            positions.remove(symbol);
        } else {
            position.setShares(remaining);
        }
        position.observePrice(price);

        ClosedTrade trade = ClosedTrade.builder()
            .symbol(symbol)
            .entryDate(position.getEntryDate())
            .entryPrice(position.getEntryPrice())
            .exitDate(date)
            .exitPrice(price)
            .shares(sold)
            .exitReason(reason)
            .pnl(pnl)
            .pnlPct(pnlPct)
            .holdingDays(holdingDays)
            .build();
        closedTrades.add(trade);
        tradeLog.add(TradeLogEntry.builder()
            .date(date)
            .action(TradeAction.SELL)
            .symbol(symbol)
            .shares(sold)
            .price(price)
            .notional(notional)
            .transactionCost(cost)
            .compositeScore(compositeScore)
            .entryPrice(position.getEntryPrice())
            .entryDate(position.getEntryDate())
            .holdingDays(holdingDays)
            .pnl(pnl)
            .pnlPct(pnlPct)
            .exitReason(reason)
            .build());
        log.info("🔴 SELL {} {} @ {} [{}] P&L {} ({}%)", String.format("%.4f", sold), symbol,
            String.format("%.2f", price), reason.getCode(), String.format("%.2f", pnl),
            String.format("%.2f", pnlPct * 100));
        return trade;
    }

    public double positionsValue() {
        double value = 0;
        for (Position position : positions.values()) {
            value += position.marketValue();
        }
        return value;
    }

    public double totalValue() {
        return cash + positionsValue();
    }

    /**
     * Appends the current valuation to the value history.
     */
    public EquityPoint recordValue(LocalDate date) {
        if (cash < -CASH_TOLERANCE) {
            throw new IllegalStateException("Cash went negative on " + date + ": " + cash);
        }
        if (!valueHistory.isEmpty() && !date.isAfter(valueHistory.get(valueHistory.size() - 1).date())) {
            throw new IllegalStateException("Value history must move forward, got " + date);
        }
        double positionsValue = positionsValue();
        EquityPoint point = new EquityPoint(date, cash + positionsValue, cash, positionsValue);
        valueHistory.add(point);
        return point;
    }

    public boolean holds(String symbol) {
        return positions.containsKey(symbol);
    }

    public Optional<Position> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    /**
     * Open positions in symbol order.
     */
    public List<Position> positions() {
        return List.copyOf(positions.values());
    }

    public List<EquityPoint> valueHistory() {
        return Collections.unmodifiableList(valueHistory);
    }

    public List<TradeLogEntry> tradeLog() {
        return Collections.unmodifiableList(tradeLog);
    }

    public List<ClosedTrade> closedTrades() {
        return Collections.unmodifiableList(closedTrades);
    }
}
