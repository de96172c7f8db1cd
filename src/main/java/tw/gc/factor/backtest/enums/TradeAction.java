package tw.gc.factor.backtest.enums;

public enum TradeAction {
    BUY, SELL
}
