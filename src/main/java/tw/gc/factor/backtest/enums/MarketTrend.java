package tw.gc.factor.backtest.enums;

public enum MarketTrend {
    BULL,
    BEAR,
    SIDEWAYS
}
