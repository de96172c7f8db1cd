package tw.gc.factor.backtest.enums;

public enum VolatilityRegime {
    HIGH,
    NORMAL,
    LOW
}
