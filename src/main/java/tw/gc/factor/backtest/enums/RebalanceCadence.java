package tw.gc.factor.backtest.enums;

import java.time.LocalDate;

/**
 * Rebalance frequency. Anchors are generated from the backtest start date.
 */
public enum RebalanceCadence {
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly");
    
    private final String code;
    
    RebalanceCadence(String code) {
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    /**
     * Anchor date of the n-th rebalance counted from start (n = 0 is start itself).
     * Computed from start rather than chained so month-end anchors do not drift.
     */
    public LocalDate anchor(LocalDate start, int n) {
        return switch (this) {
            case WEEKLY -> start.plusWeeks(n);
            case MONTHLY -> start.plusMonths(n);
            case QUARTERLY -> start.plusMonths(3L * n);
        };
    }
    
    public static RebalanceCadence fromStringIgnoreCase(String value) {
        if (value == null) return null;
        for (RebalanceCadence cadence : values()) {
            if (cadence.code.equalsIgnoreCase(value) || cadence.name().equalsIgnoreCase(value)) {
                return cadence;
            }
        }
        throw new IllegalArgumentException("Unknown rebalance cadence: " + value);
    }
}
