package tw.gc.factor.backtest.enums;

/**
 * Why an open position was (fully or partially) sold.
 */
public enum ExitReason {
    /**
     * Held symbol no longer in the target set at a rebalance
     */
    REBALANCE_EXIT("rebalance_exit", false),
    
    /**
     * Quality-tiered static stop measured from the entry price
     */
    STOP_LOSS("stop_loss", true),
    
    /**
     * Trailing stop measured from the highest price since entry
     */
    TRAILING_STOP("trailing_stop", true),
    
    /**
     * Portfolio drawdown de-risking
     */
    REGIME_REDUCTION("regime_reduction", false),
    
    /**
     * Composite score fell too far below the score at entry
     */
    SCORE_DETERIORATION("score_deterioration", false);
    
    private final String code;
    private final boolean riskStop;
    
    ExitReason(String code, boolean riskStop) {
        this.code = code;
        this.riskStop = riskStop;
    }
    
    public String getCode() {
        return code;
    }
    
    /**
     * Risk-driven stops leave a re-entry record behind
     */
    public boolean isRiskStop() {
        return riskStop;
    }
    
    public static ExitReason fromCode(String code) {
        for (ExitReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown exit reason: " + code);
    }
}
