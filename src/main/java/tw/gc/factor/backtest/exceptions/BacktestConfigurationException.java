package tw.gc.factor.backtest.exceptions;

import lombok.Getter;

/**
 * Fatal configuration problem detected before the simulation starts.
 */
@Getter
public class BacktestConfigurationException extends IllegalArgumentException {

    private final String field;

    public BacktestConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
