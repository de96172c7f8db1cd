package tw.gc.factor.backtest.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Risk stop on a symbol, kept for the re-entry lookback window.
 * Also follows the price after exit to tell whether the stop was premature.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopRecord {

    private String symbol;

    private LocalDate stopDate;

    private double fundamentalsScore;

    private double exitPrice;

    private double entryPrice;

    private double maxPriceAfterExit;

    private boolean recovered;

    private LocalDate recoveryDate;

    /**
     * True while {@code asOf} is within {@code lookbackDays} calendar days of the stop.
     */
    public boolean isActiveOn(LocalDate asOf, int lookbackDays) {
        return !asOf.isAfter(stopDate.plusDays(lookbackDays));
    }
}
