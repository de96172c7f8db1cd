package tw.gc.factor.backtest.entities;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Open holding in the simulated portfolio. At most one per symbol.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;

    private double shares;

    private double entryPrice;

    private LocalDate entryDate;

    /** composite score on the entry date */
    private double entryScore;

    /** quality sub-score on the entry date; drives the static stop tier */
    private double entryQuality;

    private double entryFundamentals;

    /** highest observed price since entry, never decreases; moved only by {@link #observePrice} */
    @Setter(AccessLevel.NONE)
    private double highestPrice;

    /** last observed price, used for valuation on ticks without a quote */
    private double lastPrice;

    private Integer entryRank;

    /**
     * Records a new price observation.
     */
    public void observePrice(double price) {
        this.lastPrice = price;
        if (price > highestPrice) {
            this.highestPrice = price;
        }
    }

    public double marketValue() {
        return shares * lastPrice;
    }
}
