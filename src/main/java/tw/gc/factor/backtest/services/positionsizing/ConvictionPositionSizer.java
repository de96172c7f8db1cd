package tw.gc.factor.backtest.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.config.ConvictionTiers;
import tw.gc.factor.backtest.enums.ConvictionTier;
import tw.gc.factor.backtest.services.scoring.ScoredSymbol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conviction-weighted allocation across the selected symbols.
 *
 * <p>Each symbol gets the base weight of its tier; weights are then normalized to sum to the
 * invested fraction (1.0 without a cash buffer). Iteration order of the result follows the input.
 */
@Service
@Slf4j
public class ConvictionPositionSizer {

    public Map<String, Double> weightsFor(List<ScoredSymbol> selected, ConvictionTiers tiers) {
        return weightsFor(selected, tiers, 1.0);
    }

    public Map<String, Double> weightsFor(List<ScoredSymbol> selected, ConvictionTiers tiers, double investedFraction) {
        if (investedFraction < 0 || investedFraction > 1) {
            throw new IllegalArgumentException("investedFraction must be in [0, 1], got " + investedFraction);
        }
        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0;
        for (ScoredSymbol candidate : selected) {
            ConvictionTier tier = tiers.classify(candidate.compositeScore(), candidate.quality());
            double base = tiers.baseWeight(tier);
            raw.put(candidate.symbol(), base);
            total += base;
            log.debug("{} conviction {} (score {}, quality {}) base weight {}", candidate.symbol(), tier,
                String.format("%.1f", candidate.compositeScore()), String.format("%.1f", candidate.quality()), base);
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        if (total <= 0) {
            return weights;
        }
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            weights.put(entry.getKey(), entry.getValue() / total * investedFraction);
        }
        return weights;
    }
}
