package tw.gc.factor.backtest.services.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.factor.backtest.config.MomentumVetoRules;

import java.util.Optional;

/**
 * Excludes candidates with weak momentum.
 *
 * <ul>
 *   <li>momentum below the hard floor</li>
 *   <li>momentum below the soft level while fundamentals are also below their soft level</li>
 * </ul>
 * Exempt symbols always pass.
 */
@Service
@Slf4j
public class MomentumVetoFilter {

    public Optional<String> vetoReason(ScoredSymbol candidate, MomentumVetoRules rules) {
        if (rules.isExempt(candidate.symbol())) {
            return Optional.empty();
        }
        double momentum = candidate.momentum();
        if (momentum < rules.hardFloor()) {
            return Optional.of(String.format("momentum %.1f below floor %.1f", momentum, rules.hardFloor()));
        }
        if (momentum < rules.softMomentum() && candidate.fundamentals() < rules.softFundamentals()) {
            return Optional.of(String.format("momentum %.1f and fundamentals %.1f both weak",
                momentum, candidate.fundamentals()));
        }
        return Optional.empty();
    }

    public boolean isVetoed(ScoredSymbol candidate, MomentumVetoRules rules) {
        Optional<String> reason = vetoReason(candidate, rules);
        reason.ifPresent(r -> log.warn("🚫 {} vetoed: {}", candidate.symbol(), r));
        return reason.isPresent();
    }
}
