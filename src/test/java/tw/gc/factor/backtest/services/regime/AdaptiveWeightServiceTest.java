package tw.gc.factor.backtest.services.regime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.factor.backtest.config.FactorWeights;
import tw.gc.factor.backtest.enums.MarketTrend;
import tw.gc.factor.backtest.enums.VolatilityRegime;
import tw.gc.factor.backtest.strategy.RegimeProvider;
import tw.gc.factor.backtest.strategy.RegimeSnapshot;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdaptiveWeightService")
class AdaptiveWeightServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);
    private static final FactorWeights STATIC = FactorWeights.DEFAULT;

    @Mock
    private RegimeProvider regimeProvider;

    private AdaptiveWeightService service;

    @BeforeEach
    void setUp() {
        service = new AdaptiveWeightService();
    }

    @Test
    @DisplayName("should use static weights without consulting regimes when adaptive is off")
    void staticWhenNotAdaptive() {
        WeightDecision decision = service.resolve(DAY, STATIC, false, Optional.of(regimeProvider));

        assertThat(decision.weights()).isEqualTo(STATIC);
        assertThat(decision.regime()).isEqualTo(WeightDecision.STATIC);
        verifyNoInteractions(regimeProvider);
    }

    @Nested
    @DisplayName("Adaptive")
    class Adaptive {

        @Test
        @DisplayName("should map trend and volatility through the regime table")
        void shouldUseTable() {
            when(regimeProvider.regimeAt(DAY)).thenReturn(Optional.of(RegimeSnapshot.of(MarketTrend.BEAR, VolatilityRegime.HIGH)));

            WeightDecision decision = service.resolve(DAY, STATIC, true, Optional.of(regimeProvider));

            assertThat(decision.weights()).isEqualTo(new FactorWeights(0.20, 0.20, 0.40, 0.20));
            assertThat(decision.regime()).isEqualTo("BEAR_HIGH_VOL");
            assertThat(decision.note()).isEmpty();
        }

        @Test
        @DisplayName("should prefer weights supplied with the regime and honor its cash allocation")
        void shouldPreferSuppliedWeights() {
            FactorWeights supplied = new FactorWeights(0.25, 0.25, 0.25, 0.25);
            when(regimeProvider.regimeAt(DAY)).thenReturn(Optional.of(new RegimeSnapshot(
                MarketTrend.BULL, VolatilityRegime.LOW, Optional.of(supplied), OptionalDouble.of(0.3))));

            WeightDecision decision = service.resolve(DAY, STATIC, true, Optional.of(regimeProvider));

            assertThat(decision.weights()).isEqualTo(supplied);
            assertThat(decision.cashAllocation()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("should fall back to static weights when no regime is known for the date")
        void fallbackWhenRegimeMissing() {
            when(regimeProvider.regimeAt(any())).thenReturn(Optional.empty());

            WeightDecision decision = service.resolve(DAY, STATIC, true, Optional.of(regimeProvider));

            assertThat(decision.weights()).isEqualTo(STATIC);
            assertThat(decision.note()).hasValueSatisfying(note -> assertThat(note).contains(DAY.toString()));
        }

        @Test
        @DisplayName("should fall back when the regime supplies invalid weights")
        void fallbackOnInvalidWeights() {
            when(regimeProvider.regimeAt(DAY)).thenReturn(Optional.of(new RegimeSnapshot(
                MarketTrend.BULL, VolatilityRegime.LOW, Optional.of(new FactorWeights(0.5, 0.5, 0.5, 0.5)),
                OptionalDouble.empty())));

            WeightDecision decision = service.resolve(DAY, STATIC, true, Optional.of(regimeProvider));

            assertThat(decision.weights()).isEqualTo(STATIC);
            assertThat(decision.note()).isPresent();
        }

        @Test
        @DisplayName("should fall back when the regime lookup throws")
        void fallbackOnLookupFailure() {
            when(regimeProvider.regimeAt(DAY)).thenThrow(new IllegalStateException("classifier offline"));

            WeightDecision decision = service.resolve(DAY, STATIC, true, Optional.of(regimeProvider));

            assertThat(decision.weights()).isEqualTo(STATIC);
            assertThat(decision.note()).hasValueSatisfying(note -> assertThat(note).contains("classifier offline"));
        }

        @Test
        @DisplayName("should refuse adaptive weighting without a provider")
        void requiresProvider() {
            assertThatThrownBy(() -> service.resolve(DAY, STATIC, true, Optional.empty()))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @ParameterizedTest
    @EnumSource(MarketTrend.class)
    @DisplayName("every table row should hold valid weights")
    void tableRowsAreValid(MarketTrend trend) {
        for (VolatilityRegime volatility : VolatilityRegime.values()) {
            assertThat(service.weightsFor(trend, volatility).isValid()).isTrue();
        }
    }
}
