package org.carball.pivot.validator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ConfidenceCalculatorTest {

    private final ConfidenceCalculator calculator = new ConfidenceCalculator(0.10);

    @Test
    void shouldMatchClosedFormWithoutFailures() {
        // P(rate < r | k passes) = 1 - (1 - r)^(k + 1)
        assertThat(calculator.confidence(105, 0, 0.0, 105, 105))
                .isCloseTo(100.0 * (1 - Math.pow(0.9, 106)), within(1e-9));
        assertThat(calculator.confidence(0, 0, 0.0, 0, 0)).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void shouldIncreaseWithMorePasses() {
        double previous = -1;
        for (int passed = 0; passed <= 200; passed += 20) {
            double confidence = calculator.confidence(passed, 0, 0.0, passed, passed);
            assertThat(confidence).isGreaterThan(previous).isBetween(0.0, 100.0);
            previous = confidence;
        }
    }

    @Test
    void shouldDecreaseWithFailures() {
        double none = calculator.confidence(100, 0, 0.0, 100, 100);
        double one = calculator.confidence(100, 1, 0.0, 100, 100);
        double many = calculator.confidence(100, 20, 0.0, 100, 100);

        assertThat(one).isLessThan(none);
        assertThat(many).isLessThan(one);
    }

    @Test
    void shouldPenalizeDistributionShiftBeyondCriticalValue() {
        double critical = ConfidenceCalculator.ksCritical(100, 100);

        double atCritical = calculator.confidence(100, 0, critical, 100, 100);
        double beyond = calculator.confidence(100, 0, critical + 0.5, 100, 100);

        assertThat(atCritical).isCloseTo(calculator.confidence(100, 0, 0.0, 100, 100), within(1e-9));
        assertThat(beyond).isCloseTo(atCritical * 0.5, within(1e-9));
        assertThat(calculator.confidence(100, 0, 5.0, 1, 1)).isZero();
    }

    @Test
    void shouldComputeCriticalDistance() {
        assertThat(ConfidenceCalculator.ksCritical(100, 100)).isCloseTo(1.95 * Math.sqrt(0.02), within(1e-12));
        assertThat(ConfidenceCalculator.ksCritical(0, 10)).isEqualTo(1.0);
    }

    @Test
    void shouldRejectRateOutsideUnitInterval() {
        assertThatThrownBy(() -> new ConfidenceCalculator(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceCalculator(1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
