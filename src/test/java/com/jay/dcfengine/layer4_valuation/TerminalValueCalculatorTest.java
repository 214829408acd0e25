package com.jay.dcfengine.layer4_valuation;

import com.jay.dcfengine.exception.DomainException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TerminalValueCalculatorTest {

    private final TerminalValueCalculator calculator = new TerminalValueCalculator();

    @Test
    void gordonGrowthOnFinalCashFlow() {
        assertThat(calculator.calculate(1000, 0.10, 0.025)).isCloseTo(13_666.67, within(0.01));
    }

    @Test
    void positiveWhenCashFlowPositiveAndRateAboveGrowth() {
        assertThat(calculator.calculate(1, 0.0501, 0.05)).isPositive();
        assertThat(calculator.calculate(250, 0.20, -0.01)).isPositive();
    }

    @Test
    void rejectsDiscountRateBelowGrowth() {
        assertThatThrownBy(() -> calculator.calculate(1000, 0.08, 0.10))
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("must exceed terminal growth rate");
    }

    @Test
    void rejectsDiscountRateEqualToGrowth() {
        assertThatThrownBy(() -> calculator.calculate(1000, 0.03, 0.03))
            .isInstanceOf(DomainException.class);
    }
}
