package com.jay.dcfengine.layer4_valuation;

import com.jay.dcfengine.exception.DomainException;
import org.springframework.stereotype.Component;

/**
 * Layer 4 — Terminal Value.
 * Gordon growth model on the final projected cash flow.
 */
@Component
public class TerminalValueCalculator {

    /**
     * @throws DomainException when the discount rate does not exceed the terminal growth rate
     */
    public double calculate(double finalCashFlow, double discountRate, double terminalGrowthRate) {
        requireRateAboveGrowth(discountRate, terminalGrowthRate);
        double terminalCashFlow = finalCashFlow * (1 + terminalGrowthRate);
        return terminalCashFlow / (discountRate - terminalGrowthRate);
    }

    public static boolean isRateAboveGrowth(double discountRate, double terminalGrowthRate) {
        return discountRate > terminalGrowthRate;
    }

    public static void requireRateAboveGrowth(double discountRate, double terminalGrowthRate) {
        if (!isRateAboveGrowth(discountRate, terminalGrowthRate)) {
            throw new DomainException(String.format(
                "discount rate %.4f must exceed terminal growth rate %.4f for the Gordon growth model",
                discountRate, terminalGrowthRate));
        }
    }
}
