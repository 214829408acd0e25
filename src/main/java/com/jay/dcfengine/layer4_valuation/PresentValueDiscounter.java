package com.jay.dcfengine.layer4_valuation;

import com.jay.dcfengine.exception.DomainException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Present Value Discounter.
 * Discounts year i (1-based) by (1 + r)^i and the terminal value by (1 + r)^horizon.
 * Output has one entry per projected year plus the discounted terminal value last.
 */
@Component
public class PresentValueDiscounter {

    public List<Double> discount(List<Double> cashFlows, double terminalValue, double discountRate) {
        if (!(discountRate > -1)) {
            throw new DomainException(String.format("discount rate %.4f leaves no positive discount factor", discountRate));
        }
        List<Double> presentValues = new ArrayList<>(cashFlows.size() + 1);
        for (int i = 0; i < cashFlows.size(); i++) {
            presentValues.add(cashFlows.get(i) / Math.pow(1 + discountRate, i + 1));
        }
        presentValues.add(terminalValue / Math.pow(1 + discountRate, cashFlows.size()));
        return presentValues;
    }
}
