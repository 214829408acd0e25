package com.jay.dcfengine.layer1_quality;

import com.jay.dcfengine.model.FinancialInputBundle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Layer 1 — Data Freshness Scorer.
 * Rates how recent the bundle's data snapshot is, 0 to 1, from its age in hours.
 */
@Component
@RequiredArgsConstructor
public class DataFreshnessScorer {

    private final Clock clock;

    public double score(FinancialInputBundle bundle) {
        LocalDateTime asOf = bundle.getAsOf();
        if (asOf == null) return 0.0;

        double ageHours = Duration.between(asOf, LocalDateTime.now(clock)).toMinutes() / 60.0;
        if (ageHours <= 1)  return 1.0;
        if (ageHours <= 6)  return 0.9;
        if (ageHours <= 24) return 0.7;
        if (ageHours <= 72) return 0.5;
        return 0.3;
    }
}
