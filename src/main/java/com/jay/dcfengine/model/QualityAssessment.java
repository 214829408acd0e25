package com.jay.dcfengine.model;

import com.jay.dcfengine.model.enums.QualityGrade;

import java.util.List;

/**
 * Reliability verdict on an input bundle. A warning does not stop the valuation;
 * the caller decides what to do with it.
 */
public record QualityAssessment(double score, QualityGrade grade, List<String> issues, boolean warning) {

    public QualityAssessment {
        issues = List.copyOf(issues);
    }
}
