package com.jay.dcfengine.model.enums;

public enum QualityGrade {
    A, B, C, D, F;

    /** Letter grade for a 0–1 quality score. */
    public static QualityGrade fromScore(double score) {
        if (score >= 0.90) return A;
        if (score >= 0.75) return B;
        if (score >= 0.60) return C;
        if (score >= 0.40) return D;
        return F;
    }
}
