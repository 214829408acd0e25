package com.jay.dcfengine.model.enums;

public enum ScenarioType {
    WORST_CASE("worst_case"),   // higher discount rate, slower growth, thinner margin
    BASE_CASE("base_case"),     // unadjusted WACC, table growth and margin
    BEST_CASE("best_case"),     // lower discount rate, faster growth, wider margin
    CUSTOM("custom");           // caller-supplied assumptions

    private final String key;

    ScenarioType(String key) {
        this.key = key;
    }

    /** Report map key, e.g. "base_case". */
    public String key() {
        return key;
    }

    public static ScenarioType[] canonical() {
        return new ScenarioType[] { WORST_CASE, BASE_CASE, BEST_CASE };
    }
}
