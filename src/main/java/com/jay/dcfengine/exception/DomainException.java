package com.jay.dcfengine.exception;

/**
 * Raised when valid inputs still describe an impossible valuation,
 * e.g. a discount rate at or below the terminal growth rate.
 */
public class DomainException extends DcfException {

    private final String scenarioName;

    public DomainException(String message) {
        super(message);
        this.scenarioName = null;
    }

    public DomainException(String scenarioName, String message) {
        super(String.format("Scenario '%s': %s", scenarioName, message));
        this.scenarioName = scenarioName;
    }

    public DomainException(String scenarioName, String message, Throwable cause) {
        super(String.format("Scenario '%s': %s", scenarioName, message), cause);
        this.scenarioName = scenarioName;
    }

    /** Name of the scenario that failed, or null when the failure is not scenario-specific. */
    public String getScenarioName() {
        return scenarioName;
    }
}
