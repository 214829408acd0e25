package com.jay.dcfengine.exception;

import java.util.List;

/**
 * Raised when a financial input bundle or a set of scenario assumptions is malformed.
 * Thrown before any calculation begins; carries every rule that failed, not just the first.
 */
public class ValidationException extends DcfException {

    private final List<String> failures;

    public ValidationException(String subject, List<String> failures) {
        super(String.format("Invalid %s — %d violation(s): %s",
            subject, failures.size(), String.join("; ", failures)));
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
