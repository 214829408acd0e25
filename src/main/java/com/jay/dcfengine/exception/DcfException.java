package com.jay.dcfengine.exception;

/**
 * Base type for every failure the valuation engine reports to its caller.
 */
public class DcfException extends RuntimeException {

    public DcfException(String message) {
        super(message);
    }

    public DcfException(String message, Throwable cause) {
        super(message, cause);
    }
}
