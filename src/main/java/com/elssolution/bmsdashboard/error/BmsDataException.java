package com.elssolution.bmsdashboard.error;

/**
 * Base of the typed failures a single acquisition leg can report.
 * Anything thrown by a leg that is not one of these counts as an internal fault.
 */
public abstract class BmsDataException extends Exception {

    protected BmsDataException(String message) {
        super(message);
    }

    protected BmsDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
