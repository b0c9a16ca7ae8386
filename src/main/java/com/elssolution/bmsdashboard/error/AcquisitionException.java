package com.elssolution.bmsdashboard.error;

import com.elssolution.bmsdashboard.acquisition.Leg;

/**
 * Outcome of a failed poll cycle. Callers tell controller/network faults
 * ({@link FetchFailedException}) apart from faults in the acquisition code itself
 * ({@link UnexpectedFailureException}).
 */
public abstract class AcquisitionException extends Exception {

    private final Leg leg;

    protected AcquisitionException(Leg leg, String message, Throwable cause) {
        super(message, cause);
        this.leg = leg;
    }

    /** Leg whose failure ended the cycle. */
    public Leg getLeg() {
        return leg;
    }
}
