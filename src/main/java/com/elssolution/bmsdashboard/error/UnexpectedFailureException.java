package com.elssolution.bmsdashboard.error;

import com.elssolution.bmsdashboard.acquisition.Leg;

/** A leg's worker terminated abnormally instead of returning a typed failure. */
public class UnexpectedFailureException extends AcquisitionException {

    public UnexpectedFailureException(Leg leg, Throwable cause) {
        super(leg, leg.label() + " crashed: " + cause, cause);
    }
}
