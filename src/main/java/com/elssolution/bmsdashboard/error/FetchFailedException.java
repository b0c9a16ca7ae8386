package com.elssolution.bmsdashboard.error;

import com.elssolution.bmsdashboard.acquisition.Leg;

/** A leg returned one of the typed pipeline failures. */
public class FetchFailedException extends AcquisitionException {

    public FetchFailedException(Leg leg, BmsDataException cause) {
        super(leg, leg.label() + ": " + cause.getMessage(), cause);
    }

    @Override
    public synchronized BmsDataException getCause() {
        return (BmsDataException) super.getCause();
    }
}
