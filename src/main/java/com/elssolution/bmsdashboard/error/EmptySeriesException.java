package com.elssolution.bmsdashboard.error;

/** Statistics were requested over zero samples. */
public class EmptySeriesException extends BmsDataException {

    public EmptySeriesException(String message) {
        super(message);
    }
}
