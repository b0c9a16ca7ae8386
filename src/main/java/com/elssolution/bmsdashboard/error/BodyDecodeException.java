package com.elssolution.bmsdashboard.error;

/** Response body arrived but is not valid text. */
public class BodyDecodeException extends BmsDataException {

    public BodyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
