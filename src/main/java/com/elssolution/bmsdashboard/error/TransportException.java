package com.elssolution.bmsdashboard.error;

/** Connection, DNS or HTTP status failure while talking to the controller. */
public class TransportException extends BmsDataException {

    private final int statusCode; // -1 when no response was received

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
