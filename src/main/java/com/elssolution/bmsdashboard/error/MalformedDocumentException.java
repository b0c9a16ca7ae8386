package com.elssolution.bmsdashboard.error;

/**
 * The page does not carry exactly one assignment of the expected key.
 * Usually a firmware mismatch, a captive portal or a truncated response.
 */
public class MalformedDocumentException extends BmsDataException {

    private final String key;

    public MalformedDocumentException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
