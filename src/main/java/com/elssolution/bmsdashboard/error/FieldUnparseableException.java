package com.elssolution.bmsdashboard.error;

/** A token exists but does not parse as the type the decode plan declares. */
public class FieldUnparseableException extends BmsDataException {

    private final int position;
    private final String fieldName;
    private final String rawToken;

    public FieldUnparseableException(int position, String fieldName, String rawToken, Throwable cause) {
        super("field '" + fieldName + "' at position " + position + " unparseable: '" + rawToken + "'", cause);
        this.position = position;
        this.fieldName = fieldName;
        this.rawToken = rawToken;
    }

    public int getPosition() {
        return position;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getRawToken() {
        return rawToken;
    }
}
