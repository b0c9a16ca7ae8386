package com.elssolution.bmsdashboard.error;

/** Payload ran out of separators before the decode plan was satisfied. */
public class FieldMissingException extends BmsDataException {

    private final int position;
    private final String fieldName;

    public FieldMissingException(int position, String fieldName) {
        super("field '" + fieldName + "' missing at position " + position);
        this.position = position;
        this.fieldName = fieldName;
    }

    /** Zero-based token index the plan expected to read. */
    public int getPosition() {
        return position;
    }

    public String getFieldName() {
        return fieldName;
    }
}
