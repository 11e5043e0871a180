package com.medimind.alert.core.error;

/** A single snapshot field could not be read as a number. Never escapes evaluation. */
public class InvalidSnapshotException extends RuntimeException {
    private final String field;

    public InvalidSnapshotException(String field, Object value) {
        super("Vital '" + field + "' is not numeric: " + value);
        this.field = field;
    }

    public InvalidSnapshotException(String field, Object value, Throwable cause) {
        super("Vital '" + field + "' is not numeric: " + value, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
