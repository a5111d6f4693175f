package com.consent.reconciliation.bulk;

/**
 * Thrown when an input file cannot be read as a table at all.
 * Individual bad values never raise this; they become data-quality warnings.
 */
public class TableReadException extends RuntimeException {

    public TableReadException(String message) {
        super(message);
    }

    public TableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
