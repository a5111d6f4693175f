package com.consent.reconciliation.rules;

/**
 * Thrown when a study mapping file cannot be read or parsed.
 */
public class StudyMappingException extends RuntimeException {

    public StudyMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
