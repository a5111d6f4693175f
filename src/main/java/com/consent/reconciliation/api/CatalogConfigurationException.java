package com.consent.reconciliation.api;

/**
 * Thrown before a report run when the version catalog cannot be used, e.g. when it is empty.
 */
public class CatalogConfigurationException extends RuntimeException {

    public CatalogConfigurationException(String message) {
        super(message);
    }
}
