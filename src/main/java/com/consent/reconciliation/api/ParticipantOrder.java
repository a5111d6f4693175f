package com.consent.reconciliation.api;

/**
 * Order in which participants appear in the report.
 */
public enum ParticipantOrder {
    /** Ascending participant id (string order). */
    ASCENDING_ID,

    /** Order of first appearance: signature table first, then the exit table. */
    FIRST_SEEN
}
