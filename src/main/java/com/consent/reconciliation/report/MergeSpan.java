package com.consent.reconciliation.report;

/**
 * A maximal run of adjacent report rows belonging to the same participant.
 *
 * @param participantId the participant shared by the run
 * @param startRow      index of the first row of the run (0-based)
 * @param rowCount      number of rows in the run, at least 1
 */
public record MergeSpan(String participantId, int startRow, int rowCount) {
    public MergeSpan {
        if (startRow < 0) {
            throw new IllegalArgumentException("startRow must be >= 0");
        }
        if (rowCount < 1) {
            throw new IllegalArgumentException("rowCount must be >= 1");
        }
    }

    public int endRow() {
        return startRow + rowCount;
    }
}
