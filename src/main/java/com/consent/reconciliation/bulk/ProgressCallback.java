package com.consent.reconciliation.bulk;

/**
 * Receives progress while the rows of an input table are converted.
 * Importers call it every 100 rows and once more when the table is done.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed data rows converted so far
     * @param total     data rows in the table
     * @param message   short status line, e.g. {@code "Imported 200 signatures rows"}
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
