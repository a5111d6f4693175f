package com.consent.reconciliation.bulk;

import com.consent.reconciliation.rules.TableKind;

/**
 * Turns a {@link RawTable} into typed records.
 *
 * @param <T> the record type
 */
public interface TableImporter<T> {

    /**
     * Imports the records of a table.
     *
     * @param table    the table to import
     * @param callback optional progress callback
     * @return the imported records and the data-quality warnings raised on the way
     */
    ImportResult<T> importRecords(RawTable table, ProgressCallback callback);

    /**
     * Returns the kind of table this importer reads.
     */
    TableKind getTableKind();
}
