package com.consent.reconciliation.export;

import com.consent.reconciliation.report.ReportTable;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a merged {@link ReportTable} in a specific format.
 */
public interface ReportExporter {

    /**
     * Exports the table to a writer. The writer is flushed, not closed.
     *
     * @param table  the merged report table
     * @param writer the writer to write to
     * @return the export result
     * @throws java.io.UncheckedIOException if writing fails
     */
    ExportResult export(ReportTable table, Writer writer);

    /**
     * Exports the table to an output stream as UTF-8.
     */
    default ExportResult export(ReportTable table, OutputStream output) {
        return export(table, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    /**
     * Returns the format produced by this exporter (e.g., "csv", "html").
     */
    String getFormat();
}
