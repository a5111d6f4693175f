package com.consent.reconciliation.bulk;

import java.util.List;
import java.util.Objects;

/**
 * An input table as read from a file: headers and untyped cell values.
 *
 * @param source  where the table came from, for log and warning messages
 * @param headers the column headers in file order
 * @param rows    the data rows, blank lines excluded
 */
public record RawTable(String source, List<String> headers, List<Row> rows) {

    public RawTable {
        Objects.requireNonNull(source, "source is required");
        headers = headers != null ? List.copyOf(headers) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public static RawTable empty(String source) {
        return new RawTable(source, List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * One data row.
     *
     * @param lineNumber the 1-based line (CSV) or record (JSON) number
     * @param values     cell values; may be shorter than the header list
     */
    public record Row(long lineNumber, List<String> values) {
        public Row {
            values = values != null ? List.copyOf(values) : List.of();
        }

        /**
         * Returns the cell value at the given column, or an empty string when the row
         * is shorter than the header.
         */
        public String value(int column) {
            return column >= 0 && column < values.size() ? values.get(column) : "";
        }
    }
}
