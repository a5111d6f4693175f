package com.consent.reconciliation.core.model;

/**
 * An input value that could not be used and was treated as absent, or a row that was
 * skipped. Warnings never stop a report run; they are surfaced next to the report.
 *
 * @param table      the input table label ({@code catalog}, {@code signatures}, {@code exits})
 * @param lineNumber the 1-based line or record number, 0 for table-level problems
 * @param column     the offending column header, empty for row-level problems
 * @param value      the raw value, empty if not applicable
 * @param message    what was wrong and how it was handled
 */
public record DataQualityWarning(String table, long lineNumber, String column, String value, String message) {
    public DataQualityWarning {
        table = table != null ? table : "";
        column = column != null ? column : "";
        value = value != null ? value : "";
        message = message != null ? message : "";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(table);
        if (lineNumber > 0) {
            sb.append(" line ").append(lineNumber);
        }
        if (!column.isEmpty()) {
            sb.append(" [").append(column).append(']');
        }
        if (!value.isEmpty()) {
            sb.append(" '").append(value).append('\'');
        }
        return sb.append(": ").append(message).toString();
    }
}
