package com.consent.reconciliation.rules;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Result of resolving a table's headers: the column index of every recognized field,
 * plus the headers nothing claimed.
 */
public record ColumnMapping(TableKind table, Map<CanonicalField, Integer> columns, List<String> unmappedHeaders) {

    public ColumnMapping {
        columns = Map.copyOf(columns);
        unmappedHeaders = unmappedHeaders != null ? List.copyOf(unmappedHeaders) : List.of();
    }

    public OptionalInt indexOf(CanonicalField field) {
        Integer index = columns.get(field);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    public boolean has(CanonicalField field) {
        return columns.containsKey(field);
    }

    /**
     * Returns the required fields of this table that no header resolved to.
     */
    public List<CanonicalField> missingRequired() {
        return Arrays.stream(CanonicalField.values())
                .filter(f -> f.belongsTo(table) && f.isRequired() && !has(f))
                .toList();
    }
}
