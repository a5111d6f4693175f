package com.consent.reconciliation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Study-specific translation of column codes to canonical fields.
 *
 * <p>Loaded once per run (see {@link StudyMappingLoader}) and handed to the
 * {@link ColumnNormalizer}. Codes are matched case-insensitively against the
 * trimmed header and take precedence over the generic {@link ColumnRule}s.</p>
 *
 * <pre>
 * {
 *   "study": "MNP-2",
 *   "columns": { "pat_no": "PARTICIPANT_ID", "ic_sign_dt": "SIGNATURE_DATE" }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StudyMapping {

    private static final StudyMapping EMPTY = new StudyMapping("", Map.of());

    private final String study;
    private final Map<String, CanonicalField> columns;

    @JsonCreator
    public StudyMapping(@JsonProperty("study") String study,
                        @JsonProperty("columns") Map<String, CanonicalField> columns) {
        this.study = study != null ? study : "";
        Map<String, CanonicalField> normalized = new LinkedHashMap<>();
        if (columns != null) {
            columns.forEach((code, field) -> {
                if (code != null && field != null) {
                    normalized.put(normalizeCode(code), field);
                }
            });
        }
        this.columns = Map.copyOf(normalized);
    }

    public static StudyMapping empty() {
        return EMPTY;
    }

    @JsonProperty("study")
    public String getStudy() {
        return study;
    }

    @JsonProperty("columns")
    public Map<String, CanonicalField> getColumns() {
        return columns;
    }

    public Optional<CanonicalField> lookup(String header) {
        if (header == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(normalizeCode(header)));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return columns.isEmpty();
    }

    private static String normalizeCode(String code) {
        return code.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "StudyMapping{study='" + study + "', columns=" + columns.size() + '}';
    }
}
