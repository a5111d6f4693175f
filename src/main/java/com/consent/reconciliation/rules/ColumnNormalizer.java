package com.consent.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves raw table headers to {@link CanonicalField}s.
 *
 * <p>An exact entry in the {@link StudyMapping} wins; otherwise the rules are tried in
 * priority order. When several headers resolve to the same field, the leftmost one is
 * used.</p>
 */
public class ColumnNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ColumnNormalizer.class);

    private final StudyMapping studyMapping;
    private final List<ColumnRule> rules;

    public ColumnNormalizer() {
        this(StudyMapping.empty(), DefaultColumnRules.getRules());
    }

    public ColumnNormalizer(StudyMapping studyMapping) {
        this(studyMapping, DefaultColumnRules.getRules());
    }

    public ColumnNormalizer(StudyMapping studyMapping, List<ColumnRule> rules) {
        this.studyMapping = Objects.requireNonNull(studyMapping, "studyMapping is required");
        List<ColumnRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ColumnRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public StudyMapping getStudyMapping() {
        return studyMapping;
    }

    public List<ColumnRule> getRules() {
        return rules;
    }

    /**
     * Resolves a single header for the given table.
     */
    public Optional<CanonicalField> resolve(String header, TableKind table) {
        Optional<CanonicalField> mapped = studyMapping.lookup(header)
                .filter(field -> field.belongsTo(table));
        if (mapped.isPresent()) {
            return mapped;
        }
        for (ColumnRule rule : rules) {
            if (rule.appliesTo(table) && rule.matches(header)) {
                log.trace("Rule '{}' mapped header '{}' to {}", rule.getName(), header, rule.getField());
                return Optional.of(rule.getField());
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves all headers of a table.
     */
    public ColumnMapping map(TableKind table, List<String> headers) {
        Map<CanonicalField, Integer> columns = new EnumMap<>(CanonicalField.class);
        List<String> unmapped = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            Optional<CanonicalField> field = resolve(header, table);
            if (field.isEmpty()) {
                unmapped.add(header);
                continue;
            }
            if (columns.putIfAbsent(field.get(), i) != null) {
                log.debug("Ignoring duplicate column '{}' for {} in {} table", header, field.get(), table.label());
                unmapped.add(header);
            }
        }
        ColumnMapping mapping = new ColumnMapping(table, columns, unmapped);
        log.debug("columns.mapped table={} fields={} unmapped={}", table.label(), columns.keySet(), unmapped);
        return mapping;
    }
}
