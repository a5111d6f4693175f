package com.consent.reconciliation.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps raw column headers to a {@link CanonicalField} by regex.
 * The pattern is searched (not fully matched) in the trimmed, lower-cased header.
 * Rules are tried in priority order (lower number first).
 */
public class ColumnRule {
    private final String name;
    private final Pattern pattern;
    private final CanonicalField field;
    private final int priority;

    private ColumnRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.field = builder.field;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public CanonicalField getField() {
        return field;
    }

    public int getPriority() {
        return priority;
    }

    public boolean appliesTo(TableKind kind) {
        return field.belongsTo(kind);
    }

    public boolean matches(String header) {
        if (header == null) {
            return false;
        }
        return pattern.matcher(header.trim().toLowerCase(Locale.ROOT)).find();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnRule that = (ColumnRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ColumnRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", field=" + field +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private CanonicalField field;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder field(CanonicalField field) {
            this.field = field;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public ColumnRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(field, "field is required");
            return new ColumnRule(this);
        }
    }
}
