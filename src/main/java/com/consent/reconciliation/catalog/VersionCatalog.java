package com.consent.reconciliation.catalog;

import com.consent.reconciliation.core.model.CatalogVersion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, date-ordered list of consent form versions.
 *
 * <p>The lookup mode is fixed when the catalog is built. Both modes answer
 * "which versions are in force on this date"; an empty answer means no version
 * was in force yet (or the date was missing) and is not an error.</p>
 */
public final class VersionCatalog {

    private final List<CatalogVersion> versions;
    private final LookupMode mode;

    private VersionCatalog(List<CatalogVersion> versions, LookupMode mode) {
        List<CatalogVersion> sorted = new ArrayList<>(versions);
        // List.sort is stable: versions sharing a date keep their input order
        sorted.sort(Comparator.comparing(CatalogVersion::effectiveFrom));
        this.versions = List.copyOf(sorted);
        this.mode = mode;
    }

    /**
     * Builds a catalog.
     *
     * @throws IllegalArgumentException if two versions share a name; signed versions
     *                                  are resolved by name, so names must be unique
     */
    public static VersionCatalog of(List<CatalogVersion> versions, LookupMode mode) {
        Objects.requireNonNull(versions, "versions is required");
        Objects.requireNonNull(mode, "mode is required");
        Set<String> names = new HashSet<>();
        for (CatalogVersion version : versions) {
            if (!names.add(version.name())) {
                throw new IllegalArgumentException("Duplicate catalog version name: " + version.name());
            }
        }
        return new VersionCatalog(versions, mode);
    }

    /**
     * Returns all versions in ascending {@code effectiveFrom} order.
     */
    public List<CatalogVersion> versions() {
        return versions;
    }

    public LookupMode mode() {
        return mode;
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }

    public int size() {
        return versions.size();
    }

    /**
     * Returns the names of the versions in force on the given date, in catalog order.
     *
     * @param date the date to resolve, may be null
     * @return the applicable version names, empty if none applies
     */
    public Set<String> applicableVersions(LocalDate date) {
        if (date == null || versions.isEmpty()) {
            return Set.of();
        }
        return switch (mode) {
            case INTERVAL -> intervalLookup(date);
            case TIED_LATEST -> tiedLatestLookup(date);
        };
    }

    private Set<String> intervalLookup(LocalDate date) {
        for (int i = 0; i < versions.size(); i++) {
            CatalogVersion version = versions.get(i);
            LocalDate from = version.effectiveFrom();
            LocalDate until = i + 1 < versions.size() ? versions.get(i + 1).effectiveFrom() : null;
            boolean started = !date.isBefore(from);
            if (started && (until == null || date.isBefore(until))) {
                return Set.of(version.name());
            }
        }
        return Set.of();
    }

    private Set<String> tiedLatestLookup(LocalDate date) {
        LocalDate latest = null;
        for (CatalogVersion version : versions) {
            if (!version.effectiveFrom().isAfter(date)) {
                latest = version.effectiveFrom();
            }
        }
        if (latest == null) {
            return Set.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (CatalogVersion version : versions) {
            if (version.effectiveFrom().equals(latest)) {
                names.add(version.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public String toString() {
        return "VersionCatalog{versions=" + versions.size() + ", mode=" + mode + '}';
    }
}
