package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.rules.CanonicalField;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports the consent form catalog.
 * Rows without a version name or without a usable effective date are skipped, as are
 * later rows repeating a version name already imported.
 */
public class CatalogImporter extends AbstractTableImporter<CatalogVersion> {

    public CatalogImporter(ColumnNormalizer normalizer) {
        super(normalizer);
    }

    @Override
    protected CatalogVersion convert(Cells cells) {
        String name = cells.text(CanonicalField.VERSION_NAME);
        if (name == null) {
            cells.warn(CanonicalField.VERSION_NAME, "", "Catalog row without version name skipped");
            return null;
        }
        LocalDate effectiveFrom = cells.date(CanonicalField.EFFECTIVE_FROM);
        if (effectiveFrom == null) {
            cells.warn(CanonicalField.EFFECTIVE_FROM, name, "Version without effective date left out of the catalog");
            return null;
        }
        return new CatalogVersion(name, effectiveFrom);
    }

    @Override
    protected List<CatalogVersion> complete(List<CatalogVersion> records, List<DataQualityWarning> warnings) {
        Map<String, CatalogVersion> byName = new LinkedHashMap<>();
        for (CatalogVersion version : records) {
            CatalogVersion first = byName.putIfAbsent(version.name(), version);
            if (first != null) {
                warnings.add(new DataQualityWarning(getTableKind().label(), 0, "", version.name(),
                        "Duplicate version name; first one (effective " + first.effectiveFrom() + ") used"));
            }
        }
        return new ArrayList<>(byName.values());
    }

    @Override
    public TableKind getTableKind() {
        return TableKind.CATALOG;
    }
}
