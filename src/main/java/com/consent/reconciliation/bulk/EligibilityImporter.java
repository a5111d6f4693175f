package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.EligibilityRecord;
import com.consent.reconciliation.rules.CanonicalField;
import com.consent.reconciliation.rules.ColumnMapping;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the screening outcome from the exit table.
 *
 * <p>A table without an eligibility column yields no records, so every participant
 * counts as eligible. Rows without participant id are left to {@link ExitRecordImporter}
 * to report. Unrecognized flag values count as eligible and raise a warning.</p>
 */
public class EligibilityImporter extends AbstractTableImporter<EligibilityRecord> {

    private static final Set<String> YES = Set.of("yes", "y", "true", "1", "ja", "j");
    private static final Set<String> NO = Set.of("no", "n", "false", "0", "nein");

    public EligibilityImporter(ColumnNormalizer normalizer) {
        super(normalizer);
    }

    @Override
    protected boolean canImport(ColumnMapping mapping, List<DataQualityWarning> warnings) {
        return mapping.has(CanonicalField.PARTICIPANT_ID) && mapping.has(CanonicalField.ELIGIBLE);
    }

    @Override
    protected EligibilityRecord convert(Cells cells) {
        String participantId = cells.text(CanonicalField.PARTICIPANT_ID);
        String flag = cells.text(CanonicalField.ELIGIBLE);
        if (participantId == null || flag == null) {
            return null;
        }
        String normalized = flag.toLowerCase(Locale.ROOT);
        if (NO.contains(normalized)) {
            return new EligibilityRecord(participantId, false);
        }
        if (!YES.contains(normalized)) {
            cells.warn(CanonicalField.ELIGIBLE, flag, "Unrecognized eligibility flag treated as eligible");
        }
        return new EligibilityRecord(participantId, true);
    }

    @Override
    public TableKind getTableKind() {
        return TableKind.EXITS;
    }
}
