package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.ExitRecord;
import com.consent.reconciliation.rules.CanonicalField;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports end-of-study records. A participant listed more than once keeps the last
 * record, in the position of its first occurrence.
 */
public class ExitRecordImporter extends AbstractTableImporter<ExitRecord> {

    public ExitRecordImporter(ColumnNormalizer normalizer) {
        super(normalizer);
    }

    @Override
    protected ExitRecord convert(Cells cells) {
        String participantId = cells.text(CanonicalField.PARTICIPANT_ID);
        if (participantId == null) {
            cells.warn(CanonicalField.PARTICIPANT_ID, "", "Exit row without participant id skipped");
            return null;
        }
        return new ExitRecord(
                participantId,
                cells.date(CanonicalField.EXIT_DATE),
                cells.date(CanonicalField.DEATH_DATE));
    }

    @Override
    protected List<ExitRecord> complete(List<ExitRecord> records, List<DataQualityWarning> warnings) {
        Map<String, ExitRecord> byParticipant = new LinkedHashMap<>();
        for (ExitRecord record : records) {
            if (byParticipant.put(record.participantId(), record) != null) {
                warnings.add(new DataQualityWarning(getTableKind().label(), 0, "", record.participantId(),
                        "Duplicate exit record; last one used"));
            }
        }
        return new ArrayList<>(byParticipant.values());
    }

    @Override
    public TableKind getTableKind() {
        return TableKind.EXITS;
    }
}
