package com.consent.reconciliation.bulk;

import com.consent.reconciliation.core.model.SignatureEvent;
import com.consent.reconciliation.rules.CanonicalField;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;

/**
 * Imports signature events. An unparseable signature date keeps the event with an
 * absent date; a row without participant id is skipped.
 */
public class SignatureEventImporter extends AbstractTableImporter<SignatureEvent> {

    public SignatureEventImporter(ColumnNormalizer normalizer) {
        super(normalizer);
    }

    @Override
    protected SignatureEvent convert(Cells cells) {
        String participantId = cells.text(CanonicalField.PARTICIPANT_ID);
        if (participantId == null) {
            cells.warn(CanonicalField.PARTICIPANT_ID, "", "Signature row without participant id skipped");
            return null;
        }
        return new SignatureEvent(
                participantId,
                cells.date(CanonicalField.SIGNATURE_DATE),
                cells.text(CanonicalField.RANDO_GROUP_1),
                cells.text(CanonicalField.RANDO_GROUP_2));
    }

    @Override
    public TableKind getTableKind() {
        return TableKind.SIGNATURES;
    }
}
