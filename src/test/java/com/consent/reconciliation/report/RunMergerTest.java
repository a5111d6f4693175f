package com.consent.reconciliation.report;

import com.consent.reconciliation.core.model.ConsentStatus;
import com.consent.reconciliation.core.model.ReportRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunMergerTest {

    private final RunMerger merger = new RunMerger();

    private static ReportRow row(String participant, String version, String comment) {
        return new ReportRow(participant, version, ConsentStatus.notApplicable(), comment);
    }

    @Test
    @DisplayName("Should collapse each run of one participant into a single span")
    void collapsesRuns() {
        List<ReportRow> rows = List.of(
                row("P1", "V1", "c1"), row("P1", "V2", "c1"), row("P1", "V3", "c1"),
                row("P2", "V1", "c2"), row("P2", "V2", "c2"));

        List<MergeSpan> spans = merger.spans(rows);

        assertEquals(List.of(new MergeSpan("P1", 0, 3), new MergeSpan("P2", 3, 2)), spans);
    }

    @Test
    @DisplayName("Only the first row of a span carries participant and comment")
    void firstRowCarriesValues() {
        List<ReportRow> rows = List.of(
                new ReportRow("P1", "V1", ConsentStatus.signed(LocalDate.of(2020, 6, 1)), "A / B"),
                new ReportRow("P1", "V2", ConsentStatus.needsVerification(), "A / B"));

        ReportTable table = merger.merge(rows);

        assertEquals(List.of(
                new ReportTableRow("P1", "V1", "2020-06-01", "A / B", 2),
                new ReportTableRow("", "V2", "CHECK", "", 0)), table.rows());
    }

    @Test
    @DisplayName("Should never merge non-adjacent rows of the same participant")
    void nonAdjacentNotMerged() {
        List<ReportRow> rows = List.of(row("P1", "V1", "c"), row("P2", "V1", "d"), row("P1", "V2", "c"));

        List<MergeSpan> spans = merger.spans(rows);

        assertEquals(3, spans.size());
        assertEquals("P1", spans.get(2).participantId());
        assertEquals("P1", merger.merge(rows).rows().get(2).participantCell());
    }

    @Test
    @DisplayName("Span row counts should add up to the input row count")
    void countsConserved() {
        List<ReportRow> rows = List.of(
                row("A", "V1", ""), row("A", "V2", ""), row("B", "V1", ""),
                row("C", "V1", ""), row("C", "V2", ""), row("C", "V3", ""), row("A", "V1", ""));

        List<MergeSpan> spans = merger.spans(rows);

        assertEquals(rows.size(), spans.stream().mapToInt(MergeSpan::rowCount).sum());
        assertEquals(rows.size(), merger.merge(rows).rows().size());
    }

    @Test
    @DisplayName("Empty input should produce an empty table")
    void emptyInput() {
        ReportTable table = merger.merge(List.of());
        assertTrue(table.isEmpty());
        assertTrue(table.spans().isEmpty());
    }
}
