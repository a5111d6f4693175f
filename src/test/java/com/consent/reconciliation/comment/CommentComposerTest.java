package com.consent.reconciliation.comment;

import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.SignatureEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CommentComposerTest {

    private final CommentComposer composer = new CommentComposer();

    @Test
    @DisplayName("Screening failure replaces the whole comment")
    void screeningFailure() {
        ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                .event(new SignatureEvent("P1", LocalDate.of(2020, 1, 5), "A", "B"))
                .deathDate(LocalDate.of(2021, 3, 1))
                .eligible(false)
                .build();

        assertEquals("Screening Failure", composer.compose(timeline));
    }

    @Test
    @DisplayName("Groups of the first signature and the death note, one per line")
    void groupsAndDeath() {
        ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                .event(new SignatureEvent("P1", LocalDate.of(2021, 1, 5), "C", "D"))
                .event(new SignatureEvent("P1", LocalDate.of(2020, 1, 5), "A", "B"))
                .exitDate(LocalDate.of(2021, 2, 1))
                .deathDate(LocalDate.of(2021, 3, 1))
                .build();

        assertEquals("A / B\nEOS (Death, 01.03.2021)", composer.compose(timeline));
    }

    @Test
    @DisplayName("Plain exit is rendered with day.month.year")
    void plainExit() {
        ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                .event(new SignatureEvent("P1", LocalDate.of(2020, 1, 5), "A", null))
                .exitDate(LocalDate.of(2020, 12, 1))
                .build();

        assertEquals("A / -\nEOS (01.12.2020)", composer.compose(timeline));
    }

    @Test
    @DisplayName("Missing groups use the placeholder and no exit leaves no separator")
    void missingGroupsNoExit() {
        ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                .event(new SignatureEvent("P1", LocalDate.of(2020, 1, 5), " ", null))
                .build();

        assertEquals("- / -", composer.compose(timeline));
    }

    @Test
    @DisplayName("Participant without signatures only gets the exit note")
    void noSignatures() {
        ParticipantTimeline timeline = ParticipantTimeline.builder("P1")
                .exitDate(LocalDate.of(2020, 12, 1))
                .build();

        assertEquals("EOS (01.12.2020)", composer.compose(timeline));
        assertEquals("", composer.compose(ParticipantTimeline.builder("P2").build()));
    }

    @Test
    @DisplayName("Custom placeholder and screening text are used")
    void customTexts() {
        CommentComposer custom = new CommentComposer("n/a", "Screen fail");
        ParticipantTimeline signed = ParticipantTimeline.builder("P1")
                .event(new SignatureEvent("P1", LocalDate.of(2020, 1, 5), null, "B"))
                .build();

        assertEquals("n/a / B", custom.compose(signed));
        assertEquals("Screen fail", custom.compose(ParticipantTimeline.builder("P2").eligible(false).build()));
    }
}
