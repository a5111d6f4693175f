package com.consent.reconciliation.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything known about one participant for a report run: signature events in
 * chronological order, end-of-study dates and the screening outcome.
 * Undated signature events sort after dated ones, keeping their input order.
 */
public class ParticipantTimeline {

    private static final Comparator<SignatureEvent> CHRONOLOGICAL =
            Comparator.comparing(SignatureEvent::date, Comparator.nullsLast(Comparator.naturalOrder()));

    private final String participantId;
    private final List<SignatureEvent> events;
    private final LocalDate exitDate;
    private final LocalDate deathDate;
    private final boolean eligible;

    private ParticipantTimeline(Builder builder) {
        this.participantId = builder.participantId;
        List<SignatureEvent> sorted = new ArrayList<>(builder.events);
        sorted.sort(CHRONOLOGICAL);
        this.events = List.copyOf(sorted);
        this.exitDate = builder.exitDate;
        this.deathDate = builder.deathDate;
        this.eligible = builder.eligible;
    }

    public String getParticipantId() {
        return participantId;
    }

    public List<SignatureEvent> getEvents() {
        return events;
    }

    public Optional<LocalDate> getExitDate() {
        return Optional.ofNullable(exitDate);
    }

    public Optional<LocalDate> getDeathDate() {
        return Optional.ofNullable(deathDate);
    }

    public boolean isEligible() {
        return eligible;
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    /**
     * Returns the first event in chronological order, the one whose randomization
     * groups annotate the participant.
     */
    public Optional<SignatureEvent> firstEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(0));
    }

    /**
     * Returns the latest signature date, or empty when no event carries a date.
     */
    public Optional<LocalDate> lastSignatureDate() {
        return events.stream()
                .map(SignatureEvent::date)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParticipantTimeline that = (ParticipantTimeline) o;
        return eligible == that.eligible
                && participantId.equals(that.participantId)
                && events.equals(that.events)
                && Objects.equals(exitDate, that.exitDate)
                && Objects.equals(deathDate, that.deathDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participantId, events, exitDate, deathDate, eligible);
    }

    @Override
    public String toString() {
        return "ParticipantTimeline{" +
                "participantId='" + participantId + '\'' +
                ", events=" + events.size() +
                ", exitDate=" + exitDate +
                ", deathDate=" + deathDate +
                ", eligible=" + eligible +
                '}';
    }

    public static Builder builder(String participantId) {
        return new Builder(participantId);
    }

    public static class Builder {
        private final String participantId;
        private final List<SignatureEvent> events = new ArrayList<>();
        private LocalDate exitDate;
        private LocalDate deathDate;
        private boolean eligible = true;

        private Builder(String participantId) {
            this.participantId = Objects.requireNonNull(participantId, "participantId is required");
        }

        public Builder event(SignatureEvent event) {
            if (!participantId.equals(event.participantId())) {
                throw new IllegalArgumentException("Event belongs to participant '" + event.participantId()
                        + "', not '" + participantId + "'");
            }
            this.events.add(event);
            return this;
        }

        public Builder events(List<SignatureEvent> events) {
            events.forEach(this::event);
            return this;
        }

        public Builder exitDate(LocalDate exitDate) {
            this.exitDate = exitDate;
            return this;
        }

        public Builder deathDate(LocalDate deathDate) {
            this.deathDate = deathDate;
            return this;
        }

        public Builder eligible(boolean eligible) {
            this.eligible = eligible;
            return this;
        }

        public ParticipantTimeline build() {
            return new ParticipantTimeline(this);
        }
    }
}
