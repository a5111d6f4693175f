package com.consent.reconciliation.api;

import com.consent.reconciliation.core.model.EligibilityRecord;
import com.consent.reconciliation.core.model.ExitRecord;
import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.SignatureEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups the normalized input records into one {@link ParticipantTimeline} per participant.
 *
 * <p>Every participant named in the signature table or in the exit table gets a timeline,
 * so a participant who never signed still appears in the report. Timelines are returned
 * in the requested {@link ParticipantOrder}.</p>
 */
public class TimelineAssembler {

    public List<ParticipantTimeline> assemble(ConsentInputs inputs, ParticipantOrder order) {
        Set<String> participants = new LinkedHashSet<>();
        Map<String, List<SignatureEvent>> eventsByParticipant = new HashMap<>();
        for (SignatureEvent event : inputs.signatures()) {
            participants.add(event.participantId());
            eventsByParticipant.computeIfAbsent(event.participantId(), id -> new ArrayList<>()).add(event);
        }

        Map<String, ExitRecord> exits = new LinkedHashMap<>();
        for (ExitRecord exit : inputs.exits()) {
            participants.add(exit.participantId());
            exits.put(exit.participantId(), exit);
        }

        Map<String, Boolean> eligibility = new HashMap<>();
        for (EligibilityRecord record : inputs.eligibility()) {
            participants.add(record.participantId());
            eligibility.put(record.participantId(), record.eligible());
        }

        List<String> ordered = new ArrayList<>(participants);
        if (order == ParticipantOrder.ASCENDING_ID) {
            ordered.sort(Comparator.naturalOrder());
        }

        List<ParticipantTimeline> timelines = new ArrayList<>(ordered.size());
        for (String participantId : ordered) {
            ParticipantTimeline.Builder builder = ParticipantTimeline.builder(participantId)
                    .events(eventsByParticipant.getOrDefault(participantId, List.of()))
                    .eligible(eligibility.getOrDefault(participantId, true));
            ExitRecord exit = exits.get(participantId);
            if (exit != null) {
                builder.exitDate(exit.exitDate()).deathDate(exit.deathDate());
            }
            timelines.add(builder.build());
        }
        return timelines;
    }
}
