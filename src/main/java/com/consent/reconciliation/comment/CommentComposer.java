package com.consent.reconciliation.comment;

import com.consent.reconciliation.core.model.ParticipantTimeline;
import com.consent.reconciliation.core.model.SignatureEvent;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the free-text comment shown next to a participant's rows.
 *
 * <p>A screening failure replaces the whole comment. Otherwise the comment holds the
 * randomization groups of the first signature ({@code "A / B"}) and an end-of-study
 * note, one per line. Death takes priority over a plain exit.</p>
 */
public class CommentComposer {

    public static final String DEFAULT_SCREENING_FAILURE = "Screening Failure";
    public static final String DEFAULT_MISSING_GROUP = "-";

    private static final DateTimeFormatter COMMENT_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final String LINE_SEPARATOR = "\n";

    private final String missingGroupPlaceholder;
    private final String screeningFailureText;

    public CommentComposer() {
        this(DEFAULT_MISSING_GROUP, DEFAULT_SCREENING_FAILURE);
    }

    public CommentComposer(String missingGroupPlaceholder, String screeningFailureText) {
        this.missingGroupPlaceholder = Objects.requireNonNull(missingGroupPlaceholder,
                "missingGroupPlaceholder is required");
        this.screeningFailureText = Objects.requireNonNull(screeningFailureText,
                "screeningFailureText is required");
    }

    public String compose(ParticipantTimeline timeline) {
        if (!timeline.isEligible()) {
            return screeningFailureText;
        }

        List<String> parts = new ArrayList<>(2);
        timeline.firstEvent().map(this::randomization).ifPresent(parts::add);
        String endOfStudy = endOfStudy(timeline);
        if (!endOfStudy.isEmpty()) {
            parts.add(endOfStudy);
        }
        return String.join(LINE_SEPARATOR, parts);
    }

    private String randomization(SignatureEvent event) {
        return groupOrPlaceholder(event.randoGroup1()) + " / " + groupOrPlaceholder(event.randoGroup2());
    }

    private String groupOrPlaceholder(String group) {
        return group == null || group.isBlank() ? missingGroupPlaceholder : group.trim();
    }

    private static String endOfStudy(ParticipantTimeline timeline) {
        if (timeline.getDeathDate().isPresent()) {
            return "EOS (Death, " + format(timeline.getDeathDate().get()) + ")";
        }
        return timeline.getExitDate()
                .map(exit -> "EOS (" + format(exit) + ")")
                .orElse("");
    }

    static String format(LocalDate date) {
        return COMMENT_DATE.format(date);
    }
}
