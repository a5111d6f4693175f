package com.consent.reconciliation.api;

import com.consent.reconciliation.catalog.LookupMode;
import com.consent.reconciliation.comment.CommentComposer;

/**
 * Options for consent report runs.
 * Configures catalog lookup, participant ordering, parallelism and comment texts.
 */
public class ReconciliationOptions {

    private static final int DEFAULT_PARALLELISM = 1;

    private final LookupMode lookupMode;
    private final ParticipantOrder participantOrder;
    private final int parallelism;
    private final String missingGroupPlaceholder;
    private final String screeningFailureText;

    private ReconciliationOptions(Builder builder) {
        this.lookupMode = builder.lookupMode;
        this.participantOrder = builder.participantOrder;
        this.parallelism = builder.parallelism;
        this.missingGroupPlaceholder = builder.missingGroupPlaceholder;
        this.screeningFailureText = builder.screeningFailureText;
    }

    public LookupMode getLookupMode() {
        return lookupMode;
    }

    public ParticipantOrder getParticipantOrder() {
        return participantOrder;
    }

    public int getParallelism() {
        return parallelism;
    }

    public String getMissingGroupPlaceholder() {
        return missingGroupPlaceholder;
    }

    public String getScreeningFailureText() {
        return screeningFailureText;
    }

    /**
     * Creates default options: interval lookup, ascending ids, single-threaded.
     */
    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options resolving signatures to every version of the latest effective date.
     */
    public static ReconciliationOptions tiedLatest() {
        return builder().lookupMode(LookupMode.TIED_LATEST).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LookupMode lookupMode = LookupMode.INTERVAL;
        private ParticipantOrder participantOrder = ParticipantOrder.ASCENDING_ID;
        private int parallelism = DEFAULT_PARALLELISM;
        private String missingGroupPlaceholder = CommentComposer.DEFAULT_MISSING_GROUP;
        private String screeningFailureText = CommentComposer.DEFAULT_SCREENING_FAILURE;

        public Builder lookupMode(LookupMode lookupMode) {
            if (lookupMode == null) {
                throw new IllegalArgumentException("lookupMode must not be null");
            }
            this.lookupMode = lookupMode;
            return this;
        }

        public Builder participantOrder(ParticipantOrder participantOrder) {
            if (participantOrder == null) {
                throw new IllegalArgumentException("participantOrder must not be null");
            }
            this.participantOrder = participantOrder;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder missingGroupPlaceholder(String missingGroupPlaceholder) {
            if (missingGroupPlaceholder == null) {
                throw new IllegalArgumentException("missingGroupPlaceholder must not be null");
            }
            this.missingGroupPlaceholder = missingGroupPlaceholder;
            return this;
        }

        public Builder screeningFailureText(String screeningFailureText) {
            if (screeningFailureText == null || screeningFailureText.isBlank()) {
                throw new IllegalArgumentException("screeningFailureText must not be null or blank");
            }
            this.screeningFailureText = screeningFailureText;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "lookupMode=" + lookupMode +
                ", participantOrder=" + participantOrder +
                ", parallelism=" + parallelism +
                ", missingGroupPlaceholder='" + missingGroupPlaceholder + '\'' +
                ", screeningFailureText='" + screeningFailureText + '\'' +
                '}';
    }
}
