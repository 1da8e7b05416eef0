package com.artistreach.enrichment.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What a step handler hands back to the controller. {@code resolvedData} marks a step that produced
 * data for a later step (a canonical channel URL, a link-in-bio URL) even without an email.
 */
public record StepOutcome(
    List<EmailCandidate> candidates,
    String rawContent,
    String urlFetched,
    FetchTier tierUsed,
    boolean wasBlocked,
    List<RejectedEmail> rejected,
    AuxiliaryFields auxiliary,
    boolean resolvedData,
    String failureReason
) {
    public StepOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
        auxiliary = auxiliary == null ? AuxiliaryFields.EMPTY : auxiliary;
        tierUsed = tierUsed == null ? FetchTier.NONE : tierUsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StepOutcome failure(String urlFetched, String failureReason) {
        return builder().urlFetched(urlFetched).failureReason(failureReason).build();
    }

    public int contentLength() {
        return rawContent == null ? 0 : rawContent.length();
    }

    public static final class Builder {
        private final List<EmailCandidate> candidates = new ArrayList<>();
        private final List<RejectedEmail> rejected = new ArrayList<>();
        private String rawContent;
        private String urlFetched;
        private FetchTier tierUsed = FetchTier.NONE;
        private boolean wasBlocked;
        private AuxiliaryFields auxiliary = AuxiliaryFields.EMPTY;
        private boolean resolvedData;
        private String failureReason;

        private Builder() {
        }

        public Builder extraction(ExtractionResult extraction) {
            if (extraction != null) {
                candidates.addAll(extraction.candidates());
                rejected.addAll(extraction.rejected());
                if (extraction.rawContentUsed() != null) {
                    rawContent = extraction.rawContentUsed();
                }
            }
            return this;
        }

        public Builder candidate(EmailCandidate candidate) {
            candidates.add(candidate);
            return this;
        }

        public Builder rejected(List<RejectedEmail> values) {
            if (values != null) {
                rejected.addAll(values);
            }
            return this;
        }

        public Builder rawContent(String rawContent) {
            this.rawContent = rawContent;
            return this;
        }

        public Builder fetch(FetchOutcome fetch) {
            if (fetch != null) {
                this.urlFetched = fetch.url();
                this.tierUsed = fetch.tierUsed();
                this.wasBlocked = fetch.wasBlocked();
                if (fetch.hasContent() && rawContent == null) {
                    this.rawContent = fetch.content();
                }
            }
            return this;
        }

        public Builder urlFetched(String urlFetched) {
            this.urlFetched = urlFetched;
            return this;
        }

        public Builder tierUsed(FetchTier tierUsed) {
            this.tierUsed = tierUsed;
            return this;
        }

        public Builder wasBlocked(boolean wasBlocked) {
            this.wasBlocked = wasBlocked;
            return this;
        }

        public Builder auxiliary(AuxiliaryFields auxiliary) {
            this.auxiliary = this.auxiliary.mergedWith(auxiliary);
            return this;
        }

        public Builder resolvedData(boolean resolvedData) {
            this.resolvedData = resolvedData;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public StepOutcome build() {
            return new StepOutcome(
                candidates,
                rawContent,
                urlFetched,
                tierUsed,
                wasBlocked,
                rejected,
                auxiliary,
                resolvedData,
                failureReason
            );
        }
    }
}
