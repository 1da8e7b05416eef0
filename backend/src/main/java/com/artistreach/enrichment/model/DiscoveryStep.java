package com.artistreach.enrichment.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DiscoveryStep {
    private final DiscoveryMethod method;
    private final String label;
    private StepStatus status = StepStatus.PENDING;
    private final List<String> acceptedEmails = new ArrayList<>();
    private final List<RejectedEmail> rejected = new ArrayList<>();
    private String bestEmail;
    private double confidence;
    private Instant startedAt;
    private long durationMs;
    private String urlFetched;
    private FetchTier tierUsed = FetchTier.NONE;
    private int contentLength;
    private boolean wasBlocked;
    private String reason;

    public DiscoveryStep(DiscoveryMethod method, String label) {
        this.method = method;
        this.label = label == null ? method.label() : label;
    }

    public void markRunning(Instant now) {
        this.status = StepStatus.RUNNING;
        this.startedAt = now;
    }

    public void markSkipped(String reason) {
        this.status = StepStatus.SKIPPED;
        this.reason = reason;
    }

    public void markFailed(String reason) {
        this.status = StepStatus.FAILED;
        this.reason = reason;
    }

    public void markSuccess(List<EmailCandidate> accepted) {
        this.status = StepStatus.SUCCESS;
        this.reason = null;
        EmailCandidate best = null;
        for (EmailCandidate candidate : accepted) {
            acceptedEmails.add(candidate.email());
            if (best == null || candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }
        if (best != null) {
            this.bestEmail = best.email();
            this.confidence = best.confidence();
        }
    }

    public void markResolvedOnly(String note) {
        this.status = StepStatus.SUCCESS;
        this.reason = note;
    }

    public void recordDiagnostics(StepOutcome outcome) {
        if (outcome == null) {
            return;
        }
        this.urlFetched = outcome.urlFetched();
        this.tierUsed = outcome.tierUsed();
        this.contentLength = outcome.contentLength();
        this.wasBlocked = outcome.wasBlocked();
    }

    public void addRejected(List<RejectedEmail> values) {
        for (RejectedEmail value : values) {
            if (!rejected.contains(value)) {
                rejected.add(value);
            }
        }
    }

    public void finish(Instant now) {
        if (startedAt != null) {
            this.durationMs = Duration.between(startedAt, now).toMillis();
        }
    }

    public DiscoveryMethod getMethod() {
        return method;
    }

    public String getMethodId() {
        return method.id();
    }

    public String getLabel() {
        return label;
    }

    public StepStatus getStatus() {
        return status;
    }

    public List<String> getAcceptedEmails() {
        return Collections.unmodifiableList(acceptedEmails);
    }

    public List<RejectedEmail> getRejected() {
        return Collections.unmodifiableList(rejected);
    }

    public String getBestEmail() {
        return bestEmail;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getUrlFetched() {
        return urlFetched;
    }

    public FetchTier getTierUsed() {
        return tierUsed;
    }

    public int getContentLength() {
        return contentLength;
    }

    public boolean isWasBlocked() {
        return wasBlocked;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return method.id() + "[" + status + (reason == null ? "" : ": " + reason) + "]";
    }
}
