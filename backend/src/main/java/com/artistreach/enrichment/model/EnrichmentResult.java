package com.artistreach.enrichment.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class EnrichmentResult {
    private final String artistId;
    private final String artistName;
    private final List<DiscoveryStep> steps;
    private final List<EmailCandidate> acceptedCandidates = new ArrayList<>();
    private final List<RejectedEmail> rejectedCandidates = new ArrayList<>();
    private String bestEmail;
    private double bestConfidence;
    private String bestSource;
    private AuxiliaryFields auxiliary = AuxiliaryFields.EMPTY;
    private long totalDurationMs;

    public EnrichmentResult(String artistId, String artistName, List<DiscoveryStep> steps) {
        this.artistId = artistId;
        this.artistName = artistName;
        this.steps = List.copyOf(steps);
    }

    /**
     * Records an accepted candidate. The best email only moves on a strictly higher confidence,
     * so among equals the earliest offer keeps it.
     */
    public void offer(EmailCandidate candidate) {
        acceptedCandidates.add(candidate);
        if (bestEmail == null || candidate.confidence() > bestConfidence) {
            bestEmail = candidate.email();
            bestConfidence = candidate.confidence();
            bestSource = candidate.source();
        }
    }

    public void reject(RejectedEmail rejected) {
        if (!rejectedCandidates.contains(rejected)) {
            rejectedCandidates.add(rejected);
        }
    }

    public void mergeAuxiliary(AuxiliaryFields fields) {
        this.auxiliary = auxiliary.mergedWith(fields);
    }

    public void retainAccepted(List<EmailCandidate> kept) {
        acceptedCandidates.clear();
        bestEmail = null;
        bestConfidence = 0.0;
        bestSource = null;
        for (EmailCandidate candidate : kept) {
            offer(candidate);
        }
    }

    public void finish(long totalDurationMs) {
        this.totalDurationMs = totalDurationMs;
    }

    public String getArtistId() {
        return artistId;
    }

    public String getArtistName() {
        return artistName;
    }

    public String getBestEmail() {
        return bestEmail;
    }

    public double getBestConfidence() {
        return bestConfidence;
    }

    public String getBestSource() {
        return bestSource;
    }

    public List<EmailCandidate> getAcceptedCandidates() {
        return Collections.unmodifiableList(acceptedCandidates);
    }

    public List<RejectedEmail> getRejectedCandidates() {
        return Collections.unmodifiableList(rejectedCandidates);
    }

    public List<DiscoveryStep> getSteps() {
        return steps;
    }

    public DiscoveryStep step(DiscoveryMethod method) {
        for (DiscoveryStep step : steps) {
            if (step.getMethod() == method) {
                return step;
            }
        }
        return null;
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public boolean isContactable() {
        return bestEmail != null;
    }

    public AuxiliaryFields getAuxiliary() {
        return auxiliary;
    }
}
