package com.artistreach.enrichment.service;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.extract.EmailExtractionService;
import com.artistreach.enrichment.extract.VerbatimContentGuard;
import com.artistreach.enrichment.filter.EmailQualityFilter;
import com.artistreach.enrichment.http.RunDeadline;
import com.artistreach.enrichment.http.RunDeadlineContext;
import com.artistreach.enrichment.http.RunDeadlineExceededException;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.DiscoveryStep;
import com.artistreach.enrichment.model.EmailCandidate;
import com.artistreach.enrichment.model.EnrichmentResult;
import com.artistreach.enrichment.model.FilterResult;
import com.artistreach.enrichment.model.RejectedEmail;
import com.artistreach.enrichment.model.StepOutcome;
import com.artistreach.enrichment.step.DiscoveryStepTable;
import com.artistreach.enrichment.step.StepContext;
import com.artistreach.enrichment.step.StepDefinition;
import com.artistreach.enrichment.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the discovery waterfall for one artist. Steps run strictly one after another; the first step
 * that produces an address passing the quality filter ends the run and every later step is skipped.
 */
@Service
public class WaterfallController {
    private static final Logger log = LoggerFactory.getLogger(WaterfallController.class);

    private final DiscoveryStepTable stepTable;
    private final EmailQualityFilter qualityFilter;
    private final EnrichmentCapabilities capabilities;
    private final EnrichmentProperties properties;
    private final Clock clock;

    @Autowired
    public WaterfallController(
        DiscoveryStepTable stepTable,
        EmailQualityFilter qualityFilter,
        EnrichmentCapabilities capabilities,
        EnrichmentProperties properties
    ) {
        this(stepTable, qualityFilter, capabilities, properties, Clock.systemUTC());
    }

    WaterfallController(
        DiscoveryStepTable stepTable,
        EmailQualityFilter qualityFilter,
        EnrichmentCapabilities capabilities,
        EnrichmentProperties properties,
        Clock clock
    ) {
        this.stepTable = stepTable;
        this.qualityFilter = qualityFilter;
        this.capabilities = capabilities;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws EnrichmentConfigurationException when a mandatory capability is missing; nothing else
     *     escapes, failures of individual steps are recorded on the step
     */
    public EnrichmentResult runPipeline(ArtistProfile profile, EnrichmentProgressListener listener) {
        if (capabilities == null) {
            throw new EnrichmentConfigurationException("no capabilities configured");
        }
        capabilities.validate();
        EnrichmentProgressListener progress = listener == null ? EnrichmentProgressListener.NONE : listener;

        List<StepDefinition> rows = stepTable.rows();
        List<DiscoveryStep> steps = new ArrayList<>();
        for (StepDefinition row : rows) {
            steps.add(new DiscoveryStep(row.method(), row.label()));
        }
        EnrichmentResult result = new EnrichmentResult(profile.id(), profile.name(), steps);
        StepContext context = new StepContext(capabilities);
        Instant runStarted = clock.instant();
        RunDeadline deadline = new RunDeadline(
            clock,
            Duration.ofSeconds(properties.getPipeline().getEntityDeadlineSeconds()),
            "artist " + profile.id()
        );

        boolean anyStepRan = false;
        try (RunDeadlineContext.Scope ignored = RunDeadlineContext.activate(deadline)) {
            for (int i = 0; i < rows.size(); i++) {
                StepDefinition row = rows.get(i);
                DiscoveryStep step = steps.get(i);

                Optional<String> unmet = row.precondition().unmetReason(profile, context);
                if (unmet.isPresent()) {
                    step.markSkipped(unmet.get());
                    emit(progress, step, i);
                    continue;
                }

                if (anyStepRan) {
                    pause(properties.getPipeline().getStepDelayMs());
                }
                if (Thread.currentThread().isInterrupted()) {
                    step.markSkipped(ReasonCodeClassifier.INTERRUPTED);
                    emit(progress, step, i);
                    continue;
                }
                anyStepRan = true;
                step.markRunning(clock.instant());
                emit(progress, step, i);

                StepOutcome outcome;
                try {
                    outcome = row.handler().handle(profile, context);
                } catch (RunDeadlineExceededException e) {
                    log.warn("Step {} for {} ran past the run deadline", row.method().id(), profile.name());
                    step.finish(clock.instant());
                    step.markFailed(ReasonCodeClassifier.DEADLINE_EXCEEDED);
                    emit(progress, step, i);
                    continue;
                } catch (RuntimeException e) {
                    log.warn("Step {} failed for {}", row.method().id(), profile.name(), e);
                    step.finish(clock.instant());
                    step.markFailed(errorText(e));
                    emit(progress, step, i);
                    continue;
                }
                if (outcome == null) {
                    outcome = StepOutcome.failure(null, ReasonCodeClassifier.STEP_ERROR);
                }

                step.recordDiagnostics(outcome);
                result.mergeAuxiliary(outcome.auxiliary());
                List<EmailCandidate> accepted = gate(outcome, step, result);
                step.finish(clock.instant());

                if (!accepted.isEmpty()) {
                    step.markSuccess(accepted);
                    for (EmailCandidate candidate : accepted) {
                        result.offer(candidate);
                    }
                    emit(progress, step, i);
                    for (int j = i + 1; j < steps.size(); j++) {
                        steps.get(j).markSkipped(ReasonCodeClassifier.EARLY_TERMINATION);
                        emit(progress, steps.get(j), j);
                    }
                    break;
                }
                if (outcome.resolvedData()) {
                    step.markResolvedOnly(ReasonCodeClassifier.DISCOVERY_ONLY);
                } else {
                    step.markFailed(failureReason(outcome, step));
                }
                emit(progress, step, i);
            }
        }

        applyFinalGate(result);
        result.finish(Duration.between(runStarted, clock.instant()).toMillis());
        log.info(
            "Enrichment for {} finished in {} ms: {} (confidence {}, source {})",
            profile.name(),
            result.getTotalDurationMs(),
            result.isContactable() ? result.getBestEmail() : "no contact",
            result.getBestConfidence(),
            result.getBestSource()
        );
        return result;
    }

    /**
     * Applies the anti-hallucination rule and the quality filter to a step's candidates. Only
     * structured-field candidates are exempt from the literal-substring check.
     */
    private List<EmailCandidate> gate(StepOutcome outcome, DiscoveryStep step, EnrichmentResult result) {
        String source = step.getMethodId();
        List<RejectedEmail> rejected = new ArrayList<>();
        for (RejectedEmail value : outcome.rejected()) {
            rejected.add(value.withSource(source));
        }

        Map<String, EmailCandidate> kept = new LinkedHashMap<>();
        for (EmailCandidate candidate : outcome.candidates()) {
            if (candidate == null || candidate.email() == null) {
                continue;
            }
            String email = candidate.email().trim().toLowerCase(Locale.ROOT);
            boolean trusted = candidate.origin() != null && candidate.origin().isTrustedField();
            if (!trusted && !VerbatimContentGuard.appearsIn(email, outcome.rawContent())) {
                rejected.add(new RejectedEmail(email, EmailExtractionService.NOT_VERBATIM_REASON, source));
                continue;
            }
            EmailCandidate normalized = new EmailCandidate(email, source, candidate.confidence(), candidate.origin());
            EmailCandidate existing = kept.get(email);
            if (existing == null || normalized.confidence() > existing.confidence()) {
                kept.put(email, normalized);
            }
        }

        List<EmailCandidate> accepted = new ArrayList<>();
        if (!kept.isEmpty()) {
            FilterResult filtered = qualityFilter.filterEmails(kept.keySet());
            for (RejectedEmail value : filtered.rejected()) {
                rejected.add(value.withSource(source));
            }
            for (String email : filtered.accepted()) {
                accepted.add(kept.get(email));
            }
        }

        step.addRejected(rejected);
        for (RejectedEmail value : rejected) {
            result.reject(value);
        }
        return accepted;
    }

    private void applyFinalGate(EnrichmentResult result) {
        List<EmailCandidate> current = result.getAcceptedCandidates();
        if (current.isEmpty()) {
            return;
        }
        List<String> emails = new ArrayList<>();
        for (EmailCandidate candidate : current) {
            emails.add(candidate.email());
        }
        FilterResult filtered = qualityFilter.filterEmails(emails);
        if (filtered.accepted().size() == current.size()) {
            return;
        }
        List<EmailCandidate> kept = new ArrayList<>();
        for (EmailCandidate candidate : current) {
            if (filtered.accepted().contains(candidate.email())) {
                kept.add(candidate);
            }
        }
        for (RejectedEmail value : filtered.rejected()) {
            result.reject(value.withSource("final_gate"));
        }
        result.retainAccepted(kept);
    }

    private static String failureReason(StepOutcome outcome, DiscoveryStep step) {
        if (outcome.failureReason() != null && !outcome.failureReason().isBlank()) {
            return outcome.failureReason();
        }
        if (!step.getRejected().isEmpty()) {
            return ReasonCodeClassifier.ALL_CANDIDATES_REJECTED;
        }
        return ReasonCodeClassifier.NO_EMAIL_FOUND;
    }

    private static String errorText(RuntimeException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private static void emit(EnrichmentProgressListener listener, DiscoveryStep step, int index) {
        try {
            listener.onStepUpdate(step, index);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} ({})", step.getMethodId(), step.getStatus(), e);
        }
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
