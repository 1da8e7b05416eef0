package com.artistreach.enrichment.service;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.model.ArtistProfile;
import com.artistreach.enrichment.model.BatchSummary;
import com.artistreach.enrichment.model.EnrichmentResult;
import com.artistreach.enrichment.model.RawArtistRecord;
import com.artistreach.enrichment.normalize.ArtistProfileNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Enriches a list of artists one after another with a pause between entities. Entities never run
 * concurrently, so the downstream rate limits hold for the whole batch.
 */
@Service
public class BatchEnrichmentRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchEnrichmentRunner.class);

    private final WaterfallController controller;
    private final ArtistProfileNormalizer normalizer;
    private final EnrichmentProperties properties;

    public BatchEnrichmentRunner(
        WaterfallController controller,
        ArtistProfileNormalizer normalizer,
        EnrichmentProperties properties
    ) {
        this.controller = controller;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    public BatchSummary runRecords(List<RawArtistRecord> records, EntityCompletionListener onEntityComplete) {
        return runRecords(records, onEntityComplete, EnrichmentProgressListener.NONE);
    }

    public BatchSummary runRecords(
        List<RawArtistRecord> records,
        EntityCompletionListener onEntityComplete,
        EnrichmentProgressListener onStepUpdate
    ) {
        List<ArtistProfile> profiles = new ArrayList<>();
        if (records != null) {
            for (RawArtistRecord record : records) {
                profiles.add(normalizer.normalize(record));
            }
        }
        return runBatch(profiles, onEntityComplete, onStepUpdate, entityDelay());
    }

    public BatchSummary runBatch(List<ArtistProfile> profiles, EntityCompletionListener onEntityComplete) {
        return runBatch(profiles, onEntityComplete, EnrichmentProgressListener.NONE, entityDelay());
    }

    public BatchSummary runBatch(List<ArtistProfile> profiles, EntityCompletionListener onEntityComplete, Duration interEntityDelay) {
        return runBatch(profiles, onEntityComplete, EnrichmentProgressListener.NONE, interEntityDelay);
    }

    /**
     * Step progress of every artist is forwarded to {@code onStepUpdate}. An interrupt stops the batch
     * before the next artist and the summary covers the artists enriched so far.
     *
     * @throws EnrichmentConfigurationException before the first entity starts when a mandatory
     *     capability is missing
     */
    public BatchSummary runBatch(
        List<ArtistProfile> profiles,
        EntityCompletionListener onEntityComplete,
        EnrichmentProgressListener onStepUpdate,
        Duration interEntityDelay
    ) {
        List<ArtistProfile> queue = profiles == null ? List.of() : profiles;
        EntityCompletionListener listener = onEntityComplete == null ? EntityCompletionListener.NONE : onEntityComplete;
        List<EnrichmentResult> results = new ArrayList<>();
        EnrichmentProgressListener progress = onStepUpdate == null ? EnrichmentProgressListener.NONE : onStepUpdate;
        int found = 0;
        int total = queue.size();
        boolean interrupted = false;
        log.info("Starting enrichment batch of {} artists", total);

        for (int i = 0; i < total; i++) {
            if (i > 0) {
                pause(interEntityDelay);
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Batch interrupted after {}/{} artists", i, total);
                interrupted = true;
                break;
            }
            ArtistProfile profile = queue.get(i);
            EnrichmentResult result = controller.runPipeline(profile, progress);
            results.add(result);
            if (result.isContactable()) {
                found++;
            }
            log.info(
                "Enriched {}/{}: {} -> {}",
                i + 1,
                total,
                profile.name(),
                result.isContactable() ? result.getBestEmail() : "no contact"
            );
            try {
                listener.onEntityComplete(result, i, total);
            } catch (RuntimeException e) {
                log.warn("Entity completion listener failed for {}", profile.name(), e);
            }
        }

        int enriched = results.size();
        double hitRate = enriched == 0 ? 0.0 : (double) found / enriched;
        log.info("Batch finished: {}/{} contactable ({})", found, enriched, String.format("%.1f%%", hitRate * 100));
        return new BatchSummary(List.copyOf(results), enriched, found, hitRate, interrupted);
    }

    private Duration entityDelay() {
        return Duration.ofMillis(properties.getPipeline().getEntityDelayMs());
    }

    private static void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
