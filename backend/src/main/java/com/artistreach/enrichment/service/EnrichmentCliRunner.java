package com.artistreach.enrichment.service;

import com.artistreach.config.EnrichmentProperties;
import com.artistreach.enrichment.model.BatchSummary;
import com.artistreach.enrichment.model.EnrichmentResult;
import com.artistreach.enrichment.model.RawArtistRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch from a JSON file of artist rows when {@code enrichment.cli.run} is set, and
 * optionally writes the per-artist results next to it.
 */
@Component
public class EnrichmentCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentCliRunner.class);

    private final EnrichmentProperties properties;
    private final BatchEnrichmentRunner batchRunner;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public EnrichmentCliRunner(
        EnrichmentProperties properties,
        BatchEnrichmentRunner batchRunner,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.batchRunner = batchRunner;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        EnrichmentProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        if (cli.getInputFile() == null || cli.getInputFile().isBlank()) {
            throw new EnrichmentConfigurationException("enrichment.cli.input-file is required when enrichment.cli.run is set");
        }

        List<RawArtistRecord> records = readRecords(Path.of(cli.getInputFile().trim()));
        BatchSummary summary = batchRunner.runRecords(
            records,
            (result, index, total) -> log.info("[{}/{}] {}: {}", index + 1, total, result.getArtistName(), describe(result))
        );
        log.info("Batch completed: {} of {} artists contactable", summary.found(), summary.total());
        if (summary.interrupted()) {
            log.warn("Batch was interrupted; only {} of {} artists were enriched", summary.total(), records.size());
        }

        if (cli.getOutputFile() != null && !cli.getOutputFile().isBlank()) {
            writeResults(Path.of(cli.getOutputFile().trim()), summary);
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    List<RawArtistRecord> readRecords(Path input) {
        try {
            return objectMapper.readValue(input.toFile(), new TypeReference<List<RawArtistRecord>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artist rows from " + input, e);
        }
    }

    void writeResults(Path output, BatchSummary summary) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), summary);
            log.info("Wrote {} results to {}", summary.results().size(), output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + output, e);
        }
    }

    private static String describe(EnrichmentResult result) {
        if (!result.isContactable()) {
            return "no contact";
        }
        return result.getBestEmail() + " via " + result.getBestSource();
    }
}
