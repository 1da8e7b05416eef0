package com.artistreach.config;

import com.artistreach.enrichment.ai.GenerativeReplyDecoder;
import com.artistreach.enrichment.ai.GenerativeTier;
import com.artistreach.enrichment.ai.LangChainGenerativeExtraction;
import com.artistreach.enrichment.fetch.ApifyRenderingClient;
import com.artistreach.enrichment.fetch.BlockedContentDetector;
import com.artistreach.enrichment.fetch.TieredContentFetcher;
import com.artistreach.enrichment.http.PoliteHttpClient;
import com.artistreach.enrichment.service.EnrichmentCapabilities;
import com.artistreach.enrichment.video.YouTubeDataApiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EnrichmentConfig {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(EnrichmentProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public GenerativeReplyDecoder generativeReplyDecoder(ObjectMapper objectMapper) {
        return new GenerativeReplyDecoder(objectMapper);
    }

    /**
     * Only configured tiers get a model; an absent FAST tier is reported when a run starts.
     */
    @Bean(name = "generativeModels")
    public Map<GenerativeTier, ChatModel> generativeModels(EnrichmentProperties properties) {
        Map<GenerativeTier, ChatModel> models = new EnumMap<>(GenerativeTier.class);
        addModel(models, GenerativeTier.FAST, properties.getGenerative().getFast());
        addModel(models, GenerativeTier.DEEP, properties.getGenerative().getDeep());
        return models;
    }

    @Bean
    public LangChainGenerativeExtraction generativeExtraction(
        @Qualifier("generativeModels") Map<GenerativeTier, ChatModel> generativeModels,
        GenerativeReplyDecoder decoder
    ) {
        return new LangChainGenerativeExtraction(generativeModels, decoder);
    }

    @Bean
    public ApifyRenderingClient renderingClient(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        EnrichmentProperties properties
    ) {
        return new ApifyRenderingClient(httpClient, objectMapper, properties);
    }

    @Bean
    public TieredContentFetcher contentFetcher(
        PoliteHttpClient httpClient,
        BlockedContentDetector blockedContentDetector,
        ApifyRenderingClient renderingClient,
        EnrichmentProperties properties
    ) {
        return new TieredContentFetcher(httpClient, blockedContentDetector, renderingClient, properties);
    }

    @Bean
    public YouTubeDataApiClient videoMetadataClient(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        EnrichmentProperties properties
    ) {
        return new YouTubeDataApiClient(httpClient, objectMapper, properties);
    }

    @Bean
    public EnrichmentCapabilities enrichmentCapabilities(
        TieredContentFetcher contentFetcher,
        YouTubeDataApiClient videoMetadataClient,
        LangChainGenerativeExtraction generativeExtraction
    ) {
        return new EnrichmentCapabilities(contentFetcher, videoMetadataClient, generativeExtraction);
    }

    private static void addModel(
        Map<GenerativeTier, ChatModel> models,
        GenerativeTier tier,
        EnrichmentProperties.Model settings
    ) {
        if (settings == null || !settings.isConfigured()) {
            log.info("Generative tier {} is not configured", tier);
            return;
        }
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
            .apiKey(settings.getApiKey())
            .modelName(settings.getModelName())
            .maxTokens(settings.getMaxTokens())
            .temperature(settings.getTemperature())
            .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()));
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        models.put(tier, builder.build());
        log.info("Generative tier {} uses model {}", tier, settings.getModelName());
    }
}
