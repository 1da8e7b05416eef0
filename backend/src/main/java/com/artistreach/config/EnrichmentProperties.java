package com.artistreach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int perHostDelayMs = 500;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 10;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private Pipeline pipeline = new Pipeline();
    private Fetch fetch = new Fetch();
    private Rendering rendering = new Rendering();
    private Video video = new Video();
    private Generative generative = new Generative();
    private Confidence confidence = new Confidence();
    private Filter filter = new Filter();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Rendering getRendering() {
        return rendering;
    }

    public void setRendering(Rendering rendering) {
        this.rendering = rendering;
    }

    public Video getVideo() {
        return video;
    }

    public void setVideo(Video video) {
        this.video = video;
    }

    public Generative getGenerative() {
        return generative;
    }

    public void setGenerative(Generative generative) {
        this.generative = generative;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public void setConfidence(Confidence confidence) {
        this.confidence = confidence;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class Pipeline {
        private int stepDelayMs = 1000;
        private int entityDelayMs = 3000;
        private int entityDeadlineSeconds = 240;
        private int maxGenerativeContentChars = 5000;

        public int getStepDelayMs() {
            return Math.max(0, stepDelayMs);
        }

        public void setStepDelayMs(int stepDelayMs) {
            this.stepDelayMs = Math.max(0, stepDelayMs);
        }

        public int getEntityDelayMs() {
            return Math.max(0, entityDelayMs);
        }

        public void setEntityDelayMs(int entityDelayMs) {
            this.entityDelayMs = Math.max(0, entityDelayMs);
        }

        public int getEntityDeadlineSeconds() {
            return Math.max(1, entityDeadlineSeconds);
        }

        public void setEntityDeadlineSeconds(int entityDeadlineSeconds) {
            this.entityDeadlineSeconds = Math.max(1, entityDeadlineSeconds);
        }

        public int getMaxGenerativeContentChars() {
            return Math.max(200, maxGenerativeContentChars);
        }

        public void setMaxGenerativeContentChars(int maxGenerativeContentChars) {
            this.maxGenerativeContentChars = Math.max(200, maxGenerativeContentChars);
        }
    }

    public static class Fetch {
        private int minContentChars = 500;
        private int maxSubpages = 4;
        private int maxContactLinks = 2;
        private int subpageDelayMs = 500;
        private int minGenerativeContentChars = 100;

        public int getMinContentChars() {
            return Math.max(0, minContentChars);
        }

        public void setMinContentChars(int minContentChars) {
            this.minContentChars = Math.max(0, minContentChars);
        }

        public int getMaxSubpages() {
            return Math.max(0, maxSubpages);
        }

        public void setMaxSubpages(int maxSubpages) {
            this.maxSubpages = Math.max(0, maxSubpages);
        }

        public int getMaxContactLinks() {
            return Math.max(0, maxContactLinks);
        }

        public void setMaxContactLinks(int maxContactLinks) {
            this.maxContactLinks = Math.max(0, maxContactLinks);
        }

        public int getSubpageDelayMs() {
            return Math.max(0, subpageDelayMs);
        }

        public void setSubpageDelayMs(int subpageDelayMs) {
            this.subpageDelayMs = Math.max(0, subpageDelayMs);
        }

        public int getMinGenerativeContentChars() {
            return Math.max(0, minGenerativeContentChars);
        }

        public void setMinGenerativeContentChars(int minGenerativeContentChars) {
            this.minGenerativeContentChars = Math.max(0, minGenerativeContentChars);
        }
    }

    public static class Rendering {
        private String baseUrl = "https://api.apify.com/v2";
        private String token;
        private String videoProfileActor = "streamers~youtube-scraper";
        private String photoProfileActor = "apify~instagram-profile-scraper";
        private String webPageActor = "apify~website-content-crawler";
        private int pollIntervalMs = 2000;
        private int maxWaitSeconds = 45;
        private int maxCrawlPages = 3;

        public boolean isConfigured() {
            return hasText(token) && hasText(baseUrl);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getVideoProfileActor() {
            return videoProfileActor;
        }

        public void setVideoProfileActor(String videoProfileActor) {
            this.videoProfileActor = videoProfileActor;
        }

        public String getPhotoProfileActor() {
            return photoProfileActor;
        }

        public void setPhotoProfileActor(String photoProfileActor) {
            this.photoProfileActor = photoProfileActor;
        }

        public String getWebPageActor() {
            return webPageActor;
        }

        public void setWebPageActor(String webPageActor) {
            this.webPageActor = webPageActor;
        }

        public int getPollIntervalMs() {
            return Math.max(1, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(1, pollIntervalMs);
        }

        public int getMaxWaitSeconds() {
            return Math.max(1, maxWaitSeconds);
        }

        public void setMaxWaitSeconds(int maxWaitSeconds) {
            this.maxWaitSeconds = Math.max(1, maxWaitSeconds);
        }

        public int getMaxCrawlPages() {
            return Math.max(1, maxCrawlPages);
        }

        public void setMaxCrawlPages(int maxCrawlPages) {
            this.maxCrawlPages = Math.max(1, maxCrawlPages);
        }
    }

    public static class Video {
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private String apiKey;
        private int searchResults = 5;
        private int detailCandidates = 3;
        private double minVerificationConfidence = 0.5;

        public boolean isConfigured() {
            return hasText(apiKey) && hasText(baseUrl);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getSearchResults() {
            return Math.max(1, searchResults);
        }

        public void setSearchResults(int searchResults) {
            this.searchResults = Math.max(1, searchResults);
        }

        public int getDetailCandidates() {
            return Math.max(1, detailCandidates);
        }

        public void setDetailCandidates(int detailCandidates) {
            this.detailCandidates = Math.max(1, detailCandidates);
        }

        public double getMinVerificationConfidence() {
            return minVerificationConfidence;
        }

        public void setMinVerificationConfidence(double minVerificationConfidence) {
            this.minVerificationConfidence = minVerificationConfidence;
        }
    }

    public static class Generative {
        private Model fast = new Model("gpt-4o-mini", null, 500, 0.0);
        private Model deep = new Model("sonar", "https://api.perplexity.ai", 600, 0.1);

        public Model getFast() {
            return fast;
        }

        public void setFast(Model fast) {
            this.fast = fast;
        }

        public Model getDeep() {
            return deep;
        }

        public void setDeep(Model deep) {
            this.deep = deep;
        }
    }

    public static class Model {
        private String modelName;
        private String baseUrl;
        private String apiKey;
        private int maxTokens;
        private double temperature;
        private int timeoutSeconds = 30;

        public Model() {
        }

        public Model(String modelName, String baseUrl, int maxTokens, double temperature) {
            this.modelName = modelName;
            this.baseUrl = baseUrl;
            this.maxTokens = maxTokens;
            this.temperature = temperature;
        }

        public boolean isConfigured() {
            return hasText(apiKey) && hasText(modelName);
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getMaxTokens() {
            return Math.max(64, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(64, maxTokens);
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    /**
     * Per-path confidence weights. Empirical values; tune them against a labelled sample.
     */
    public static class Confidence {
        private double structuredField = 0.9;
        private double structuredSecondaryField = 0.85;
        private double platformRegex = 0.85;
        private double platformBioRegex = 0.8;
        private double platformTextRegex = 0.75;
        private double aggregatorRegex = 0.75;
        private double websiteRegex = 0.8;
        private double biographyRegex = 0.7;
        private double generative = 0.7;
        private double webSearch = 0.6;

        public double getStructuredField() {
            return structuredField;
        }

        public void setStructuredField(double structuredField) {
            this.structuredField = clamp(structuredField);
        }

        public double getStructuredSecondaryField() {
            return structuredSecondaryField;
        }

        public void setStructuredSecondaryField(double structuredSecondaryField) {
            this.structuredSecondaryField = clamp(structuredSecondaryField);
        }

        public double getPlatformRegex() {
            return platformRegex;
        }

        public void setPlatformRegex(double platformRegex) {
            this.platformRegex = clamp(platformRegex);
        }

        public double getPlatformBioRegex() {
            return platformBioRegex;
        }

        public void setPlatformBioRegex(double platformBioRegex) {
            this.platformBioRegex = clamp(platformBioRegex);
        }

        public double getPlatformTextRegex() {
            return platformTextRegex;
        }

        public void setPlatformTextRegex(double platformTextRegex) {
            this.platformTextRegex = clamp(platformTextRegex);
        }

        public double getAggregatorRegex() {
            return aggregatorRegex;
        }

        public void setAggregatorRegex(double aggregatorRegex) {
            this.aggregatorRegex = clamp(aggregatorRegex);
        }

        public double getWebsiteRegex() {
            return websiteRegex;
        }

        public void setWebsiteRegex(double websiteRegex) {
            this.websiteRegex = clamp(websiteRegex);
        }

        public double getBiographyRegex() {
            return biographyRegex;
        }

        public void setBiographyRegex(double biographyRegex) {
            this.biographyRegex = clamp(biographyRegex);
        }

        public double getGenerative() {
            return generative;
        }

        public void setGenerative(double generative) {
            this.generative = clamp(generative);
        }

        public double getWebSearch() {
            return webSearch;
        }

        public void setWebSearch(double webSearch) {
            this.webSearch = clamp(webSearch);
        }

        private static double clamp(double value) {
            return Math.max(0.0, Math.min(1.0, value));
        }
    }

    public static class Filter {
        private List<String> blockedDomains = new ArrayList<>();

        public List<String> getBlockedDomains() {
            return blockedDomains;
        }

        public void setBlockedDomains(List<String> blockedDomains) {
            this.blockedDomains = blockedDomains == null ? new ArrayList<>() : new ArrayList<>(blockedDomains);
        }
    }

    public static class Cli {
        private boolean run;
        private String inputFile;
        private String outputFile;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getInputFile() {
            return inputFile;
        }

        public void setInputFile(String inputFile) {
            this.inputFile = inputFile;
        }

        public String getOutputFile() {
            return outputFile;
        }

        public void setOutputFile(String outputFile) {
            this.outputFile = outputFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
