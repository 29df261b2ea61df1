package de.mirkosertic.vectorsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the Vector Sync engine.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.vectorsync/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "VECTORSYNC_INDEX_PATH";
    private static final String ENV_FOLDERS = "VECTORSYNC_FOLDERS";
    private static final String ENV_EMBEDDING_URL = "VECTORSYNC_EMBEDDING_URL";
    private static final String PROP_INDEX_PATH = "vectorsync.index.path";
    private static final String PROP_PROFILE = "vectorsync.profile";
    private static final String CONFIG_DIR = ".vectorsync";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Index settings
    private String indexPath;
    private long commitIntervalMs = 5000;

    // Chunking settings
    private int chunkSizeWords = 150;
    private double chunkOverlapRatio = 0.15;
    private int minChunkCharacters = 10;
    private int previewCharacters = 100;

    // Watch settings
    private long watchDebounceMs = 500;
    private long watchPollIntervalMs = 2000;

    // Synchronization settings
    private int threadPoolSize = 4;
    private int queueDepth = 64;
    private int embeddingBatchSize = 16;
    private long errorRetryIntervalMs = 30000;
    private int retryMaxAttempts = 5;
    private long retryInitialBackoffMs = 200;
    private double retryMultiplier = 2.0;
    private long retryMaxBackoffMs = 10000;
    private String collectionPrefix = "rag";

    // State persistence
    private long persistIntervalMs = 2000;

    // Extraction
    private String fallbackEncoding = "windows-1252";
    private long maxContentLength = -1;

    // Embedding provider
    private String embeddingProvider = "tei";
    private String embeddingBaseUrl = "http://localhost:8080";
    private int vectorSize = 768;
    private String passagePrefix = "search_document: ";
    private String queryPrefix = "search_query: ";
    private long embeddingTimeoutMs = 30000;

    // Reranking provider
    private boolean rerankEnabled = false;
    private String rerankBaseUrl = "http://localhost:8081";
    private double rerankScoreThreshold = 0.35;
    private long rerankTimeoutMs = 30000;

    // Query time
    private double searchScoreThreshold = 0.15;

    // Folders to watch on startup
    private List<String> folders = new ArrayList<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: indexPath={}, folders={}, embeddingProvider={}, deployedMode={}",
                config.indexPath, config.folders.size(), config.embeddingProvider, config.deployedMode);

        return config;
    }

    /**
     * Configuration with built-in defaults only. Intended for embedding the engine
     * programmatically; no file or environment lookups are performed.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.indexPath = getConfigDirectory().resolve("index").toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("vectorsync");
        if (root == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            if (indexConfig.get("path") != null) {
                this.indexPath = resolveVariables(indexConfig.get("path").toString());
            }
            if (indexConfig.containsKey("commit-interval-ms")) {
                this.commitIntervalMs = ((Number) indexConfig.get("commit-interval-ms")).longValue();
            }
        }

        final Map<String, Object> chunkingConfig = (Map<String, Object>) root.get("chunking");
        if (chunkingConfig != null) {
            applyChunkingConfig(chunkingConfig);
        }

        final Map<String, Object> watchConfig = (Map<String, Object>) root.get("watch");
        if (watchConfig != null) {
            if (watchConfig.containsKey("debounce-ms")) {
                this.watchDebounceMs = ((Number) watchConfig.get("debounce-ms")).longValue();
            }
            if (watchConfig.containsKey("poll-interval-ms")) {
                this.watchPollIntervalMs = ((Number) watchConfig.get("poll-interval-ms")).longValue();
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) root.get("sync");
        if (syncConfig != null) {
            applySyncConfig(syncConfig);
        }

        final Map<String, Object> stateConfig = (Map<String, Object>) root.get("state");
        if (stateConfig != null && stateConfig.containsKey("persist-interval-ms")) {
            this.persistIntervalMs = ((Number) stateConfig.get("persist-interval-ms")).longValue();
        }

        final Map<String, Object> extractionConfig = (Map<String, Object>) root.get("extraction");
        if (extractionConfig != null) {
            if (extractionConfig.get("fallback-encoding") != null) {
                this.fallbackEncoding = extractionConfig.get("fallback-encoding").toString();
            }
            if (extractionConfig.containsKey("max-content-length")) {
                this.maxContentLength = ((Number) extractionConfig.get("max-content-length")).longValue();
            }
        }

        final Map<String, Object> embeddingConfig = (Map<String, Object>) root.get("embedding");
        if (embeddingConfig != null) {
            applyEmbeddingConfig(embeddingConfig);
        }

        final Map<String, Object> rerankConfig = (Map<String, Object>) root.get("rerank");
        if (rerankConfig != null) {
            if (rerankConfig.containsKey("enabled")) {
                this.rerankEnabled = (Boolean) rerankConfig.get("enabled");
            }
            if (rerankConfig.get("base-url") != null) {
                this.rerankBaseUrl = resolveVariables(rerankConfig.get("base-url").toString());
            }
            if (rerankConfig.containsKey("score-threshold")) {
                this.rerankScoreThreshold = ((Number) rerankConfig.get("score-threshold")).doubleValue();
            }
            if (rerankConfig.containsKey("timeout-ms")) {
                this.rerankTimeoutMs = ((Number) rerankConfig.get("timeout-ms")).longValue();
            }
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) root.get("search");
        if (searchConfig != null && searchConfig.containsKey("score-threshold")) {
            this.searchScoreThreshold = ((Number) searchConfig.get("score-threshold")).doubleValue();
        }

        if (root.containsKey("folders")) {
            final Object dirs = root.get("folders");
            if (dirs instanceof List) {
                this.folders = new ArrayList<>((List<String>) dirs);
            }
        }
    }

    private void applyChunkingConfig(final Map<String, Object> chunkingConfig) {
        if (chunkingConfig.containsKey("size-words")) {
            this.chunkSizeWords = ((Number) chunkingConfig.get("size-words")).intValue();
        }
        if (chunkingConfig.containsKey("overlap-ratio")) {
            this.chunkOverlapRatio = ((Number) chunkingConfig.get("overlap-ratio")).doubleValue();
        }
        if (chunkingConfig.containsKey("min-chunk-characters")) {
            this.minChunkCharacters = ((Number) chunkingConfig.get("min-chunk-characters")).intValue();
        }
        if (chunkingConfig.containsKey("preview-characters")) {
            this.previewCharacters = ((Number) chunkingConfig.get("preview-characters")).intValue();
        }
    }

    @SuppressWarnings("unchecked")
    private void applySyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) syncConfig.get("thread-pool-size")).intValue();
        }
        if (syncConfig.containsKey("queue-depth")) {
            this.queueDepth = ((Number) syncConfig.get("queue-depth")).intValue();
        }
        if (syncConfig.containsKey("embedding-batch-size")) {
            this.embeddingBatchSize = ((Number) syncConfig.get("embedding-batch-size")).intValue();
        }
        if (syncConfig.containsKey("error-retry-interval-ms")) {
            this.errorRetryIntervalMs = ((Number) syncConfig.get("error-retry-interval-ms")).longValue();
        }
        if (syncConfig.get("collection-prefix") != null) {
            this.collectionPrefix = syncConfig.get("collection-prefix").toString();
        }

        final Map<String, Object> retryConfig = (Map<String, Object>) syncConfig.get("retry");
        if (retryConfig != null) {
            if (retryConfig.containsKey("max-attempts")) {
                this.retryMaxAttempts = ((Number) retryConfig.get("max-attempts")).intValue();
            }
            if (retryConfig.containsKey("initial-backoff-ms")) {
                this.retryInitialBackoffMs = ((Number) retryConfig.get("initial-backoff-ms")).longValue();
            }
            if (retryConfig.containsKey("multiplier")) {
                this.retryMultiplier = ((Number) retryConfig.get("multiplier")).doubleValue();
            }
            if (retryConfig.containsKey("max-backoff-ms")) {
                this.retryMaxBackoffMs = ((Number) retryConfig.get("max-backoff-ms")).longValue();
            }
        }
    }

    private void applyEmbeddingConfig(final Map<String, Object> embeddingConfig) {
        if (embeddingConfig.get("provider") != null) {
            this.embeddingProvider = embeddingConfig.get("provider").toString();
        }
        if (embeddingConfig.get("base-url") != null) {
            this.embeddingBaseUrl = resolveVariables(embeddingConfig.get("base-url").toString());
        }
        if (embeddingConfig.containsKey("dimension")) {
            this.vectorSize = ((Number) embeddingConfig.get("dimension")).intValue();
        }
        if (embeddingConfig.get("passage-prefix") != null) {
            this.passagePrefix = embeddingConfig.get("passage-prefix").toString();
        }
        if (embeddingConfig.get("query-prefix") != null) {
            this.queryPrefix = embeddingConfig.get("query-prefix").toString();
        }
        if (embeddingConfig.containsKey("timeout-ms")) {
            this.embeddingTimeoutMs = ((Number) embeddingConfig.get("timeout-ms")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        // Default index path if not set
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("index").toString();
        }

        // Watched folders from environment (overrides all other sources)
        final String envFolders = System.getenv(ENV_FOLDERS);
        if (envFolders != null && !envFolders.trim().isEmpty()) {
            this.folders = new ArrayList<>();
            for (final String dir : envFolders.split(",")) {
                final String trimmed = dir.trim();
                if (!trimmed.isEmpty()) {
                    this.folders.add(trimmed);
                }
            }
            logger.info("Watched folders from environment: {}", this.folders);
        }

        final String envEmbeddingUrl = System.getenv(ENV_EMBEDDING_URL);
        if (envEmbeddingUrl != null && !envEmbeddingUrl.isBlank()) {
            this.embeddingBaseUrl = envEmbeddingUrl.trim();
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = findClosingBrace(result, start + 2);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    private static int findClosingBrace(final String value, final int from) {
        int depth = 0;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Setters used when embedding the engine programmatically and in tests
    public void setIndexPath(final String indexPath) {
        this.indexPath = indexPath;
    }

    public void setWatchDebounceMs(final long watchDebounceMs) {
        this.watchDebounceMs = watchDebounceMs;
    }

    public void setWatchPollIntervalMs(final long watchPollIntervalMs) {
        this.watchPollIntervalMs = watchPollIntervalMs;
    }

    public void setChunkSizeWords(final int chunkSizeWords) {
        this.chunkSizeWords = chunkSizeWords;
    }

    public void setChunkOverlapRatio(final double chunkOverlapRatio) {
        this.chunkOverlapRatio = chunkOverlapRatio;
    }

    public void setQueueDepth(final int queueDepth) {
        this.queueDepth = queueDepth;
    }

    public void setPersistIntervalMs(final long persistIntervalMs) {
        this.persistIntervalMs = persistIntervalMs;
    }

    public void setErrorRetryIntervalMs(final long errorRetryIntervalMs) {
        this.errorRetryIntervalMs = errorRetryIntervalMs;
    }

    public void setVectorSize(final int vectorSize) {
        this.vectorSize = vectorSize;
    }

    public void setEmbeddingProvider(final String embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    public void setFolders(final List<String> folders) {
        this.folders = new ArrayList<>(folders);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public long getCommitIntervalMs() {
        return commitIntervalMs;
    }

    public int getChunkSizeWords() {
        return chunkSizeWords;
    }

    public double getChunkOverlapRatio() {
        return chunkOverlapRatio;
    }

    public int getMinChunkCharacters() {
        return minChunkCharacters;
    }

    public int getPreviewCharacters() {
        return previewCharacters;
    }

    public long getWatchDebounceMs() {
        return watchDebounceMs;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public long getErrorRetryIntervalMs() {
        return errorRetryIntervalMs;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public long getRetryInitialBackoffMs() {
        return retryInitialBackoffMs;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public long getRetryMaxBackoffMs() {
        return retryMaxBackoffMs;
    }

    public String getCollectionPrefix() {
        return collectionPrefix;
    }

    public long getPersistIntervalMs() {
        return persistIntervalMs;
    }

    public String getFallbackEncoding() {
        return fallbackEncoding;
    }

    public long getMaxContentLength() {
        return maxContentLength;
    }

    public String getEmbeddingProvider() {
        return embeddingProvider;
    }

    public String getEmbeddingBaseUrl() {
        return embeddingBaseUrl;
    }

    public int getVectorSize() {
        return vectorSize;
    }

    public String getPassagePrefix() {
        return passagePrefix;
    }

    public String getQueryPrefix() {
        return queryPrefix;
    }

    public long getEmbeddingTimeoutMs() {
        return embeddingTimeoutMs;
    }

    public boolean isRerankEnabled() {
        return rerankEnabled;
    }

    public String getRerankBaseUrl() {
        return rerankBaseUrl;
    }

    public double getRerankScoreThreshold() {
        return rerankScoreThreshold;
    }

    public long getRerankTimeoutMs() {
        return rerankTimeoutMs;
    }

    public double getSearchScoreThreshold() {
        return searchScoreThreshold;
    }

    public List<String> getFolders() {
        return folders;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
