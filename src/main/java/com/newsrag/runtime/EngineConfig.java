package com.newsrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.newsrag.engine.ConfigurationException;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    public static final List<String> DEFAULT_TAXONOMY = List.of(
            "Premium",
            "Economy",
            "Markets",
            "Law",
            "Technology",
            "Business",
            "RealEstate",
            "Work",
            "PersonalFinance");

    private EmbeddingConfig embedding = new EmbeddingConfig();
    private SynthesisConfig synthesis = new SynthesisConfig();
    private CacheConfig cache = new CacheConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private PersistenceConfig persistence = new PersistenceConfig();
    private BackupConfig backup = new BackupConfig();
    private ResilienceConfig resilience = new ResilienceConfig();

    public static EngineConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new EngineConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        EngineConfig config = mapper.readValue(path.toFile(), EngineConfig.class);
        return config == null ? new EngineConfig() : config;
    }

    public EngineConfig validate() {
        require(!isBlank(embedding.getModel()), "embedding.model must not be blank");
        require(embedding.getStrategy() != null, "embedding.strategy must be set");
        require(embedding.getTimeoutMs() > 0, "embedding.timeoutMs must be > 0");
        require(embedding.getDimension() > 0, "embedding.dimension must be > 0");
        require(!isBlank(synthesis.getModel()), "synthesis.model must not be blank");
        require(synthesis.getTimeoutMs() > 0, "synthesis.timeoutMs must be > 0");
        require(synthesis.getContextMaxChars() > 0, "synthesis.contextMaxChars must be > 0");
        require(synthesis.getMaxTokens() > 0, "synthesis.maxTokens must be > 0");
        require(cache.getTtlMs() > 0, "cache.ttlMs must be > 0");
        require(cache.getCapacity() > 0, "cache.capacity must be > 0");
        require(retrieval.getTopK() > 0, "retrieval.topK must be > 0");
        require(retrieval.getPerCategoryK() > 0, "retrieval.perCategoryK must be > 0");
        List<String> taxonomy = retrieval.getTaxonomy();
        require(taxonomy != null && !taxonomy.isEmpty(), "retrieval.taxonomy must list at least one category");
        require(taxonomy.stream().noneMatch(EngineConfig::isBlank), "retrieval.taxonomy must not contain blank names");
        require(new HashSet<>(taxonomy).size() == taxonomy.size(), "retrieval.taxonomy must not contain duplicates");
        require(!isBlank(persistence.getRoot()), "persistence.root must not be blank");
        require(persistence.getRetainedSnapshots() >= 0, "persistence.retainedSnapshots must be >= 0");
        require(backup.getMaxBundleBytes() > 0, "backup.maxBundleBytes must be > 0");
        require(resilience.getMaxRetries() >= 0, "resilience.maxRetries must be >= 0");
        require(resilience.getInitialBackoffMs() >= 0, "resilience.initialBackoffMs must be >= 0");
        require(resilience.getMaxBackoffMs() >= resilience.getInitialBackoffMs(),
                "resilience.maxBackoffMs must be >= resilience.initialBackoffMs");
        require(resilience.getFailureThreshold() > 0, "resilience.failureThreshold must be > 0");
        require(resilience.getOpenStateMs() > 0, "resilience.openStateMs must be > 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Resolves an API key from the literal value or, failing that, the named
     * environment variable. Returns null when neither is set.
     */
    static String resolveApiKey(String literal, String envName) {
        if (!isBlank(literal)) {
            return literal.strip();
        }
        if (isBlank(envName)) {
            return null;
        }
        String fromEnv = System.getenv(envName);
        return isBlank(fromEnv) ? null : fromEnv.strip();
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public SynthesisConfig getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(SynthesisConfig synthesis) {
        this.synthesis = synthesis == null ? new SynthesisConfig() : synthesis;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public PersistenceConfig getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceConfig persistence) {
        this.persistence = persistence == null ? new PersistenceConfig() : persistence;
    }

    public BackupConfig getBackup() {
        return backup;
    }

    public void setBackup(BackupConfig backup) {
        this.backup = backup == null ? new BackupConfig() : backup;
    }

    public ResilienceConfig getResilience() {
        return resilience;
    }

    public void setResilience(ResilienceConfig resilience) {
        this.resilience = resilience == null ? new ResilienceConfig() : resilience;
    }

    public enum EmbeddingStrategy {
        /** Remote embedding model over HTTP. */
        OPENAI,
        /** Deterministic local token hashing; a separate vector space, never a fallback. */
        HASHING
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private EmbeddingStrategy strategy = EmbeddingStrategy.OPENAI;
        private String model = "text-embedding-3-large";
        private String endpoint = "https://api.openai.com/v1/embeddings";
        private String apiKey;
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int dimension = 384;
        private int timeoutMs = 30000;

        public String resolveApiKey() {
            return EngineConfig.resolveApiKey(apiKey, apiKeyEnv);
        }

        public EmbeddingStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(EmbeddingStrategy strategy) {
            this.strategy = strategy;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SynthesisConfig {
        private String model = "gpt-4o-mini";
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey;
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int timeoutMs = 60000;
        private double temperature = 0.3;
        private int maxTokens = 2000;
        private int contextMaxChars = 18000;
        private int minCategoryContextChars = 600;

        public String resolveApiKey() {
            return EngineConfig.resolveApiKey(apiKey, apiKeyEnv);
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getContextMaxChars() {
            return contextMaxChars;
        }

        public void setContextMaxChars(int contextMaxChars) {
            this.contextMaxChars = contextMaxChars;
        }

        public int getMinCategoryContextChars() {
            return minCategoryContextChars;
        }

        public void setMinCategoryContextChars(int minCategoryContextChars) {
            this.minCategoryContextChars = minCategoryContextChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private long ttlMs = 3_600_000L;
        private int capacity = 10_000;

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 5;
        private int perCategoryK = 2;
        private List<String> taxonomy = DEFAULT_TAXONOMY;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getPerCategoryK() {
            return perCategoryK;
        }

        public void setPerCategoryK(int perCategoryK) {
            this.perCategoryK = perCategoryK;
        }

        public List<String> getTaxonomy() {
            return taxonomy;
        }

        public void setTaxonomy(List<String> taxonomy) {
            this.taxonomy = taxonomy == null ? DEFAULT_TAXONOMY : List.copyOf(taxonomy);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PersistenceConfig {
        private String root = ".newsrag/index";
        private int retainedSnapshots = 1;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public int getRetainedSnapshots() {
            return retainedSnapshots;
        }

        public void setRetainedSnapshots(int retainedSnapshots) {
            this.retainedSnapshots = retainedSnapshots;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackupConfig {
        private long maxBundleBytes = 512L * 1024 * 1024;

        public long getMaxBundleBytes() {
            return maxBundleBytes;
        }

        public void setMaxBundleBytes(long maxBundleBytes) {
            this.maxBundleBytes = maxBundleBytes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResilienceConfig {
        private int maxRetries = 2;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 8000;
        private int failureThreshold = 5;
        private long openStateMs = 30000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getOpenStateMs() {
            return openStateMs;
        }

        public void setOpenStateMs(long openStateMs) {
            this.openStateMs = openStateMs;
        }
    }
}
