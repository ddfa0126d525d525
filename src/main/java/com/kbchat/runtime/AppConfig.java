package com.kbchat.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kbchat.inference.SamplingParameters;
import com.kbchat.retrieval.RetrievalSettings;
import com.kbchat.sync.SyncSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexConfig index = new IndexConfig();
    private EncoderConfig encoder = new EncoderConfig();
    private KnowledgeConfig knowledge = new KnowledgeConfig();
    private SyncConfig sync = new SyncConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private GeneratorConfig generator = new GeneratorConfig();

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public EncoderConfig getEncoder() {
        return encoder;
    }

    public void setEncoder(EncoderConfig encoder) {
        this.encoder = encoder == null ? new EncoderConfig() : encoder;
    }

    public KnowledgeConfig getKnowledge() {
        return knowledge;
    }

    public void setKnowledge(KnowledgeConfig knowledge) {
        this.knowledge = knowledge == null ? new KnowledgeConfig() : knowledge;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public GeneratorConfig getGenerator() {
        return generator;
    }

    public void setGenerator(GeneratorConfig generator) {
        this.generator = generator == null ? new GeneratorConfig() : generator;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String structurePath = "data/index/knowledge.kbvi";

        public String getStructurePath() {
            return structurePath;
        }

        public void setStructurePath(String structurePath) {
            this.structurePath = structurePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EncoderConfig {
        private String provider = "hashing";
        private int dimension = 384;
        private String endpoint = "";
        private String model = "all-MiniLM-L6-v2";
        private String apiKey = "";
        private int batchSize = 32;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KnowledgeConfig {
        private String jdbcUrl = "jdbc:mysql://localhost:3306/kbchat?connectTimeout=5000";
        private String username = "kbchat";
        private String password = "";
        private String table = "knowledge_entries";
        private int queryTimeoutSeconds = 10;
        private String uptimeQuery = "SHOW GLOBAL STATUS LIKE 'Uptime'";

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public int getQueryTimeoutSeconds() {
            return queryTimeoutSeconds;
        }

        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
        }

        public String getUptimeQuery() {
            return uptimeQuery;
        }

        public void setUptimeQuery(String uptimeQuery) {
            this.uptimeQuery = uptimeQuery;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private boolean enabled = true;
        private long pollIntervalSeconds = 60;
        private long initialDelaySeconds = 5;
        private long sourceUptimeThresholdSeconds = 300;
        private long minRebuildIntervalSeconds = 300;
        private int rebuildBatchSize = 32;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalSeconds() {
            return pollIntervalSeconds;
        }

        public void setPollIntervalSeconds(long pollIntervalSeconds) {
            this.pollIntervalSeconds = pollIntervalSeconds;
        }

        public long getInitialDelaySeconds() {
            return initialDelaySeconds;
        }

        public void setInitialDelaySeconds(long initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }

        public long getSourceUptimeThresholdSeconds() {
            return sourceUptimeThresholdSeconds;
        }

        public void setSourceUptimeThresholdSeconds(long sourceUptimeThresholdSeconds) {
            this.sourceUptimeThresholdSeconds = sourceUptimeThresholdSeconds;
        }

        public long getMinRebuildIntervalSeconds() {
            return minRebuildIntervalSeconds;
        }

        public void setMinRebuildIntervalSeconds(long minRebuildIntervalSeconds) {
            this.minRebuildIntervalSeconds = minRebuildIntervalSeconds;
        }

        public int getRebuildBatchSize() {
            return rebuildBatchSize;
        }

        public void setRebuildBatchSize(int rebuildBatchSize) {
            this.rebuildBatchSize = rebuildBatchSize;
        }

        public SyncSettings toSettings() {
            return new SyncSettings(
                    Duration.ofSeconds(pollIntervalSeconds),
                    Duration.ofSeconds(initialDelaySeconds),
                    Duration.ofSeconds(sourceUptimeThresholdSeconds),
                    Duration.ofSeconds(minRebuildIntervalSeconds));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultTopK = 5;
        private int maxTopK = 50;
        private double confidenceThreshold = 0.65;
        private String hedgePrefix = RetrievalSettings.DEFAULT_HEDGE_PREFIX;
        private long generationTimeoutMs = 30000;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMaxTopK() {
            return maxTopK;
        }

        public void setMaxTopK(int maxTopK) {
            this.maxTopK = maxTopK;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public String getHedgePrefix() {
            return hedgePrefix;
        }

        public void setHedgePrefix(String hedgePrefix) {
            this.hedgePrefix = hedgePrefix;
        }

        public long getGenerationTimeoutMs() {
            return generationTimeoutMs;
        }

        public void setGenerationTimeoutMs(long generationTimeoutMs) {
            this.generationTimeoutMs = generationTimeoutMs;
        }

        public RetrievalSettings toSettings() {
            return new RetrievalSettings(defaultTopK, maxTopK, confidenceThreshold, hedgePrefix,
                    Duration.ofMillis(generationTimeoutMs));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeneratorConfig {
        private String provider = "http";
        private String endpoint = "http://localhost:8080";
        private String apiKey = "";
        private int maxTokens = 400;
        private double temperature = 0.3;
        private double topP = 0.9;
        private int topK = 40;
        private double repeatPenalty = 1.3;
        private List<String> stop = new ArrayList<>(List.of("</s>", "[INST]", "=== QUESTION ==="));
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 60000;
        private int extractiveMaxSentences = 3;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
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

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public double getTopP() {
            return topP;
        }

        public void setTopP(double topP) {
            this.topP = topP;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getRepeatPenalty() {
            return repeatPenalty;
        }

        public void setRepeatPenalty(double repeatPenalty) {
            this.repeatPenalty = repeatPenalty;
        }

        public List<String> getStop() {
            return stop;
        }

        public void setStop(List<String> stop) {
            this.stop = stop == null ? new ArrayList<>() : new ArrayList<>(stop);
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getExtractiveMaxSentences() {
            return extractiveMaxSentences;
        }

        public void setExtractiveMaxSentences(int extractiveMaxSentences) {
            this.extractiveMaxSentences = extractiveMaxSentences;
        }

        public SamplingParameters toSampling() {
            return new SamplingParameters(maxTokens, temperature, topP, topK, repeatPenalty, List.copyOf(stop));
        }
    }
}
