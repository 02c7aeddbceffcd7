package com.ryuqq.moderation.adapter.runner.config;

import com.ryuqq.moderation.adapter.runner.CacheConfig;
import com.ryuqq.moderation.adapter.runner.DeadLetterMonitorConfig;
import com.ryuqq.moderation.adapter.runner.TopicConfig;
import com.ryuqq.moderation.adapter.runner.WorkerConfig;
import com.ryuqq.moderation.application.model.ModelWeights;

import java.time.Duration;

/**
 * Root configuration object for the moderation worker.
 * Designed to be populated from YAML; every section falls back to defaults when omitted.
 */
public class ModerationProperties {

    private WorkerSection worker = new WorkerSection();
    private TopicsSection topics = new TopicsSection();
    private CacheSection cache = new CacheSection();
    private DeadLetterMonitorSection deadLetterMonitor = new DeadLetterMonitorSection();
    private BusSection bus = new BusSection();
    private ModelSection model = new ModelSection();

    // Getters and Setters
    public WorkerSection getWorker() { return worker; }
    public void setWorker(WorkerSection worker) { this.worker = worker; }

    public TopicsSection getTopics() { return topics; }
    public void setTopics(TopicsSection topics) { this.topics = topics; }

    public CacheSection getCache() { return cache; }
    public void setCache(CacheSection cache) { this.cache = cache; }

    public DeadLetterMonitorSection getDeadLetterMonitor() { return deadLetterMonitor; }
    public void setDeadLetterMonitor(DeadLetterMonitorSection deadLetterMonitor) { this.deadLetterMonitor = deadLetterMonitor; }

    public BusSection getBus() { return bus; }
    public void setBus(BusSection bus) { this.bus = bus; }

    public ModelSection getModel() { return model; }
    public void setModel(ModelSection model) { this.model = model; }

    public WorkerConfig toWorkerConfig() {
        WorkerSection section = worker == null ? new WorkerSection() : worker;
        return new WorkerConfig(
            section.getConcurrency(),
            Duration.ofMillis(section.getPollTimeoutMs()),
            section.getMaxRetries(),
            Duration.ofMillis(section.getRetryBaseDelayMs()),
            Duration.ofMillis(section.getMaxRetryDelayMs()),
            Duration.ofMillis(section.getShutdownTimeoutMs())
        );
    }

    public TopicConfig toTopicConfig() {
        TopicsSection section = topics == null ? new TopicsSection() : topics;
        return new TopicConfig(section.getTask(), section.getRetry(), section.getDeadLetter());
    }

    public CacheConfig toCacheConfig() {
        CacheSection section = cache == null ? new CacheSection() : cache;
        return new CacheConfig(Duration.ofMillis(section.getTtlMs()), section.getMaxEntries(), section.isEnabled());
    }

    public DeadLetterMonitorConfig toDeadLetterMonitorConfig() {
        DeadLetterMonitorSection section = deadLetterMonitor == null ? new DeadLetterMonitorSection() : deadLetterMonitor;
        return new DeadLetterMonitorConfig(section.getHistorySize(), Duration.ofMillis(section.getPollTimeoutMs()));
    }

    public ModelWeights toModelWeights() {
        ModelSection section = model == null ? new ModelSection() : model;
        WeightsSection weights = section.getWeights() == null ? new WeightsSection() : section.getWeights();
        return new ModelWeights(
            weights.getVerifiedSeller(),
            weights.getImagesQty(),
            weights.getDescriptionLength(),
            weights.getCategory(),
            section.getBias(),
            section.getThreshold()
        );
    }

    public long visibilityTimeoutMs() {
        return bus == null ? new BusSection().getVisibilityTimeoutMs() : bus.getVisibilityTimeoutMs();
    }

    /**
     * Worker pool settings.
     */
    public static class WorkerSection {
        private int concurrency = 4;
        private long pollTimeoutMs = 1000;
        private int maxRetries = 3;
        private long retryBaseDelayMs = 5000;
        private long maxRetryDelayMs = 300000;
        private long shutdownTimeoutMs = 30000;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public long getPollTimeoutMs() { return pollTimeoutMs; }
        public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
        public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }

        public long getMaxRetryDelayMs() { return maxRetryDelayMs; }
        public void setMaxRetryDelayMs(long maxRetryDelayMs) { this.maxRetryDelayMs = maxRetryDelayMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Topic names.
     */
    public static class TopicsSection {
        private String task = "moderation";
        private String retry = "moderation_retry";
        private String deadLetter = "moderation_dlq";

        public String getTask() { return task; }
        public void setTask(String task) { this.task = task; }

        public String getRetry() { return retry; }
        public void setRetry(String retry) { this.retry = retry; }

        public String getDeadLetter() { return deadLetter; }
        public void setDeadLetter(String deadLetter) { this.deadLetter = deadLetter; }
    }

    /**
     * Prediction cache settings.
     */
    public static class CacheSection {
        private boolean enabled = true;
        private long ttlMs = 900000;
        private int maxEntries = 10000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }

    /**
     * Dead-letter monitor settings.
     */
    public static class DeadLetterMonitorSection {
        private int historySize = 1000;
        private long pollTimeoutMs = 1000;

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public long getPollTimeoutMs() { return pollTimeoutMs; }
        public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }
    }

    /**
     * In-memory bus settings.
     */
    public static class BusSection {
        private long visibilityTimeoutMs = 30000;

        public long getVisibilityTimeoutMs() { return visibilityTimeoutMs; }
        public void setVisibilityTimeoutMs(long visibilityTimeoutMs) { this.visibilityTimeoutMs = visibilityTimeoutMs; }
    }

    /**
     * Logistic model parameters.
     */
    public static class ModelSection {
        private WeightsSection weights = new WeightsSection();
        private double bias = 2.5;
        private double threshold = 0.5;

        public WeightsSection getWeights() { return weights; }
        public void setWeights(WeightsSection weights) { this.weights = weights; }

        public double getBias() { return bias; }
        public void setBias(double bias) { this.bias = bias; }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
    }

    /**
     * Per-feature weights.
     */
    public static class WeightsSection {
        private double verifiedSeller = -6.0;
        private double imagesQty = -8.0;
        private double descriptionLength = -0.5;
        private double category = 0.2;

        public double getVerifiedSeller() { return verifiedSeller; }
        public void setVerifiedSeller(double verifiedSeller) { this.verifiedSeller = verifiedSeller; }

        public double getImagesQty() { return imagesQty; }
        public void setImagesQty(double imagesQty) { this.imagesQty = imagesQty; }

        public double getDescriptionLength() { return descriptionLength; }
        public void setDescriptionLength(double descriptionLength) { this.descriptionLength = descriptionLength; }

        public double getCategory() { return category; }
        public void setCategory(double category) { this.category = category; }
    }
}
