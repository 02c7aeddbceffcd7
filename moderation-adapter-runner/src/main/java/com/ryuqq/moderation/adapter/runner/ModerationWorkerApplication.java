package com.ryuqq.moderation.adapter.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.moderation.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.moderation.adapter.inmemory.cache.InMemoryPredictionCache;
import com.ryuqq.moderation.adapter.inmemory.store.InMemoryItemRepository;
import com.ryuqq.moderation.adapter.inmemory.store.InMemoryResultStore;
import com.ryuqq.moderation.adapter.runner.config.ModerationConfigLoader;
import com.ryuqq.moderation.adapter.runner.config.ModerationProperties;
import com.ryuqq.moderation.application.codec.DeadLetterCodec;
import com.ryuqq.moderation.application.codec.ModerationJson;
import com.ryuqq.moderation.application.codec.TaskMessageCodec;
import com.ryuqq.moderation.application.model.LogisticModerationModel;
import com.ryuqq.moderation.application.service.ModerationService;
import com.ryuqq.moderation.core.spi.PredictionCache;
import com.ryuqq.moderation.core.spi.noop.NoOpPredictionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the moderation worker.
 *
 * <p>Wires the in-memory adapters, the intake service, the worker pool and the
 * dead-letter monitor from {@code moderation.yaml}.</p>
 */
public class ModerationWorkerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModerationWorkerApplication.class);

    private final InMemoryMessageBus messageBus;
    private final InMemoryResultStore resultStore;
    private final InMemoryItemRepository itemRepository;
    private final PredictionCache predictionCache;
    private final ModerationService moderationService;
    private final WorkerPool workerPool;
    private final DeadLetterMonitor deadLetterMonitor;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ModerationWorkerApplication(ModerationProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public ModerationWorkerApplication(ModerationProperties properties, Clock clock) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        log.info("Initializing moderation worker...");

        WorkerConfig workerConfig = properties.toWorkerConfig();
        TopicConfig topics = properties.toTopicConfig();
        CacheConfig cacheConfig = properties.toCacheConfig();

        ObjectMapper objectMapper = ModerationJson.newObjectMapper();
        TaskMessageCodec taskCodec = new TaskMessageCodec(objectMapper);
        DeadLetterCodec deadLetterCodec = new DeadLetterCodec(objectMapper);

        this.messageBus = new InMemoryMessageBus(properties.visibilityTimeoutMs());
        this.resultStore = new InMemoryResultStore(clock);
        this.itemRepository = new InMemoryItemRepository();
        this.predictionCache = cacheConfig.enabled()
            ? new InMemoryPredictionCache(cacheConfig.ttl(), cacheConfig.maxEntries(), clock)
            : NoOpPredictionCache.INSTANCE;

        this.moderationService = new ModerationService(resultStore, itemRepository, messageBus,
            topics.taskTopic(), taskCodec, clock);

        ModerationWorker worker = new ModerationWorker(messageBus, resultStore, itemRepository, predictionCache,
            new LogisticModerationModel(properties.toModelWeights()), workerConfig.retryPolicy(), topics,
            taskCodec, deadLetterCodec, clock);
        this.workerPool = new WorkerPool(messageBus, worker, topics, workerConfig);
        this.deadLetterMonitor = new DeadLetterMonitor(messageBus, topics, deadLetterCodec, taskCodec,
            properties.toDeadLetterMonitorConfig());

        log.info("Moderation worker initialized: concurrency={}, maxRetries={}, cacheEnabled={}",
            workerConfig.concurrency(), workerConfig.maxRetries(), cacheConfig.enabled());
    }

    public void start() {
        deadLetterMonitor.start();
        workerPool.start();
        log.info("Moderation worker started");
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ModerationService getModerationService() {
        return moderationService;
    }

    public InMemoryItemRepository getItemRepository() {
        return itemRepository;
    }

    public InMemoryResultStore getResultStore() {
        return resultStore;
    }

    public InMemoryMessageBus getMessageBus() {
        return messageBus;
    }

    public PredictionCache getPredictionCache() {
        return predictionCache;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public DeadLetterMonitor getDeadLetterMonitor() {
        return deadLetterMonitor;
    }

    @Override
    public void close() {
        log.info("Shutting down moderation worker...");

        try {
            if (!workerPool.shutdown()) {
                log.warn("Worker pool stopped with tasks still in flight");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping worker pool", e);
        }

        try {
            deadLetterMonitor.stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping dead-letter monitor", e);
        }

        log.info("Moderation worker shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : ModerationConfigLoader.DEFAULT_CONFIG_PATH;

        try {
            ModerationProperties properties = new ModerationConfigLoader(configPath).load();
            ModerationWorkerApplication app = new ModerationWorkerApplication(properties);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }, "moderation-shutdown"));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start moderation worker", e);
            System.exit(1);
        }
    }
}
