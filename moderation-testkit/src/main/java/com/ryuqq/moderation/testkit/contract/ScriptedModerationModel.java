package com.ryuqq.moderation.testkit.contract;

import com.ryuqq.moderation.application.model.LogisticModerationModel;
import com.ryuqq.moderation.core.exception.ModelUnavailableException;
import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.spi.ModerationModel;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scriptable model double for contract tests.
 *
 * <p>By default it delegates to {@link LogisticModerationModel}. Tests can pin the
 * prediction, make the model unavailable for the next N calls (or indefinitely),
 * and add latency to widen race windows.</p>
 *
 * <p>Thread-safe: all script state is held in atomics.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class ScriptedModerationModel implements ModerationModel {

    public static final String UNAVAILABLE_MESSAGE = "Model not loaded";

    private final ModerationModel delegate;
    private final AtomicReference<Prediction> pinned = new AtomicReference<>();
    private final AtomicInteger remainingFailures = new AtomicInteger();
    private final AtomicInteger callCount = new AtomicInteger();
    private volatile boolean unavailable;
    private volatile long latencyMs;

    public ScriptedModerationModel() {
        this(new LogisticModerationModel());
    }

    public ScriptedModerationModel(ModerationModel delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public Prediction predict(Item item) {
        callCount.incrementAndGet();
        pause();
        if (unavailable) {
            throw new ModelUnavailableException(UNAVAILABLE_MESSAGE);
        }
        if (remainingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new ModelUnavailableException(UNAVAILABLE_MESSAGE);
        }
        Prediction prediction = pinned.get();
        return prediction != null ? prediction : delegate.predict(item);
    }

    private void pause() {
        long delay = latencyMs;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Model call interrupted", e);
        }
    }

    /**
     * Every later call returns this prediction.
     */
    public ScriptedModerationModel respondWith(Prediction prediction) {
        pinned.set(prediction);
        return this;
    }

    /**
     * The next {@code count} calls throw {@link ModelUnavailableException}.
     */
    public ScriptedModerationModel failNextCalls(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        remainingFailures.set(count);
        return this;
    }

    /**
     * Every call throws {@link ModelUnavailableException} until {@link #recover()}.
     */
    public ScriptedModerationModel failAlways() {
        unavailable = true;
        return this;
    }

    public ScriptedModerationModel recover() {
        unavailable = false;
        remainingFailures.set(0);
        return this;
    }

    public ScriptedModerationModel withLatencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    public int getCallCount() {
        return callCount.get();
    }
}
