package com.phillippitts.tastemodel.testutil;

import com.phillippitts.tastemodel.domain.ModelMetrics;
import com.phillippitts.tastemodel.service.training.Trainer;
import com.phillippitts.tastemodel.service.training.TrainingDataset;
import com.phillippitts.tastemodel.service.training.TrainingOutcome;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Trainer returning preset MSE values in order, optionally blocking or failing.
 */
public class ScriptedTrainer implements Trainer {

    private final String modelType;
    private final Deque<Double> mses = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile CountDownLatch entered;
    private volatile CountDownLatch gate;
    private volatile Throwable failure;
    private volatile long delayMs;

    public ScriptedTrainer(String modelType, double... mseSequence) {
        this.modelType = modelType;
        for (double m : mseSequence) {
            mses.addLast(m);
        }
    }

    /** Blocks {@link #train} until {@code gate} opens; {@code entered} counts down on entry. */
    public ScriptedTrainer blockOn(CountDownLatch entered, CountDownLatch gate) {
        this.entered = entered;
        this.gate = gate;
        return this;
    }

    public ScriptedTrainer failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public ScriptedTrainer failWith(Error failure) {
        this.failure = failure;
        return this;
    }

    /** Sleeps this long before returning, simulating a slow fit. */
    public ScriptedTrainer taking(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String modelType() {
        return modelType;
    }

    @Override
    public synchronized TrainingOutcome train(TrainingDataset dataset) {
        calls.incrementAndGet();
        if (entered != null) {
            entered.countDown();
        }
        if (gate != null) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Throwable f = failure;
        if (f instanceof RuntimeException r) {
            throw r;
        }
        if (f instanceof Error e) {
            throw e;
        }
        double mse = mses.isEmpty() ? 0.5 : mses.pollFirst();
        byte[] artifact = ("model mse=" + mse + " n=" + dataset.size()).getBytes(StandardCharsets.UTF_8);
        return new TrainingOutcome(artifact, ModelMetrics.of(mse, Math.sqrt(mse), 1.0 - mse),
                Map.of("algorithm", "scripted"));
    }
}
