package com.gazapps.mcpevals.core;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-scoped cancellation signal. Every blocking step of an evaluation (settle delay,
 * readiness polling, language model calls, protocol calls) checks or waits on it.
 * Cancelling wakes pending {@link #sleep(Duration)} calls at once and runs the
 * registered callbacks, which typically abort in-flight requests.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation callback failed: {}", e.getMessage());
            }
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Evaluation run was cancelled");
        }
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately if already cancelled.
     * The returned handle unregisters it.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits for the given duration or until cancelled, whichever comes first.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if cancelled
     *         or the calling thread was interrupted
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
