package com.gazapps.mcpevals.metrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the {@code metrics} logger and keeps running counters.
 */
public class LoggingMetricsCollector implements MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger("metrics");

    private final AtomicInteger started = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger connectionFailures = new AtomicInteger();

    @Override
    public void evaluationStarted(String evaluationName) {
        started.incrementAndGet();
        logger.info("📊 evaluation started: {}", evaluationName);
    }

    @Override
    public void evaluationCompleted(String evaluationName, Duration duration, double averageScore) {
        completed.incrementAndGet();
        logger.info("📊 evaluation completed: {} in {}ms, score {}", evaluationName, duration.toMillis(),
                String.format("%.2f", averageScore));
    }

    @Override
    public void evaluationFailed(String evaluationName, Duration duration, String reason) {
        failed.incrementAndGet();
        logger.info("📊 evaluation failed: {} in {}ms: {}", evaluationName, duration.toMillis(), reason);
    }

    @Override
    public void connectionAttempt(String serverKey) {
        logger.debug("📊 connection attempt: {}", serverKey);
    }

    @Override
    public void connectionSuccess(String serverKey) {
        logger.debug("📊 connection success: {}", serverKey);
    }

    @Override
    public void connectionFailure(String serverKey, String reason) {
        connectionFailures.incrementAndGet();
        logger.info("📊 connection failure: {}: {}", serverKey, reason);
    }

    public int getStarted() { return started.get(); }
    public int getCompleted() { return completed.get(); }
    public int getFailed() { return failed.get(); }
    public int getConnectionFailures() { return connectionFailures.get(); }

    public void logSummary() {
        logger.info("📊 {}", this);
    }

    @Override
    public String toString() {
        return String.format("Metrics{started=%d, completed=%d, failed=%d, connectionFailures=%d}",
                getStarted(), getCompleted(), getFailed(), getConnectionFailures());
    }
}
