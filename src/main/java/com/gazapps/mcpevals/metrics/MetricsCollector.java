package com.gazapps.mcpevals.metrics;

import java.time.Duration;

/**
 * Hooks for evaluation and connection events.
 */
public interface MetricsCollector {

    void evaluationStarted(String evaluationName);

    void evaluationCompleted(String evaluationName, Duration duration, double averageScore);

    void evaluationFailed(String evaluationName, Duration duration, String reason);

    void connectionAttempt(String serverKey);

    void connectionSuccess(String serverKey);

    void connectionFailure(String serverKey, String reason);
}
