package com.gazapps.mcpevals.metrics;

import java.time.Duration;

public class NoOpMetricsCollector implements MetricsCollector {

    @Override
    public void evaluationStarted(String evaluationName) {
    }

    @Override
    public void evaluationCompleted(String evaluationName, Duration duration, double averageScore) {
    }

    @Override
    public void evaluationFailed(String evaluationName, Duration duration, String reason) {
    }

    @Override
    public void connectionAttempt(String serverKey) {
    }

    @Override
    public void connectionSuccess(String serverKey) {
    }

    @Override
    public void connectionFailure(String serverKey, String reason) {
    }
}
