package com.gazapps.mcpevals.model;

import java.util.List;

/**
 * Aggregate view over a batch. The mean only counts successful results.
 */
public final class EvaluationSummary {

    private final List<EvaluationResult> results;
    private final int successCount;
    private final int failureCount;
    private final double averageScore;

    private EvaluationSummary(List<EvaluationResult> results, int successCount, int failureCount, double averageScore) {
        this.results = results;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.averageScore = averageScore;
    }

    public static EvaluationSummary of(List<EvaluationResult> results) {
        List<EvaluationResult> copy = List.copyOf(results);
        int successes = (int) copy.stream().filter(EvaluationResult::isSuccess).count();
        double average = copy.stream()
                .filter(EvaluationResult::isSuccess)
                .mapToDouble(r -> r.getScore().getAverageScore())
                .average()
                .orElse(0.0);
        return new EvaluationSummary(copy, successes, copy.size() - successes, average);
    }

    public List<EvaluationResult> getResults() { return results; }
    public int getTotal() { return results.size(); }
    public int getSuccessCount() { return successCount; }
    public int getFailureCount() { return failureCount; }
    public double getAverageScore() { return averageScore; }

    public boolean allSucceeded() {
        return failureCount == 0;
    }

    @Override
    public String toString() {
        return String.format("EvaluationSummary{total=%d, success=%d, failed=%d, average=%.2f}",
                getTotal(), successCount, failureCount, averageScore);
    }
}
