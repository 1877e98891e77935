package com.gazapps.mcpevals.model;

import java.util.Objects;

/**
 * Five sub-scores in [1, 5] plus free-text comments. Out-of-range values are
 * rejected at construction, so every instance is valid.
 */
public final class EvaluationScore {

    public static final int MIN = 1;
    public static final int MAX = 5;

    private final int accuracy;
    private final int completeness;
    private final int relevance;
    private final int clarity;
    private final int reasoning;
    private final String overallComments;

    public EvaluationScore(int accuracy, int completeness, int relevance, int clarity, int reasoning,
            String overallComments) {
        this.accuracy = checkRange("accuracy", accuracy);
        this.completeness = checkRange("completeness", completeness);
        this.relevance = checkRange("relevance", relevance);
        this.clarity = checkRange("clarity", clarity);
        this.reasoning = checkRange("reasoning", reasoning);
        this.overallComments = overallComments != null ? overallComments : "";
    }

    /**
     * All 3s. Used when the scorer answered but its output could not be read.
     */
    public static EvaluationScore neutral(String comments) {
        return new EvaluationScore(3, 3, 3, 3, 3, comments);
    }

    /**
     * All 1s. Marks an evaluation that failed before it could be scored.
     */
    public static EvaluationScore failed(String comments) {
        return new EvaluationScore(1, 1, 1, 1, 1, comments);
    }

    private static int checkRange(String field, int value) {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException(
                    String.format("%s must be between %d and %d, got %d", field, MIN, MAX, value));
        }
        return value;
    }

    public double getAverageScore() {
        return (accuracy + completeness + relevance + clarity + reasoning) / 5.0;
    }

    public int getAccuracy() { return accuracy; }
    public int getCompleteness() { return completeness; }
    public int getRelevance() { return relevance; }
    public int getClarity() { return clarity; }
    public int getReasoning() { return reasoning; }
    public String getOverallComments() { return overallComments; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        EvaluationScore that = (EvaluationScore) obj;
        return accuracy == that.accuracy &&
               completeness == that.completeness &&
               relevance == that.relevance &&
               clarity == that.clarity &&
               reasoning == that.reasoning &&
               Objects.equals(overallComments, that.overallComments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accuracy, completeness, relevance, clarity, reasoning, overallComments);
    }

    @Override
    public String toString() {
        return String.format("EvaluationScore{accuracy=%d, completeness=%d, relevance=%d, clarity=%d, reasoning=%d, average=%.2f}",
                accuracy, completeness, relevance, clarity, reasoning, getAverageScore());
    }
}
