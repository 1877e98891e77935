package com.gazapps.mcpevals.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one {@link EvaluationRequest}. Immutable.
 */
public final class EvaluationResult {

    private final String name;
    private final String description;
    private final String prompt;
    private final String response;
    private final EvaluationScore score;
    private final Duration duration;
    private final Instant timestamp;
    private final String errorMessage;

    private EvaluationResult(EvaluationRequest request, String response, EvaluationScore score,
            Duration duration, String errorMessage) {
        this.name = request.name;
        this.description = request.description;
        this.prompt = request.prompt;
        this.response = response != null ? response : "";
        this.score = Objects.requireNonNull(score, "Score cannot be null");
        this.duration = duration != null ? duration : Duration.ZERO;
        this.timestamp = Instant.now();
        this.errorMessage = errorMessage;
    }

    public static EvaluationResult success(EvaluationRequest request, String response,
            EvaluationScore score, Duration duration) {
        return new EvaluationResult(request, response, score, duration, null);
    }

    /**
     * Failed evaluation with the sentinel all-1 score.
     */
    public static EvaluationResult failure(EvaluationRequest request, String errorMessage, Duration duration) {
        String message = errorMessage != null && !errorMessage.isEmpty() ? errorMessage : "Unknown error";
        return new EvaluationResult(request, "", EvaluationScore.failed("Evaluation failed: " + message),
                duration, message);
    }

    public boolean isSuccess() {
        return errorMessage == null || errorMessage.isEmpty();
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getPrompt() { return prompt; }
    public String getResponse() { return response; }
    public EvaluationScore getScore() { return score; }
    public Duration getDuration() { return duration; }
    public Instant getTimestamp() { return timestamp; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("EvaluationResult{name='%s', success=true, average=%.2f, time=%dms}",
                    name, score.getAverageScore(), duration.toMillis());
        }
        return String.format("EvaluationResult{name='%s', success=false, error='%s'}", name, errorMessage);
    }
}
