package com.gazapps.mcpevals.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

class EvaluationSummaryTest {

    private final EvaluationRequest request = new EvaluationRequest("add", "adds", "add 5 and 3");

    @Test
    void averageScore_onlyCountsSuccesses() {
        EvaluationSummary summary = EvaluationSummary.of(List.of(
            EvaluationResult.success(request, "8", new EvaluationScore(5, 5, 5, 5, 5, ""), Duration.ofSeconds(1)),
            EvaluationResult.success(request, "8", new EvaluationScore(3, 3, 3, 3, 3, ""), Duration.ofSeconds(1)),
            EvaluationResult.failure(request, "Failed to connect to MCP server", Duration.ZERO)));

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getSuccessCount()).isEqualTo(2);
        assertThat(summary.getFailureCount()).isEqualTo(1);
        assertThat(summary.getAverageScore()).isEqualTo(4.0);
        assertThat(summary.allSucceeded()).isFalse();
    }

    @Test
    void emptyBatch_hasZeroAverage_andSucceeds() {
        EvaluationSummary summary = EvaluationSummary.of(List.of());

        assertThat(summary.getAverageScore()).isZero();
        assertThat(summary.allSucceeded()).isTrue();
    }

    @Test
    void failureResult_carriesMessageAndSentinelScore() {
        EvaluationResult result = EvaluationResult.failure(request, "boom", Duration.ofMillis(5));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("boom");
        assertThat(result.getScore().getAverageScore()).isEqualTo(1.0);
        assertThat(result.getScore().getOverallComments()).isEqualTo("Evaluation failed: boom");
        assertThat(result.getName()).isEqualTo("add");
    }
}
