package com.gazapps.mcpevals.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.ConnectionException;
import com.gazapps.mcpevals.llm.LlmException;
import com.gazapps.mcpevals.llm.LlmProvider;
import com.gazapps.mcpevals.mcp.CachedConnection;
import com.gazapps.mcpevals.mcp.ConnectionCache;
import com.gazapps.mcpevals.mcp.transport.TransportResolver;
import com.gazapps.mcpevals.metrics.LoggingMetricsCollector;
import com.gazapps.mcpevals.model.EvaluationRequest;
import com.gazapps.mcpevals.model.EvaluationResult;
import com.gazapps.mcpevals.model.EvaluationScore;
import com.gazapps.mcpevals.model.EvaluationSummary;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ToolExecution;
import com.gazapps.mcpevals.planning.ToolExecutionPlanner;
import com.gazapps.mcpevals.support.FakeMcpConnection;
import com.gazapps.mcpevals.support.StubLanguageModel;

class EvaluationOrchestratorTest {

    private final ServerConfiguration server = ServerConfiguration.stdio("calculator/index.js");

    private FakeMcpConnection calculator;
    private LoggingMetricsCollector metrics;
    private ConnectionCache cache;
    private EvaluationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        calculator = FakeMcpConnection.calculator();
        metrics = new LoggingMetricsCollector();
        cache = new ConnectionCache((cfg, cancellation) -> new CachedConnection(calculator, null),
                new TransportResolver(), metrics);
        StubLanguageModel model = StubLanguageModel.scoringOnly(4);
        orchestrator = new EvaluationOrchestrator(cache, new ToolExecutionPlanner(model),
                new LlmEvaluationScorer(model), metrics);
    }

    @Test
    void echoPrompt_callsEchoAndScores() {
        EvaluationRequest request = new EvaluationRequest("echo", "Echo a greeting", "echo 'hello world'");

        EvaluationResult result = orchestrator.evaluate(request, server, CancellationToken.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse()).contains("hello world");
        assertThat(result.getScore().getAverageScore()).isEqualTo(4.0);
        ToolExecution call = calculator.getCalls().get(0);
        assertThat(call.getToolName()).isEqualTo("echo");
        assertThat(call.getArguments()).containsEntry("message", "hello world");
        assertThat(metrics.getCompleted()).isEqualTo(1);
    }

    @Test
    void unreachableServer_failsWithConnectionMessage() {
        ConnectionCache failing = new ConnectionCache((cfg, cancellation) -> {
            throw new ConnectionException("connection refused", cfg.path);
        }, new TransportResolver(), metrics);
        EvaluationOrchestrator broken = new EvaluationOrchestrator(failing,
                new ToolExecutionPlanner(null), new LlmEvaluationScorer(StubLanguageModel.scoringOnly(5)), metrics);

        EvaluationResult result = broken.evaluate(new EvaluationRequest("add", null, "add 1 and 2"), server,
                CancellationToken.none());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("Failed to connect to MCP server");
        assertThat(result.getScore()).isEqualTo(EvaluationScore.failed("Evaluation failed: Failed to connect to MCP server"));
        assertThat(metrics.getFailed()).isEqualTo(1);
    }

    @Test
    void scoringModelDown_stillSucceedsWithNeutralScore() {
        StubLanguageModel quotaExceeded = new StubLanguageModel(request -> {
            throw new LlmException(LlmProvider.OPENAI, LlmException.ErrorType.RATE_LIMIT, "quota");
        });
        EvaluationOrchestrator noJudge = new EvaluationOrchestrator(cache, new ToolExecutionPlanner(quotaExceeded),
                new LlmEvaluationScorer(quotaExceeded), metrics);

        EvaluationResult result = noJudge.evaluate(new EvaluationRequest("add", null, "add 5 and 3"), server,
                CancellationToken.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse()).isEqualTo("8.0");
        assertThat(result.getScore().getAverageScore()).isEqualTo(3.0);
        assertThat(result.getScore().getOverallComments()).startsWith("Failed to score response: ");
        assertThat(metrics.getCompleted()).isEqualTo(1);
    }

    @Test
    void evaluateAll_keepsRequestOrderAndClosesCache() {
        List<EvaluationRequest> requests = List.of(
            new EvaluationRequest("first", null, "add 5 and 3"),
            new EvaluationRequest("second", null, "echo 'ping'"),
            new EvaluationRequest("third", null, "add 10 and 20"),
            new EvaluationRequest("fourth", null, "echo 'pong'"));

        EvaluationSummary summary = orchestrator.evaluateAll(requests, server, 3, CancellationToken.none());

        assertThat(summary.getResults()).extracting(EvaluationResult::getName)
            .containsExactly("first", "second", "third", "fourth");
        assertThat(summary.getResults()).extracting(EvaluationResult::getResponse)
            .containsExactly("8.0", "Echo: ping", "30.0", "Echo: pong");
        assertThat(summary.allSucceeded()).isTrue();
        assertThat(summary.getAverageScore()).isEqualTo(4.0);
        assertThat(cache.size()).isZero();
        assertThat(calculator.getCloseCount()).isEqualTo(1);
    }

    @Test
    void evaluateAll_neverExceedsParallelism() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        EvaluationScorer slowScorer = (prompt, response, expected, cancellation) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                cancellation.sleep(Duration.ofMillis(30));
                return EvaluationScore.neutral("slow");
            } finally {
                running.decrementAndGet();
            }
        };
        EvaluationOrchestrator bounded = new EvaluationOrchestrator(cache, new ToolExecutionPlanner(null),
                slowScorer, metrics);
        List<EvaluationRequest> requests = List.of(
            new EvaluationRequest("a", null, "add 1 and 1"),
            new EvaluationRequest("b", null, "add 2 and 2"),
            new EvaluationRequest("c", null, "add 3 and 3"),
            new EvaluationRequest("d", null, "add 4 and 4"),
            new EvaluationRequest("e", null, "add 5 and 5"));

        EvaluationSummary summary = bounded.evaluateAll(requests, server, 2, CancellationToken.none());

        assertThat(summary.getSuccessCount()).isEqualTo(5);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void evaluateAll_serverDown_averagesToZero() {
        ConnectionCache unreachable = new ConnectionCache((cfg, cancellation) -> {
            throw new ConnectionException("connection refused", cfg.path);
        }, new TransportResolver(), metrics);
        EvaluationOrchestrator down = new EvaluationOrchestrator(unreachable, new ToolExecutionPlanner(null),
                new LlmEvaluationScorer(StubLanguageModel.scoringOnly(5)), metrics);

        EvaluationSummary summary = down.evaluateAll(
                List.of(new EvaluationRequest("a", null, "add 1 and 2"), new EvaluationRequest("b", null, "echo 'x'")),
                server, 2, CancellationToken.none());

        assertThat(summary.getFailureCount()).isEqualTo(2);
        assertThat(summary.getAverageScore()).isZero();
        assertThat(summary.allSucceeded()).isFalse();
    }

    @Test
    void evaluateAll_cancelledRun_failsEveryRequest() {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();

        EvaluationSummary summary = orchestrator.evaluateAll(
                List.of(new EvaluationRequest("a", null, "add 1 and 2"), new EvaluationRequest("b", null, "echo 'x'")),
                server, 2, cancellation);

        assertThat(summary.getResults()).extracting(EvaluationResult::getErrorMessage)
            .containsOnly("Evaluation cancelled");
        assertThat(calculator.getCalls()).isEmpty();
    }

    @Test
    void evaluateAll_emptyBatch_givesEmptySummary() {
        EvaluationSummary summary = orchestrator.evaluateAll(List.of(), server, 4, CancellationToken.none());

        assertThat(summary.getTotal()).isZero();
        assertThat(summary.allSucceeded()).isTrue();
    }
}
