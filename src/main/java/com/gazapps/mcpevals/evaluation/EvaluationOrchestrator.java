package com.gazapps.mcpevals.evaluation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.mcp.ConnectionCache;
import com.gazapps.mcpevals.mcp.McpConnection;
import com.gazapps.mcpevals.metrics.MetricsCollector;
import com.gazapps.mcpevals.model.EvaluationRequest;
import com.gazapps.mcpevals.model.EvaluationResult;
import com.gazapps.mcpevals.model.EvaluationScore;
import com.gazapps.mcpevals.model.EvaluationSummary;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.planning.ToolExecutionPlanner;

/**
 * Runs evaluation requests against one server: connect, plan and call tools, score.
 * <p>
 * Every request produces a result; failures become failure results instead of
 * exceptions. The orchestrator owns its {@link ConnectionCache} and tears it down when
 * a batch ends or when it is closed.
 */
public class EvaluationOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    static final String CONNECTION_FAILED = "Failed to connect to MCP server";
    static final String CANCELLED = "Evaluation cancelled";

    private final ConnectionCache connectionCache;
    private final ToolExecutionPlanner planner;
    private final EvaluationScorer scorer;
    private final MetricsCollector metrics;

    public EvaluationOrchestrator(ConnectionCache connectionCache, ToolExecutionPlanner planner,
            EvaluationScorer scorer, MetricsCollector metrics) {
        this.connectionCache = connectionCache;
        this.planner = planner;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    public EvaluationResult evaluate(EvaluationRequest request, ServerConfiguration server,
            CancellationToken cancellation) {
        long start = System.nanoTime();
        metrics.evaluationStarted(request.name);
        logger.info("🧪 Starting evaluation: {}", request.name);

        try {
            cancellation.throwIfCancelled();
            if (!connectionCache.testConnection(server, cancellation)) {
                return fail(request, CONNECTION_FAILED, start);
            }

            McpConnection client = connectionCache.getOrCreateClient(server, cancellation);
            String response = planner.executeToolInteraction(client, server, request.prompt, cancellation);
            EvaluationScore score = scorer.score(request.prompt, response, request.expectedResult, cancellation);

            Duration elapsed = elapsedSince(start);
            metrics.evaluationCompleted(request.name, elapsed, score.getAverageScore());
            logger.info("✅ Evaluation {} completed, average score {}", request.name,
                    String.format("%.2f", score.getAverageScore()));
            return EvaluationResult.success(request, response, score, elapsed);

        } catch (CancellationException e) {
            return fail(request, CANCELLED, start);
        } catch (RuntimeException e) {
            logger.debug("Evaluation {} failed", request.name, e);
            return fail(request, e.getMessage(), start);
        }
    }

    /**
     * Evaluates every request with at most {@code parallelism} running at once, then
     * closes all connections. Results come back in request order.
     */
    public EvaluationSummary evaluateAll(List<EvaluationRequest> requests, ServerConfiguration server,
            int parallelism, CancellationToken cancellation) {
        int limit = Math.max(1, parallelism);
        logger.info("🚀 Running {} evaluation(s) with parallelism {}", requests.size(), limit);

        ExecutorService executor = Executors.newFixedThreadPool(limit, workerThreads());
        Semaphore permits = new Semaphore(limit);
        List<Future<EvaluationResult>> futures = new CopyOnWriteArrayList<>();

        try (CancellationToken.Registration ignored =
                cancellation.onCancel(() -> futures.forEach(future -> future.cancel(true)))) {

            for (EvaluationRequest request : requests) {
                futures.add(executor.submit(() -> evaluateWithPermit(permits, request, server, cancellation)));
            }
            if (cancellation.isCancelled()) {
                futures.forEach(future -> future.cancel(true));
            }

            List<EvaluationResult> results = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                results.add(collect(futures.get(i), requests.get(i)));
            }

            EvaluationSummary summary = EvaluationSummary.of(results);
            logger.info("📊 {}", summary);
            return summary;
        } finally {
            executor.shutdownNow();
            connectionCache.closeAll();
        }
    }

    private EvaluationResult evaluateWithPermit(Semaphore permits, EvaluationRequest request,
            ServerConfiguration server, CancellationToken cancellation) throws InterruptedException {
        permits.acquire();
        try {
            return evaluate(request, server, cancellation);
        } finally {
            permits.release();
        }
    }

    private EvaluationResult collect(Future<EvaluationResult> future, EvaluationRequest request) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return EvaluationResult.failure(request, CANCELLED, Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EvaluationResult.failure(request, CANCELLED, Duration.ZERO);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof InterruptedException) {
                return EvaluationResult.failure(request, CANCELLED, Duration.ZERO);
            }
            logger.error("❌ Evaluation {} crashed: {}", request.name, cause.getMessage());
            return EvaluationResult.failure(request, cause.getMessage(), Duration.ZERO);
        }
    }

    private EvaluationResult fail(EvaluationRequest request, String message, long start) {
        Duration elapsed = elapsedSince(start);
        metrics.evaluationFailed(request.name, elapsed, message);
        logger.warn("❌ Evaluation {} failed: {}", request.name, message);
        return EvaluationResult.failure(request, message, elapsed);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "evaluation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public ConnectionCache getConnectionCache() {
        return connectionCache;
    }

    @Override
    public void close() {
        connectionCache.closeAll();
    }
}
