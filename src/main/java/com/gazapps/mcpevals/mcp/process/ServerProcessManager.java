package com.gazapps.mcpevals.mcp.process;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.InvalidConfigurationException;
import com.gazapps.mcpevals.exceptions.ServerStartException;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ServerType;

/**
 * Launches server processes for HTTP servers the harness owns and polls them until
 * they answer. Child output goes to {@code log/servers/<artifact>.log}, never to the
 * harness's own stdout.
 */
public class ServerProcessManager {

    private static final Logger logger = LoggerFactory.getLogger(ServerProcessManager.class);

    static final String PING_BODY = "{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1}";

    public static final int DEFAULT_MAX_ATTEMPTS = 15;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(1);
    private static final long STOP_GRACE_SECONDS = 5;

    private final HttpClient httpClient;
    private final int maxAttempts;
    private final Duration pollInterval;
    private final Duration requestTimeout;
    private final Duration settleDelay;
    private final Path logDirectory;

    public ServerProcessManager() {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_REQUEST_TIMEOUT).build(),
             DEFAULT_MAX_ATTEMPTS, DEFAULT_POLL_INTERVAL, DEFAULT_REQUEST_TIMEOUT, DEFAULT_SETTLE_DELAY,
             Paths.get("log", "servers"));
    }

    public ServerProcessManager(HttpClient httpClient, int maxAttempts, Duration pollInterval,
            Duration requestTimeout, Duration settleDelay, Path logDirectory) {
        this.httpClient = httpClient;
        this.maxAttempts = maxAttempts;
        this.pollInterval = pollInterval;
        this.requestTimeout = requestTimeout;
        this.settleDelay = settleDelay;
        this.logDirectory = logDirectory;
    }

    public Process startServer(ServerType serverType, String serverPath, ServerConfiguration config,
            CancellationToken cancellation) {
        if (serverType == ServerType.UNKNOWN) {
            throw new InvalidConfigurationException("Unsupported server type for: " + serverPath);
        }
        cancellation.throwIfCancelled();

        Path artifact = Paths.get(serverPath).toAbsolutePath().normalize();
        List<String> command = LaunchTable.command(serverType, artifact, config.argsOrEmpty());

        ProcessBuilder builder = new ProcessBuilder(command);
        Path workingDir = artifact.getParent();
        if (workingDir != null && Files.isDirectory(workingDir)) {
            builder.directory(workingDir.toFile());
        }
        if (config.env != null) {
            builder.environment().putAll(config.env);
        }
        builder.redirectErrorStream(true);

        Process process;
        try {
            Files.createDirectories(logDirectory);
            Path logFile = logDirectory.resolve(artifact.getFileName() + ".log");
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            logger.info("🚀 Starting {} server: {}", serverType.getDescription(), String.join(" ", command));
            process = builder.start();
        } catch (IOException e) {
            throw new ServerStartException(serverPath, "Failed to start server process: " + e.getMessage(), null, e);
        }

        boolean settled = cancellation.sleep(settleDelay);

        if (!process.isAlive()) {
            int exitCode = process.exitValue();
            logger.error("❌ Server process exited immediately with code {}: {}", exitCode, serverPath);
            throw new ServerStartException(serverPath,
                    "Server process exited immediately with code: " + exitCode, exitCode);
        }

        if (!settled) {
            stop(process);
            throw new CancellationException("Server start cancelled: " + serverPath);
        }

        logger.debug("Server process {} running (pid {})", serverPath, process.pid());
        return process;
    }

    /**
     * Polls {@code endpoint} with a JSON-RPC ping until any HTTP response arrives.
     * I/O failures are retried; anything else (bad endpoint, cancellation) gives up at once.
     */
    public boolean isServerReady(String endpoint, CancellationToken cancellation) {
        return isServerReady(endpoint, null, cancellation);
    }

    /**
     * Same as {@link #isServerReady(String, CancellationToken)}, but also gives up once
     * {@code budget} has elapsed. A {@code null} budget means the attempt ceiling alone.
     */
    public boolean isServerReady(String endpoint, Duration budget, CancellationToken cancellation) {
        long deadline = budget != null ? System.nanoTime() + budget.toNanos() : 0L;
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(endpoint))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(PING_BODY))
                    .build();
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid readiness endpoint {}: {}", endpoint, e.getMessage());
            return false;
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                return false;
            }

            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                logger.info("✅ Server ready at {} (status {}, attempt {}/{})", endpoint, response.statusCode(), attempt, maxAttempts);
                return true;
            } catch (IOException e) {
                logger.debug("Server not ready at {} (attempt {}/{}): {}", endpoint, attempt, maxAttempts, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (RuntimeException e) {
                logger.warn("Readiness check aborted for {}: {}", endpoint, e.getMessage());
                return false;
            }

            if (attempt < maxAttempts) {
                Duration wait = pollInterval;
                if (budget != null) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        logger.warn("⚠️ Server at {} not ready within {}s", endpoint, budget.toSeconds());
                        return false;
                    }
                    if (remaining < pollInterval.toNanos()) {
                        wait = Duration.ofNanos(remaining);
                    }
                }
                if (!cancellation.sleep(wait)) {
                    return false;
                }
            }
        }

        logger.warn("⚠️ Server at {} not ready after {} attempts", endpoint, maxAttempts);
        return false;
    }

    /**
     * Terminates a process, forcibly after a short grace period.
     */
    public static void stop(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
