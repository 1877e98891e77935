package com.gazapps.mcpevals.mcp;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.ConnectionException;
import com.gazapps.mcpevals.exceptions.InvalidConfigurationException;
import com.gazapps.mcpevals.exceptions.McpEvalsException;
import com.gazapps.mcpevals.exceptions.ServerStartException;
import com.gazapps.mcpevals.mcp.transport.TransportResolver;
import com.gazapps.mcpevals.metrics.MetricsCollector;
import com.gazapps.mcpevals.model.ServerConfiguration;

/**
 * One live client, and at most one launched process, per configuration key for the
 * duration of a run.
 * <p>
 * The first caller for a key builds the connection; concurrent callers for the same
 * key wait on the same future. Deterministic failures (bad configuration, server that
 * will not start) stay cached for the run; other failures are dropped so the next
 * request tries again. {@link #closeAll()} is the single teardown point.
 */
public class ConnectionCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionCache.class);

    private final ConcurrentMap<String, CompletableFuture<CachedConnection>> connections = new ConcurrentHashMap<>();
    private final McpConnectionFactory connectionFactory;
    private final TransportResolver transportResolver;
    private final MetricsCollector metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<CompletableFuture<Void>> closing = ConcurrentHashMap.newKeySet();

    public ConnectionCache(McpConnectionFactory connectionFactory, TransportResolver transportResolver, MetricsCollector metrics) {
        this.connectionFactory = connectionFactory;
        this.transportResolver = transportResolver;
        this.metrics = metrics;
    }

    public McpConnection getOrCreateClient(ServerConfiguration config, CancellationToken cancellation) {
        return acquire(config, cancellation);
    }

    /**
     * True when a client can be obtained and lists at least one tool. Never throws.
     * A cached client whose server stopped answering is replaced once.
     */
    public boolean testConnection(ServerConfiguration config, CancellationToken cancellation) {
        String key = keyFor(config);
        metrics.connectionAttempt(key);
        try {
            int toolCount = listToolsReconnecting(key, config, cancellation).size();
            if (toolCount == 0) {
                metrics.connectionFailure(key, "server lists no tools");
                return false;
            }
            logger.debug("Connection to {} verified, {} tool(s) available", key, toolCount);
            metrics.connectionSuccess(key);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Connection test failed for {}: {}", key, e.getMessage());
            metrics.connectionFailure(key, e.getMessage());
            return false;
        }
    }

    private List<ToolDescriptor> listToolsReconnecting(String key, ServerConfiguration config,
            CancellationToken cancellation) {
        CachedConnection connection = acquire(config, cancellation);
        try {
            return connection.listTools();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            cancellation.throwIfCancelled();
            logger.warn("♻️ Connection to {} is no longer usable ({}), reconnecting", key, e.getMessage());
            evict(key, connection);
            return acquire(config, cancellation).listTools();
        }
    }

    private CachedConnection acquire(ServerConfiguration config, CancellationToken cancellation) {
        if (closed.get()) {
            throw new IllegalStateException("Connection cache already closed");
        }
        String key = keyFor(config);

        CachedConnection connection = getOrCreate(key, config, cancellation);
        if (connection.isStale()) {
            logger.warn("♻️ Server process for {} exited, reconnecting", key);
            evict(key, connection);
            connection = getOrCreate(key, config, cancellation);
        }
        return connection;
    }

    /**
     * Key joining transport, path, url and the {@code |}-joined args.
     */
    public String keyFor(ServerConfiguration config) {
        return String.join(":",
                transportResolver.resolveTransport(config),
                config.path != null ? config.path : "",
                config.url != null ? config.url : "",
                String.join("|", config.argsOrEmpty()));
    }

    public int size() {
        return connections.size();
    }

    private CachedConnection getOrCreate(String key, ServerConfiguration config, CancellationToken cancellation) {
        CompletableFuture<CachedConnection> created = new CompletableFuture<>();
        CompletableFuture<CachedConnection> existing = connections.putIfAbsent(key, created);

        if (existing == null) {
            logger.debug("Creating connection for {}", key);
            try {
                CachedConnection connection = connectionFactory.create(config, cancellation);
                created.complete(connection);
                return connection;
            } catch (RuntimeException e) {
                created.completeExceptionally(e);
                if (!isPermanent(e)) {
                    connections.remove(key, created);
                }
                throw e;
            }
        }

        return await(key, existing);
    }

    private CachedConnection await(String key, CompletableFuture<CachedConnection> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for connection " + key);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof McpEvalsException mcpEvalsException) {
                throw mcpEvalsException;
            }
            if (cause instanceof CancellationException cancellationException) {
                throw cancellationException;
            }
            throw new ConnectionException("Failed to connect: " + cause.getMessage(), key, cause);
        }
    }

    private static boolean isPermanent(RuntimeException e) {
        return e instanceof ServerStartException || e instanceof InvalidConfigurationException;
    }

    private void evict(String key, CachedConnection stale) {
        CompletableFuture<CachedConnection> current = connections.get(key);
        if (current != null && current.isDone() && !current.isCompletedExceptionally()
                && current.join() == stale) {
            connections.remove(key, current);
        }
        closeQuietly(key, stale);
    }

    /**
     * Closes every client and stops every owned process, concurrently. Errors are
     * logged, never thrown. Safe to call more than once, from any thread; a call
     * returns only after closes started by earlier calls have finished too.
     */
    public void closeAll() {
        closed.set(true);
        List<String> keys = new ArrayList<>(connections.keySet());
        if (!keys.isEmpty()) {
            logger.info("🔌 Closing {} connection(s)...", keys.size());
        }

        for (String key : keys) {
            CompletableFuture<CachedConnection> future = connections.remove(key);
            if (future == null) {
                continue;
            }
            closing.add(future
                .thenAcceptAsync(connection -> closeQuietly(key, connection))
                .exceptionally(e -> null));
        }

        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            logger.error("Error while closing connections: {}", e.getMessage());
        }
    }

    private void closeQuietly(String key, CachedConnection connection) {
        try {
            connection.close();
            logger.info("✅ {} closed", key);
        } catch (RuntimeException e) {
            logger.error("⚠️ Error closing {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
