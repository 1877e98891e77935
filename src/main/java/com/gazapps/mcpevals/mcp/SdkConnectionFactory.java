package com.gazapps.mcpevals.mcp;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.ConnectionException;
import com.gazapps.mcpevals.mcp.process.ServerProcessManager;
import com.gazapps.mcpevals.mcp.transport.TransportCreationService;
import com.gazapps.mcpevals.mcp.transport.TransportHandle;
import com.gazapps.mcpevals.mcp.transport.TransportResolver;
import com.gazapps.mcpevals.model.ServerConfiguration;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;

/**
 * Resolves the transport, builds the handle (launching the server when needed) and
 * opens an initialized SDK client over it.
 */
public class SdkConnectionFactory implements McpConnectionFactory {

    private static final Logger logger = LoggerFactory.getLogger(SdkConnectionFactory.class);
    private static final String DEFAULT_HTTP_ENDPOINT = "/mcp";

    private final TransportResolver transportResolver;
    private final TransportCreationService transportCreation;

    public SdkConnectionFactory(TransportResolver transportResolver, TransportCreationService transportCreation) {
        this.transportResolver = transportResolver;
        this.transportCreation = transportCreation;
    }

    @Override
    public CachedConnection create(ServerConfiguration config, CancellationToken cancellation) {
        String kind = transportResolver.resolveTransport(config);
        TransportHandle handle = transportCreation.createTransport(kind, config, cancellation);
        String serverName = describe(config);

        McpSyncClient client = null;
        try {
            cancellation.throwIfCancelled();
            logger.info("📡 Connecting to {} ...", serverName);
            client = buildClient(handle, config);
            client.initialize();
            logger.info("✅ Connected to {}", serverName);
            return new CachedConnection(new SdkMcpConnection(client, serverName), handle.getOwnedProcess());
        } catch (RuntimeException e) {
            closeClient(client, serverName);
            ServerProcessManager.stop(handle.getOwnedProcess());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("❌ Failed to connect to {}: {}", serverName, message);
            throw new ConnectionException("Failed to connect to MCP server '" + serverName + "': " + message, serverName, e);
        }
    }

    protected McpSyncClient buildClient(TransportHandle handle, ServerConfiguration config) {
        return McpClient.sync(createClientTransport(handle))
            .requestTimeout(Duration.ofSeconds(config.timeout))
            .build();
    }

    /**
     * Closing the client also stops a stdio child the SDK spawned.
     */
    private static void closeClient(McpSyncClient client, String serverName) {
        if (client == null) {
            return;
        }
        try {
            if (!client.closeGracefully()) {
                client.close();
            }
        } catch (RuntimeException e) {
            logger.warn("Graceful close of {} failed, forcing: {}", serverName, e.getMessage());
            client.close();
        }
    }

    private McpClientTransport createClientTransport(TransportHandle handle) {
        return switch (handle.getKind()) {
            case STDIO -> {
                ServerParameters params = ServerParameters.builder(handle.getCommand())
                    .args(handle.getArgs())
                    .env(Map.copyOf(handle.getEnvironment()))
                    .build();
                yield new StdioClientTransport(params);
            }
            case HTTP -> {
                URI endpoint = handle.getEndpoint();
                String base = endpoint.getScheme() + "://" + endpoint.getRawAuthority();
                String path = endpoint.getRawPath() == null || endpoint.getRawPath().isEmpty()
                        ? DEFAULT_HTTP_ENDPOINT
                        : endpoint.getRawPath();
                yield HttpClientStreamableHttpTransport.builder(base)
                    .endpoint(path)
                    .build();
            }
        };
    }

    private static String describe(ServerConfiguration config) {
        return config.hasUrl() ? config.url : config.path;
    }
}
