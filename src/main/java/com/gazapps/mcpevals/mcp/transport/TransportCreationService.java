package com.gazapps.mcpevals.mcp.transport;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.InvalidConfigurationException;
import com.gazapps.mcpevals.exceptions.ServerStartException;
import com.gazapps.mcpevals.mcp.process.LaunchTable;
import com.gazapps.mcpevals.mcp.process.ServerProcessManager;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ServerType;

/**
 * Turns a resolved transport kind plus configuration into a {@link TransportHandle}.
 * For http with a path the server is launched and polled here; for stdio only the
 * launch command is built.
 */
public class TransportCreationService {

    private static final Logger logger = LoggerFactory.getLogger(TransportCreationService.class);

    private final ServerTypeDetector typeDetector;
    private final ServerProcessManager processManager;

    public TransportCreationService(ServerTypeDetector typeDetector, ServerProcessManager processManager) {
        this.typeDetector = typeDetector;
        this.processManager = processManager;
    }

    public TransportHandle createTransport(String transportKind, ServerConfiguration config, CancellationToken cancellation) {
        String kind = transportKind != null ? transportKind.toLowerCase(Locale.ROOT) : "";
        return switch (kind) {
            case TransportResolver.HTTP -> createHttpTransport(config, cancellation);
            case TransportResolver.STDIO -> createStdioTransport(config);
            default -> throw new InvalidConfigurationException("Transport not supported: " + transportKind);
        };
    }

    private TransportHandle createHttpTransport(ServerConfiguration config, CancellationToken cancellation) {
        if (!config.hasUrl()) {
            throw new InvalidConfigurationException("URL is required for http transport");
        }
        URI endpoint = parseEndpoint(config.url);

        if (!config.hasPath()) {
            logger.info("🌐 Connecting to running HTTP server at {}", endpoint);
            return TransportHandle.http(endpoint, null);
        }

        ServerType type = typeDetector.detectServerType(config.path, config);
        Process process = processManager.startServer(type, config.path, config, cancellation);

        boolean ready;
        try {
            ready = processManager.isServerReady(endpoint.toString(), readinessBudget(config), cancellation);
        } catch (RuntimeException e) {
            ServerProcessManager.stop(process);
            throw e;
        }
        if (!ready) {
            ServerProcessManager.stop(process);
            cancellation.throwIfCancelled();
            throw new ServerStartException(config.path, "Server failed to become ready at " + endpoint);
        }
        return TransportHandle.http(endpoint, process);
    }

    private static Duration readinessBudget(ServerConfiguration config) {
        return config.timeout > 0 ? Duration.ofSeconds(config.timeout) : null;
    }

    private TransportHandle createStdioTransport(ServerConfiguration config) {
        if (!config.hasPath()) {
            throw new InvalidConfigurationException("Path is required for stdio transport");
        }

        ServerType type = typeDetector.detectServerType(config.path, config);
        Path artifact = Paths.get(config.path).toAbsolutePath().normalize();
        List<String> commandLine = LaunchTable.command(type, artifact, config.argsOrEmpty());

        logger.info("📡 stdio server ({}): {}", type.getDescription(), String.join(" ", commandLine));
        return TransportHandle.stdio(commandLine, artifact.getParent(), config.env);
    }

    private static URI parseEndpoint(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
            if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
                throw new InvalidConfigurationException("URL must be an absolute http or https address: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new InvalidConfigurationException("Invalid URL: " + url, e);
        }
    }
}
