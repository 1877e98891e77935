package com.gazapps.mcpevals.mcp;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.model.ServerConfiguration;

/**
 * Builds a fresh, initialized connection for a configuration. Called by
 * {@link ConnectionCache} on a miss.
 */
@FunctionalInterface
public interface McpConnectionFactory {

    CachedConnection create(ServerConfiguration config, CancellationToken cancellation);
}
