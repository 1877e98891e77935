package com.gazapps.mcpevals.mcp.transport;

import java.util.Locale;

import com.gazapps.mcpevals.model.ServerConfiguration;

/**
 * Picks the transport kind for a configuration: explicit value, else http when a
 * url is present, else stdio.
 */
public class TransportResolver {

    public static final String STDIO = "stdio";
    public static final String HTTP = "http";

    public String resolveTransport(ServerConfiguration config) {
        if (config.transport != null && !config.transport.isBlank()) {
            return config.transport.trim().toLowerCase(Locale.ROOT);
        }
        if (config.hasUrl()) {
            return HTTP;
        }
        return STDIO;
    }
}
