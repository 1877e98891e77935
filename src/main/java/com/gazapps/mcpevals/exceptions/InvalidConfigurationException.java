package com.gazapps.mcpevals.exceptions;

/**
 * Server configuration that cannot be turned into a transport: missing url or path,
 * malformed url, unsupported transport kind or server type.
 */
public class InvalidConfigurationException extends McpEvalsException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
