package com.gazapps.mcpevals.exceptions;

/**
 * Exception for MCP server related problems
 */
public class ConnectionException extends McpEvalsException {

    private final String serverName;

    public ConnectionException(String message, String serverName) {
        super(message);
        this.serverName = serverName;
    }

    public ConnectionException(String message, String serverName, Throwable cause) {
        super(message, cause);
        this.serverName = serverName;
    }

    public String getServerName() {
        return serverName;
    }
}
