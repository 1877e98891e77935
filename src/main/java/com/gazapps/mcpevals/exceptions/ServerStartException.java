package com.gazapps.mcpevals.exceptions;

/**
 * A launched server exited right away or never answered its readiness probe.
 */
public class ServerStartException extends McpEvalsException {

    private final String serverPath;
    private final Integer exitCode;

    public ServerStartException(String serverPath, String message) {
        this(serverPath, message, null, null);
    }

    public ServerStartException(String serverPath, String message, Integer exitCode) {
        this(serverPath, message, exitCode, null);
    }

    public ServerStartException(String serverPath, String message, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.serverPath = serverPath;
        this.exitCode = exitCode;
    }

    public String getServerPath() {
        return serverPath;
    }

    /**
     * Exit code of the process, or {@code null} when it was still alive but not ready.
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
