package com.gazapps.mcpevals.exceptions;

/**
 * Base class for runtime failures of the evaluation core.
 */
public class McpEvalsException extends RuntimeException {

    public McpEvalsException(String message) {
        super(message);
    }

    public McpEvalsException(String message, Throwable cause) {
        super(message, cause);
    }
}
