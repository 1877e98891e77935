package com.gazapps.mcpevals.exceptions;

public class ToolInvocationException extends McpEvalsException {

    private final String toolName;

    public ToolInvocationException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolInvocationException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
