package com.gazapps.mcpevals.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single planned tool call. Argument values are strings, numbers, booleans or null.
 */
public final class ToolExecution {

    private final String toolName;
    private final Map<String, Object> arguments;

    public ToolExecution(String toolName, Map<String, Object> arguments) {
        this.toolName = Objects.requireNonNull(toolName, "Tool name cannot be null");
        this.arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Collections.emptyMap();
    }

    public String getToolName() { return toolName; }
    public Map<String, Object> getArguments() { return arguments; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ToolExecution that = (ToolExecution) obj;
        return toolName.equals(that.toolName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(toolName, arguments);
    }

    @Override
    public String toString() {
        return String.format("ToolExecution{tool='%s', arguments=%s}", toolName, arguments);
    }
}
