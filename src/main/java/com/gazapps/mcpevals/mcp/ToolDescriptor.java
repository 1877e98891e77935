package com.gazapps.mcpevals.mcp;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * Internal view of a tool advertised by a server: name, description and the
 * properties of its input schema.
 */
public final class ToolDescriptor {

    private final String name;
    private final String description;
    private final Map<String, Object> parameters;
    private final List<String> required;

    public ToolDescriptor(String name, String description) {
        this(name, description, null, null);
    }

    public ToolDescriptor(String name, String description, Map<String, Object> parameters, List<String> required) {
        this.name = Objects.requireNonNull(name, "Tool name cannot be null");
        this.description = description != null ? description : "";
        this.parameters = parameters != null ? Collections.unmodifiableMap(new HashMap<>(parameters)) : Collections.emptyMap();
        this.required = required != null ? List.copyOf(required) : Collections.emptyList();
    }

    public static ToolDescriptor fromMcp(Tool mcpTool) {
        Objects.requireNonNull(mcpTool, "MCP tool cannot be null");

        Map<String, Object> parameters = null;
        List<String> required = null;
        if (mcpTool.inputSchema() != null) {
            parameters = mcpTool.inputSchema().properties();
            required = mcpTool.inputSchema().required();
        }
        return new ToolDescriptor(mcpTool.name(), mcpTool.description(), parameters, required);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public Map<String, Object> getParameters() { return parameters; }
    public List<String> getRequired() { return required; }

    /**
     * One line for prompts: {@code - name: description}.
     */
    public String toPromptLine() {
        String text = description.isBlank() ? "No description available" : description;
        StringBuilder line = new StringBuilder("- ").append(name).append(": ").append(text);
        if (!parameters.isEmpty()) {
            line.append(" (parameters: ").append(String.join(", ", parameters.keySet())).append(")");
        }
        return line.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ToolDescriptor that = (ToolDescriptor) obj;
        return name.equals(that.name) && description.equals(that.description)
                && parameters.equals(that.parameters) && required.equals(that.required);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, parameters, required);
    }

    @Override
    public String toString() {
        return String.format("ToolDescriptor{name='%s', parameters=%d}", name, parameters.size());
    }
}
