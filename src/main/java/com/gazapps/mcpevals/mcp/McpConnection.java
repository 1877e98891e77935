package com.gazapps.mcpevals.mcp;

import java.util.List;
import java.util.Map;

/**
 * A live, initialized protocol client for one server.
 */
public interface McpConnection extends AutoCloseable {

    List<ToolDescriptor> listTools();

    /**
     * Invokes a tool. Protocol and transport failures surface as
     * {@link com.gazapps.mcpevals.exceptions.ToolInvocationException}; a result flagged
     * as an error by the server is returned, not thrown.
     */
    ToolCallResult callTool(String toolName, Map<String, Object> arguments);

    @Override
    void close();
}
