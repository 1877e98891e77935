package com.gazapps.mcpevals.mcp;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazapps.mcpevals.exceptions.ToolInvocationException;

import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema.CallToolRequest;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.Content;
import io.modelcontextprotocol.spec.McpSchema.ListToolsResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;

/**
 * {@link McpConnection} over the official MCP Java SDK sync client.
 */
public class SdkMcpConnection implements McpConnection {

    private static final Logger logger = LoggerFactory.getLogger(SdkMcpConnection.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final McpSyncClient client;
    private final String serverName;

    public SdkMcpConnection(McpSyncClient client, String serverName) {
        this.client = client;
        this.serverName = serverName;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        ListToolsResult result = client.listTools();
        if (result == null || result.tools() == null) {
            return List.of();
        }
        return result.tools().stream()
            .map(ToolDescriptor::fromMcp)
            .toList();
    }

    @Override
    public ToolCallResult callTool(String toolName, Map<String, Object> arguments) {
        CallToolResult result;
        try {
            result = client.callTool(new CallToolRequest(toolName, arguments));
        } catch (RuntimeException e) {
            throw new ToolInvocationException(toolName, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }

        boolean isError = Boolean.TRUE.equals(result.isError());
        if (isError) {
            logger.warn("Tool {} on {} returned an error result", toolName, serverName);
        }
        return ToolCallResult.of(extractText(result.content()), toJson(result), isError);
    }

    private String extractText(List<Content> contentList) {
        if (contentList == null) {
            return null;
        }
        for (Content content : contentList) {
            if (content instanceof TextContent textContent
                    && textContent.text() != null && !textContent.text().isBlank()) {
                return textContent.text();
            }
        }
        return null;
    }

    private String toJson(CallToolResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.debug("Could not serialize tool result: {}", e.getMessage());
            return String.valueOf(result);
        }
    }

    @Override
    public void close() {
        try {
            if (!client.closeGracefully()) {
                client.close();
            }
        } finally {
            logger.info("🔌 {} disconnected", serverName);
        }
    }

    @Override
    public String toString() {
        return "SdkMcpConnection{" + serverName + "}";
    }
}
