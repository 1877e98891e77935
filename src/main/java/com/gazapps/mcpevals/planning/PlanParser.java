package com.gazapps.mcpevals.planning;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazapps.mcpevals.model.ToolExecution;

/**
 * Reads a language model's tool plan. Accepts a single {@code {toolName, arguments}}
 * object, an object with a {@code tools} array, or a bare array. Anything else is an
 * empty plan.
 */
class PlanParser {

    private static final Logger logger = LoggerFactory.getLogger(PlanParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    List<ToolExecution> parse(String response) {
        if (response == null || response.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(response));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse tool plan: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null) {
            return List.of();
        }

        if (root.isArray()) {
            return readAll(root);
        }
        if (root.isObject() && root.path("tools").isArray()) {
            return readAll(root.get("tools"));
        }
        if (root.isObject()) {
            ToolExecution execution = read(root);
            return execution != null ? List.of(execution) : List.of();
        }
        return List.of();
    }

    private List<ToolExecution> readAll(JsonNode array) {
        List<ToolExecution> executions = new ArrayList<>();
        for (JsonNode item : array) {
            ToolExecution execution = read(item);
            if (execution != null) {
                executions.add(execution);
            }
        }
        return executions;
    }

    private ToolExecution read(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        JsonNode toolName = node.get("toolName");
        if (toolName == null || !toolName.isTextual() || toolName.asText().isBlank()) {
            return null;
        }

        Map<String, Object> arguments = new LinkedHashMap<>();
        JsonNode args = node.get("arguments");
        if (args != null && args.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = args.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                arguments.put(field.getKey(), toValue(field.getValue()));
            }
        }
        return new ToolExecution(toolName.asText(), arguments);
    }

    /**
     * Scalars keep their type; objects and arrays are passed on as raw JSON text.
     */
    static Object toValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToInt() ? (Object) value.intValue() : (Object) value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return value.toString();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            trimmed = firstNewline >= 0 ? trimmed.substring(firstNewline + 1) : trimmed.substring(3);
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3);
            }
        }
        return trimmed.trim();
    }
}
