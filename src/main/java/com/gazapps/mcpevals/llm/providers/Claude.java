package com.gazapps.mcpevals.llm.providers;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gazapps.mcpevals.llm.LlmProvider;
import com.gazapps.mcpevals.llm.LlmRequest;

/**
 * Anthropic messages API. JSON output is requested through the system prompt,
 * the API has no response format switch.
 */
public class Claude extends HttpLanguageModel {

    private static final String JSON_INSTRUCTION =
        "\n\nRespond with a single valid JSON object and nothing else.";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    private final String baseUrl;
    private final String version;

    public Claude(Map<String, String> settings, String model) {
        this(settings.get("baseUrl"), settings.get("apiKey"), model,
             settings.getOrDefault("version", "2023-06-01"),
             Integer.parseInt(settings.getOrDefault("timeout", "60")), null);
    }

    public Claude(String baseUrl, String apiKey, String model, String version, int timeoutSeconds, HttpClient httpClient) {
        super(LlmProvider.ANTHROPIC, model, apiKey, timeoutSeconds, httpClient);
        this.baseUrl = baseUrl;
        this.version = version;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.ANTHROPIC;
    }

    @Override
    protected URI endpoint() {
        return URI.create(baseUrl);
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("x-api-key", apiKey, "anthropic-version", version);
    }

    @Override
    protected Object buildBody(LlmRequest request) {
        return new ClaudeRequest(model, request);
    }

    @Override
    protected String parseContent(String responseBody) throws IOException {
        ClaudeResponse response = objectMapper.readValue(responseBody, ClaudeResponse.class);
        if (response.content == null || response.content.length == 0) {
            throw new IOException("No response from Claude");
        }

        // Claude may return several content blocks
        StringBuilder text = new StringBuilder();
        for (ClaudeResponse.Content content : response.content) {
            if ("text".equals(content.type) && content.text != null) {
                text.append(content.text);
            }
        }
        return text.toString();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private static class ClaudeRequest {
        public String model;
        @JsonProperty("max_tokens")
        public int maxTokens;
        public String system;
        public Message[] messages;
        public Double temperature;

        ClaudeRequest(String model, LlmRequest request) {
            this.model = model;
            this.maxTokens = request.getMaxTokens() > 0 ? request.getMaxTokens() : DEFAULT_MAX_TOKENS;
            String systemPrompt = request.getSystemPrompt() != null ? request.getSystemPrompt() : "";
            if (request.isJsonObject()) {
                systemPrompt += JSON_INSTRUCTION;
            }
            this.system = systemPrompt.isBlank() ? null : systemPrompt;
            this.messages = new Message[]{new Message("user", request.getUserPrompt())};
            this.temperature = request.getTemperature();
        }

        private static class Message {
            public String role;
            public String content;

            Message(String role, String content) {
                this.role = role;
                this.content = content;
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ClaudeResponse {
        public String id;
        public Content[] content;
        @JsonProperty("stop_reason")
        public String stopReason;

        @JsonIgnoreProperties(ignoreUnknown = true)
        private static class Content {
            public String type;
            public String text;
        }
    }
}
