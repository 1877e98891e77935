package com.gazapps.mcpevals.llm.providers;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gazapps.mcpevals.llm.LlmProvider;
import com.gazapps.mcpevals.llm.LlmRequest;

/**
 * OpenAI chat completions API.
 */
public class OpenAi extends HttpLanguageModel {

    private final String baseUrl;

    public OpenAi(Map<String, String> settings, String model) {
        this(settings.get("baseUrl"), settings.get("apiKey"), model,
             Integer.parseInt(settings.getOrDefault("timeout", "60")), null);
    }

    public OpenAi(String baseUrl, String apiKey, String model, int timeoutSeconds, HttpClient httpClient) {
        this(LlmProvider.OPENAI, baseUrl, apiKey, model, timeoutSeconds, httpClient);
    }

    protected OpenAi(LlmProvider provider, String baseUrl, String apiKey, String model, int timeoutSeconds, HttpClient httpClient) {
        super(provider, model, apiKey, timeoutSeconds, httpClient);
        this.baseUrl = baseUrl;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OPENAI;
    }

    @Override
    protected URI endpoint() {
        return URI.create(baseUrl);
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected Object buildBody(LlmRequest request) {
        return new ChatRequest(model, request);
    }

    @Override
    protected String parseContent(String responseBody) throws IOException {
        ChatResponse response = objectMapper.readValue(responseBody, ChatResponse.class);
        if (response.choices == null || response.choices.length == 0
                || response.choices[0].message == null || response.choices[0].message.content == null) {
            throw new IOException("No response from " + getProvider().name());
        }
        return response.choices[0].message.content;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class ChatRequest {
        public String model;
        public List<Message> messages = new ArrayList<>();
        public Double temperature;
        @JsonProperty("max_tokens")
        public Integer maxTokens;
        @JsonProperty("response_format")
        public Map<String, String> responseFormat;

        ChatRequest(String model, LlmRequest request) {
            this.model = model;
            if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
                messages.add(new Message("system", request.getSystemPrompt()));
            }
            messages.add(new Message("user", request.getUserPrompt()));
            this.temperature = request.getTemperature();
            this.maxTokens = request.getMaxTokens() > 0 ? request.getMaxTokens() : null;
            this.responseFormat = request.isJsonObject() ? Map.of("type", "json_object") : null;
        }
    }

    static class Message {
        public String role;
        public String content;

        Message(String role, String content) {
            this.role = role;
            this.content = content;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatResponse {
        public Choice[] choices;

        @JsonIgnoreProperties(ignoreUnknown = true)
        static class Choice {
            public ResponseMessage message;
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        static class ResponseMessage {
            public String role;
            public String content;
        }
    }
}
