package com.gazapps.mcpevals.llm;

import java.util.Objects;

/**
 * A single-turn chat request: system instructions plus one user message.
 */
public final class LlmRequest {

    private final String systemPrompt;
    private final String userPrompt;
    private final double temperature;
    private final int maxTokens;
    private final boolean jsonObject;

    private LlmRequest(String systemPrompt, String userPrompt, double temperature, int maxTokens, boolean jsonObject) {
        this.systemPrompt = systemPrompt;
        this.userPrompt = Objects.requireNonNull(userPrompt, "User prompt cannot be null");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.jsonObject = jsonObject;
    }

    public static LlmRequest of(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        return new LlmRequest(systemPrompt, userPrompt, temperature, maxTokens, false);
    }

    /**
     * Same request, asking the provider to answer with a JSON object.
     */
    public LlmRequest asJson() {
        return new LlmRequest(systemPrompt, userPrompt, temperature, maxTokens, true);
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt() { return userPrompt; }
    public double getTemperature() { return temperature; }
    public int getMaxTokens() { return maxTokens; }
    public boolean isJsonObject() { return jsonObject; }

    @Override
    public String toString() {
        return String.format("LlmRequest{temperature=%.2f, maxTokens=%d, json=%b, prompt=%d chars}",
                temperature, maxTokens, jsonObject, userPrompt.length());
    }
}
