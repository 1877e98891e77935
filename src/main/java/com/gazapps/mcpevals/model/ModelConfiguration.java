package com.gazapps.mcpevals.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelConfiguration {

    public static final String DEFAULT_PROVIDER = "openai";
    public static final String DEFAULT_NAME = "gpt-4o";

    public String provider = DEFAULT_PROVIDER;
    @JsonAlias("modelName")
    public String name = DEFAULT_NAME;
    @JsonAlias("api_key")
    public String apiKey;
    @JsonAlias({"baseUrl", "base_url"})
    public String endpoint;
    @JsonAlias("max_tokens")
    public int maxTokens = 4000;
    public double temperature = 0.1;

    public ModelConfiguration() {
    }

    public ModelConfiguration(String provider, String name) {
        this.provider = provider;
        this.name = name;
    }

    @Override
    public String toString() {
        return String.format("ModelConfiguration{provider=%s, name=%s, maxTokens=%d, temperature=%.2f, apiKey=%s}",
                provider, name, maxTokens, temperature, apiKey != null ? "***" : "null");
    }
}
