package com.gazapps.mcpevals.llm;

import java.util.HashMap;
import java.util.Map;

import com.gazapps.mcpevals.config.Config;
import com.gazapps.mcpevals.llm.providers.AzureOpenAi;
import com.gazapps.mcpevals.llm.providers.Claude;
import com.gazapps.mcpevals.llm.providers.OpenAi;
import com.gazapps.mcpevals.model.ModelConfiguration;

/**
 * Builds the {@link LanguageModel} for a suite. Explicit values (command line or suite
 * file) win over the application properties and environment.
 */
public class LlmBuilder {

    private LlmProvider provider;
    private String apiKey;
    private String model;
    private String endpoint;
    private Config config;

    private LlmBuilder() {}

    public static LlmBuilder create() {
        return new LlmBuilder();
    }

    public static LlmBuilder from(ModelConfiguration modelConfig) {
        return create()
            .provider(LlmProvider.fromName(modelConfig.provider))
            .model(modelConfig.name)
            .apiKey(modelConfig.apiKey)
            .endpoint(modelConfig.endpoint);
    }

    public LlmBuilder provider(LlmProvider provider) {
        this.provider = provider;
        return this;
    }

    public LlmBuilder apiKey(String apiKey) {
        if (!isBlank(apiKey)) {
            this.apiKey = apiKey;
        }
        return this;
    }

    public LlmBuilder model(String model) {
        this.model = model;
        return this;
    }

    public LlmBuilder endpoint(String endpoint) {
        if (!isBlank(endpoint)) {
            this.endpoint = endpoint;
        }
        return this;
    }

    public LlmBuilder config(Config config) {
        this.config = config;
        return this;
    }

    public LanguageModel build() {
        if (provider == null) {
            throw new LlmException(null, LlmException.ErrorType.INVALID_REQUEST, "Provider is required");
        }
        if (isBlank(model)) {
            throw new LlmException(provider, LlmException.ErrorType.INVALID_REQUEST, "Model name is required");
        }

        Map<String, String> settings = new HashMap<>(
            (config != null ? config : new Config()).getProviderConfig(provider.getConfigName()));
        if (apiKey != null) {
            settings.put("apiKey", apiKey);
        }
        if (endpoint != null) {
            settings.put("baseUrl", endpoint);
        }

        if (isBlank(settings.get("apiKey"))) {
            throw new LlmException(provider, LlmException.ErrorType.AUTHENTICATION,
                                 "API key is required for " + provider.getConfigName());
        }

        return switch (provider) {
            case OPENAI -> new OpenAi(settings, model);
            case ANTHROPIC -> new Claude(settings, model);
            case AZURE_OPENAI -> {
                if (isBlank(settings.get("baseUrl"))) {
                    throw new LlmException(provider, LlmException.ErrorType.INVALID_REQUEST,
                                         "Azure OpenAI endpoint is required (AZURE_OPENAI_ENDPOINT or --endpoint)");
                }
                yield new AzureOpenAi(settings, model);
            }
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return String.format("LlmBuilder{provider='%s', model='%s', endpoint=%s, apiKey=%s}",
                provider, model, endpoint, apiKey != null ? "***" : "null");
    }
}
