package com.gazapps.mcpevals.llm.providers;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.gazapps.mcpevals.llm.LlmProvider;
import com.gazapps.mcpevals.llm.LlmRequest;

/**
 * Azure OpenAI deployment. The model name is the deployment name; authentication
 * uses the {@code api-key} header.
 */
public class AzureOpenAi extends OpenAi {

    private final String resourceEndpoint;
    private final String apiVersion;

    public AzureOpenAi(Map<String, String> settings, String deployment) {
        this(settings.get("baseUrl"), settings.get("apiKey"), deployment,
             settings.getOrDefault("apiVersion", "2024-06-01"),
             Integer.parseInt(settings.getOrDefault("timeout", "60")), null);
    }

    public AzureOpenAi(String resourceEndpoint, String apiKey, String deployment, String apiVersion,
            int timeoutSeconds, HttpClient httpClient) {
        super(LlmProvider.AZURE_OPENAI, resourceEndpoint, apiKey, deployment, timeoutSeconds, httpClient);
        this.resourceEndpoint = resourceEndpoint;
        this.apiVersion = apiVersion;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.AZURE_OPENAI;
    }

    @Override
    protected URI endpoint() {
        String base = resourceEndpoint.endsWith("/")
                ? resourceEndpoint.substring(0, resourceEndpoint.length() - 1)
                : resourceEndpoint;
        return URI.create(base + "/openai/deployments/" + URLEncoder.encode(model, StandardCharsets.UTF_8)
                + "/chat/completions?api-version=" + apiVersion);
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("api-key", apiKey);
    }

    @Override
    protected Object buildBody(LlmRequest request) {
        // deployment already selects the model
        return new ChatRequest(null, request);
    }
}
