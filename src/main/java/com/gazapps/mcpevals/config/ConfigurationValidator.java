package com.gazapps.mcpevals.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.gazapps.mcpevals.mcp.transport.TransportResolver;
import com.gazapps.mcpevals.model.EvaluationConfiguration;
import com.gazapps.mcpevals.model.EvaluationRequest;
import com.gazapps.mcpevals.model.ModelConfiguration;
import com.gazapps.mcpevals.model.ServerConfiguration;

/**
 * Checks a loaded suite and reports every problem found, one message each.
 * An empty list means the suite is valid.
 */
public class ConfigurationValidator {

    private static final Set<String> VALID_PROVIDERS = Set.of("openai", "anthropic", "azure-openai");
    private static final Set<String> VALID_TRANSPORTS = Set.of(TransportResolver.STDIO, TransportResolver.HTTP);

    static final int MAX_TOKENS_LIMIT = 100_000;
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_PROMPT_LENGTH = 10_000;
    static final int MAX_TIMEOUT_SECONDS = 600;

    private final TransportResolver transportResolver;

    public ConfigurationValidator() {
        this(new TransportResolver());
    }

    public ConfigurationValidator(TransportResolver transportResolver) {
        this.transportResolver = transportResolver;
    }

    public List<String> validate(EvaluationConfiguration config) {
        List<String> errors = new ArrayList<>();

        if (config.model == null) {
            errors.add("Language model configuration is required");
        } else {
            validateModel(config.model, errors);
        }

        if (config.server == null) {
            errors.add("Server configuration is required");
        } else {
            validateServer(config.server, errors);
        }

        if (config.evals == null || config.evals.isEmpty()) {
            errors.add("At least one evaluation is required");
        } else {
            for (int i = 0; i < config.evals.size(); i++) {
                validateEvaluation(i + 1, config.evals.get(i), errors);
            }
        }
        return errors;
    }

    private void validateModel(ModelConfiguration model, List<String> errors) {
        if (isBlank(model.provider)) {
            errors.add("Provider is required");
        } else if (!VALID_PROVIDERS.contains(model.provider.toLowerCase(Locale.ROOT))) {
            errors.add("Provider must be one of: openai, anthropic, azure-openai");
        }
        if (isBlank(model.name)) {
            errors.add("Model name is required");
        }
        if (model.maxTokens <= 0) {
            errors.add("MaxTokens must be greater than 0");
        } else if (model.maxTokens > MAX_TOKENS_LIMIT) {
            errors.add("MaxTokens must not exceed " + MAX_TOKENS_LIMIT);
        }
        if (model.temperature < 0.0 || model.temperature > 2.0) {
            errors.add("Temperature must be between 0.0 and 2.0");
        }
    }

    private void validateServer(ServerConfiguration server, List<String> errors) {
        if (!isBlank(server.transport) && !VALID_TRANSPORTS.contains(server.transport.toLowerCase(Locale.ROOT))) {
            errors.add("Transport must be one of: stdio, http");
            return;
        }

        String transport = transportResolver.resolveTransport(server);
        if (TransportResolver.STDIO.equals(transport) && !server.hasPath()) {
            errors.add("Server path is required for stdio transport");
        }
        if (TransportResolver.HTTP.equals(transport) && !server.hasUrl()) {
            errors.add("Url is required for http transport");
        }
        if (server.hasUrl() && !isHttpUrl(server.url)) {
            errors.add("Url must be a valid HTTP or HTTPS URL");
        }
        if (server.hasPath() && !pathExists(server.path)) {
            errors.add("Server file not found: " + server.path);
        }
        if (server.timeout <= 0 || server.timeout > MAX_TIMEOUT_SECONDS) {
            errors.add("Timeout must be between 1 and " + MAX_TIMEOUT_SECONDS + " seconds");
        }
    }

    private void validateEvaluation(int index, EvaluationRequest request, List<String> errors) {
        String prefix = "Evaluation #" + index + ": ";
        if (request == null) {
            errors.add(prefix + "entry is empty");
            return;
        }
        checkText(prefix + "name", request.name, MAX_NAME_LENGTH, errors);
        checkText(prefix + "description", request.description, MAX_DESCRIPTION_LENGTH, errors);
        checkText(prefix + "prompt", request.prompt, MAX_PROMPT_LENGTH, errors);
    }

    private static void checkText(String field, String value, int maxLength, List<String> errors) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        } else if (value.length() > maxLength) {
            errors.add(field + " must not exceed " + maxLength + " characters");
        }
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
            return uri.isAbsolute() && uri.getHost() != null && (scheme.equals("http") || scheme.equals("https"));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean pathExists(String path) {
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
