package com.gazapps.mcpevals.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gazapps.mcpevals.exceptions.ConfigException;
import com.gazapps.mcpevals.model.EvaluationConfiguration;
import com.gazapps.mcpevals.model.EvaluationRequest;
import com.gazapps.mcpevals.model.ModelConfiguration;
import com.gazapps.mcpevals.model.ServerConfiguration;

/**
 * Reads an evaluation suite from a {@code .yaml}, {@code .yml} or {@code .json} file
 * and fills in the defaults the file may leave out.
 */
public class EvaluationConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationConfigLoader.class);

    static final String DEFAULT_EVALUATION_NAME = "Unnamed Evaluation";
    static final String DEFAULT_EVALUATION_DESCRIPTION = "No description provided";
    static final List<String> DEFAULT_SERVER_FILES = List.of("index.ts", "index.js", "server.ts", "server.js", "main.py");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public boolean canHandle(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    public EvaluationConfiguration load(Path file) throws ConfigException {
        String filePath = file.toString();
        if (!Files.isRegularFile(file)) {
            throw new ConfigException(filePath, "Configuration file not found: " + filePath, null);
        }
        if (!canHandle(file)) {
            throw new ConfigException(filePath, "Unsupported configuration format (expected .yaml, .yml or .json): " + filePath, null);
        }

        logger.debug("Loading configuration from {}", filePath);
        EvaluationConfiguration config;
        try {
            config = mapperFor(file).readValue(file.toFile(), EvaluationConfiguration.class);
        } catch (IOException e) {
            throw new ConfigException(filePath, "Failed to parse configuration: " + e.getMessage(), e);
        }

        if (config == null || config.evals == null || config.evals.isEmpty()) {
            throw new ConfigException(filePath, "No evaluations found in configuration", null);
        }

        Path baseDir = file.toAbsolutePath().getParent();
        applyModelDefaults(config);
        applyEvaluationDefaults(config, filePath);
        config.server = resolveServer(config.server, baseDir, filePath);

        logger.info("📋 Loaded {} evaluation(s) from {}", config.evals.size(), filePath);
        return config;
    }

    private ObjectMapper mapperFor(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
    }

    private void applyModelDefaults(EvaluationConfiguration config) {
        if (config.model == null) {
            config.model = new ModelConfiguration();
            return;
        }
        if (isBlank(config.model.provider)) {
            config.model.provider = ModelConfiguration.DEFAULT_PROVIDER;
        }
        if (isBlank(config.model.name)) {
            config.model.name = ModelConfiguration.DEFAULT_NAME;
        }
    }

    private void applyEvaluationDefaults(EvaluationConfiguration config, String filePath) throws ConfigException {
        for (int i = 0; i < config.evals.size(); i++) {
            EvaluationRequest request = config.evals.get(i);
            if (request == null || isBlank(request.prompt)) {
                throw new ConfigException(filePath, "Prompt is required (evaluation #" + (i + 1) + ")", null);
            }
            if (isBlank(request.name)) {
                request.name = DEFAULT_EVALUATION_NAME;
            }
            if (isBlank(request.description)) {
                request.description = DEFAULT_EVALUATION_DESCRIPTION;
            }
        }
    }

    /**
     * Relative paths are taken from the configuration file's directory. Without a path or
     * url, a conventional server file next to the configuration is used over stdio.
     */
    private ServerConfiguration resolveServer(ServerConfiguration server, Path baseDir, String filePath)
            throws ConfigException {
        ServerConfiguration resolved = server != null ? server : new ServerConfiguration();

        if (resolved.hasPath()) {
            Path path = Path.of(resolved.path);
            if (!path.isAbsolute() && baseDir != null) {
                resolved.path = baseDir.resolve(path).normalize().toString();
            }
            return resolved;
        }

        if (!resolved.hasUrl()) {
            Path discovered = discoverServerFile(baseDir);
            if (discovered == null) {
                throw new ConfigException(filePath, "No server path specified and no default server file found", null);
            }
            logger.info("🔎 Using server file found next to configuration: {}", discovered);
            resolved.path = discovered.toString();
        }
        return resolved;
    }

    static Path discoverServerFile(Path directory) {
        if (directory == null) {
            return null;
        }
        for (String candidate : DEFAULT_SERVER_FILES) {
            Path path = directory.resolve(candidate);
            if (Files.isRegularFile(path)) {
                return path;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
