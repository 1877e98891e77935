package com.gazapps.mcpevals.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

/**
 * Application settings from {@code config/application.properties}, with API keys
 * taken from the environment first. Also owns the programmatic Logback setup.
 */
public class Config {

    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final String CONFIG_FILE = "config/application.properties";
    private static final String BASE_PACKAGE = "com.gazapps.mcpevals";
    private static final String[] LLM_TYPES = {"openai", "anthropic", "azure-openai"};

    private static boolean loggingConfigured = false;

    private final Properties properties;

    public Config() {
        this.properties = new Properties();
        loadProperties();
    }

    public Config(Properties properties) {
        this.properties = properties;
    }

    private void loadProperties() {
        try {
            if (Files.exists(Paths.get(CONFIG_FILE))) {
                try (InputStream input = new FileInputStream(CONFIG_FILE)) {
                    properties.load(input);
                    logger.info("📋 Application properties loaded: {}", new File(CONFIG_FILE).getAbsolutePath());
                }
            } else {
                logger.debug("Configuration file not found: {}", CONFIG_FILE);
                createConfigFileIfNeeded();
            }
        } catch (IOException e) {
            logger.error("Error loading configuration: {}", e.getMessage());
        }
    }

    public void createConfigFileIfNeeded() {
        try {
            Path configPath = Paths.get(CONFIG_FILE);
            if (!Files.exists(configPath)) {
                Files.createDirectories(configPath.getParent());
                createDefaultApplicationProperties();
                logger.info("✅ Default application.properties created");
            }
        } catch (IOException e) {
            logger.error("Error creating config file: {}", e.getMessage());
        }
    }

    public Map<String, String> getOpenAiConfig() {
        Map<String, String> openAiConfig = new HashMap<>();
        openAiConfig.put("baseUrl", getProperty("openai.base.url", "https://api.openai.com/v1/chat/completions"));
        openAiConfig.put("timeout", getProperty("openai.timeout", "60"));
        openAiConfig.put("apiKey", getEnvironmentOrProperty("OPENAI_API_KEY", "openai.api.key"));
        return openAiConfig;
    }

    public Map<String, String> getClaudeConfig() {
        Map<String, String> claudeConfig = new HashMap<>();
        claudeConfig.put("baseUrl", getProperty("anthropic.base.url", "https://api.anthropic.com/v1/messages"));
        claudeConfig.put("version", getProperty("anthropic.version", "2023-06-01"));
        claudeConfig.put("timeout", getProperty("anthropic.timeout", "60"));
        claudeConfig.put("apiKey", getEnvironmentOrProperty("ANTHROPIC_API_KEY", "anthropic.api.key"));
        return claudeConfig;
    }

    public Map<String, String> getAzureOpenAiConfig() {
        Map<String, String> azureConfig = new HashMap<>();
        azureConfig.put("baseUrl", getEnvironmentOrProperty("AZURE_OPENAI_ENDPOINT", "azure.openai.endpoint"));
        azureConfig.put("apiVersion", getProperty("azure.openai.api.version", "2024-06-01"));
        azureConfig.put("timeout", getProperty("azure.openai.timeout", "60"));
        azureConfig.put("apiKey", getEnvironmentOrProperty("AZURE_OPENAI_API_KEY", "azure.openai.api.key"));
        return azureConfig;
    }

    public Map<String, String> getProviderConfig(String provider) {
        return switch (provider.toLowerCase()) {
            case "openai" -> getOpenAiConfig();
            case "anthropic", "claude" -> getClaudeConfig();
            case "azure-openai", "azure" -> getAzureOpenAiConfig();
            default -> new HashMap<>();
        };
    }

    public boolean isLlmConfigValid(String provider) {
        String apiKey = getProviderConfig(provider).get("apiKey");
        boolean isValid = apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");

        if (!isValid) {
            logger.warn("❌ Invalid configuration for {}: API key not configured", provider);
        }

        return isValid;
    }

    public int getDefaultParallelism() {
        int configured = Integer.parseInt(getProperty("evaluation.parallelism", "0"));
        return configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
    }

    public String getDefaultFormat() {
        return getProperty("report.format", "clean");
    }

    private String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private String getEnvironmentOrProperty(String envKey, String propKey) {
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String systemPropValue = System.getProperty(envKey);
        if (systemPropValue != null && !systemPropValue.isEmpty()) {
            return systemPropValue;
        }

        String propValue = properties.getProperty(propKey);
        if (propValue != null && !propValue.startsWith("${")) {
            return propValue;
        }

        return "";
    }

    private void createDefaultApplicationProperties() throws IOException {
        String defaultContent = """
                # MCP Evals Application Configuration
                app.name=mcp-evals
                app.version=0.0.1

                # Evaluation defaults (0 = number of processors)
                evaluation.parallelism=0
                report.format=clean

                # OpenAI
                openai.base.url=https://api.openai.com/v1/chat/completions
                openai.timeout=60
                openai.api.key=

                # Anthropic
                anthropic.base.url=https://api.anthropic.com/v1/messages
                anthropic.version=2023-06-01
                anthropic.timeout=60
                anthropic.api.key=

                # Azure OpenAI
                azure.openai.endpoint=
                azure.openai.api.version=2024-06-01
                azure.openai.timeout=60
                azure.openai.api.key=

                # Conversation logs per provider
                logging.llm.openai.conversations.enabled=true
                logging.llm.anthropic.conversations.enabled=true
                logging.llm.azure-openai.conversations.enabled=true
                """;

        try (FileWriter writer = new FileWriter(CONFIG_FILE)) {
            writer.write(defaultContent);
        }
    }

    /**
     * Replaces the default Logback setup: rolling files under {@code log/} and a
     * console appender that only shows warnings unless {@code verbose}.
     */
    public void setupProgrammaticLogging(boolean verbose) {
        if (loggingConfigured) return;

        try {
            LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
            loggerContext.reset();

            createLogDirectories();

            RollingFileAppender<ILoggingEvent> appAppender =
                setupFileAppender(loggerContext, "APPLICATION", "log/application.log",
                                  "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");

            RollingFileAppender<ILoggingEvent> errorAppender =
                setupFileAppender(loggerContext, "ERROR", "log/errors.log",
                                  "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
            ThresholdFilter errorFilter = new ThresholdFilter();
            errorFilter.setLevel("ERROR");
            errorFilter.start();
            errorAppender.addFilter(errorFilter);

            RollingFileAppender<ILoggingEvent> mcpAppender =
                setupFileAppender(loggerContext, "MCP", "log/mcp-operations.log",
                                  "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");

            ConsoleAppender<ILoggingEvent> consoleAppender = setupConsoleAppender(loggerContext, verbose);

            ch.qos.logback.classic.Logger mcpLogger = loggerContext.getLogger(BASE_PACKAGE + ".mcp");
            mcpLogger.setLevel(Level.DEBUG);
            mcpLogger.addAppender(mcpAppender);

            ch.qos.logback.classic.Logger appLogger = loggerContext.getLogger(BASE_PACKAGE);
            appLogger.setLevel(Level.DEBUG);

            // SDK and HTTP client internals are noisy at DEBUG
            loggerContext.getLogger("io.modelcontextprotocol").setLevel(verbose ? Level.DEBUG : Level.INFO);
            loggerContext.getLogger("reactor").setLevel(Level.WARN);

            ch.qos.logback.classic.Logger rootLogger = loggerContext.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(Level.INFO);
            rootLogger.addAppender(appAppender);
            rootLogger.addAppender(errorAppender);
            rootLogger.addAppender(consoleAppender);

            setupConversationAppenders(loggerContext);

            loggingConfigured = true;
        } catch (Exception e) {
            System.err.println("Failed to setup programmatic logging: " + e.getMessage());
        }
    }

    private void createLogDirectories() {
        for (String dir : new String[]{"log", "log/llm", "log/servers"}) {
            File directory = new File(dir);
            if (!directory.exists()) {
                directory.mkdirs();
            }
        }
    }

    private void setupConversationAppenders(LoggerContext loggerContext) {
        for (String type : LLM_TYPES) {
            String enabledKey = "logging.llm." + type + ".conversations.enabled";
            String fileKey = "logging.llm." + type + ".conversations.file";
            String patternKey = "logging.llm." + type + ".conversations.pattern";

            if (!Boolean.parseBoolean(properties.getProperty(enabledKey, "true"))) {
                continue;
            }

            String filename = properties.getProperty(fileKey, "log/llm/" + type + "-conversations.log");
            String pattern = properties.getProperty(patternKey, "%d{HH:mm:ss} [%thread] %msg%n");

            RollingFileAppender<ILoggingEvent> appender =
                setupFileAppender(loggerContext, "LLM_CONV_" + type.toUpperCase(), filename, pattern);

            ch.qos.logback.classic.Logger llmLogger = loggerContext.getLogger("llm.conversation." + type);
            llmLogger.setLevel(Level.INFO);
            llmLogger.setAdditive(false);
            llmLogger.addAppender(appender);
        }
    }

    private ConsoleAppender<ILoggingEvent> setupConsoleAppender(LoggerContext loggerContext, boolean verbose) {
        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(loggerContext);
        consoleAppender.setName("CONSOLE");
        consoleAppender.setTarget("System.err");

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern("%-5level %logger{0} - %msg%n");
        encoder.start();
        consoleAppender.setEncoder(encoder);

        ThresholdFilter filter = new ThresholdFilter();
        filter.setLevel(verbose ? "DEBUG" : "WARN");
        filter.start();
        consoleAppender.addFilter(filter);

        consoleAppender.start();
        return consoleAppender;
    }

    private RollingFileAppender<ILoggingEvent> setupFileAppender(
            LoggerContext loggerContext, String name, String filename, String pattern) {

        RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
        fileAppender.setContext(loggerContext);
        fileAppender.setName(name);
        fileAppender.setFile(filename);

        SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(loggerContext);
        rollingPolicy.setParent(fileAppender);
        rollingPolicy.setFileNamePattern(filename.replace(".log", ".%d{yyyy-MM-dd}.%i.log"));
        rollingPolicy.setMaxFileSize(FileSize.valueOf("10MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.start();

        fileAppender.setRollingPolicy(rollingPolicy);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(pattern);
        encoder.start();

        fileAppender.setEncoder(encoder);
        fileAppender.start();

        return fileAppender;
    }

    /**
     * Logger for the request/response transcript of one provider.
     */
    public static Logger getLlmConversationLogger(String llmType) {
        return LoggerFactory.getLogger("llm.conversation." + llmType.toLowerCase());
    }
}
