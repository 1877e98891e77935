package com.gazapps.mcpevals.llm;

import java.util.Arrays;
import java.util.Locale;

public enum LlmProvider {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    AZURE_OPENAI("azure-openai");

    private final String configName;

    LlmProvider(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static LlmProvider fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "openai" -> OPENAI;
            case "anthropic", "claude" -> ANTHROPIC;
            case "azure-openai", "azure", "azureopenai" -> AZURE_OPENAI;
            default -> throw new IllegalArgumentException("Unknown provider '" + name + "'. Supported: "
                    + Arrays.toString(Arrays.stream(values()).map(LlmProvider::getConfigName).toArray()));
        };
    }
}
