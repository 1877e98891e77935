package com.gazapps.mcpevals.exceptions;

import com.gazapps.mcpevals.llm.LlmException;

/**
 * Handler for converting technical exceptions to one-line messages for the console
 */
public class ErrorMessageHandler {

    private ErrorMessageHandler() {
    }

    public static String getUserFriendlyMessage(Exception e) {
        if (e instanceof LlmException) {
            LlmException llmEx = (LlmException) e;
            return String.format("🤖 Issue with %s (%s): %s\n💡 Check the API key and endpoint, then try again.",
                                llmEx.getProvider() != null ? llmEx.getProvider().getConfigName() : "language model",
                                llmEx.getErrorType().getDescription(),
                                getFirstLine(e.getMessage()));
        }

        if (e instanceof ConfigException) {
            ConfigException configEx = (ConfigException) e;
            return String.format("⚙️ Configuration issue%s: %s\n💡 Please check your evaluation file.",
                                configEx.getFilePath() != null ? " in " + configEx.getFilePath() : "",
                                getFirstLine(e.getMessage()));
        }

        if (e instanceof InvalidConfigurationException) {
            return String.format("⚙️ Invalid server configuration: %s", getFirstLine(e.getMessage()));
        }

        if (e instanceof ServerStartException) {
            return String.format("🚀 Server could not be started: %s\n💡 See log/servers for the server output.",
                                getFirstLine(e.getMessage()));
        }

        if (e instanceof ConnectionException) {
            ConnectionException connEx = (ConnectionException) e;
            return String.format("🔌 Could not connect to '%s': %s",
                                connEx.getServerName(), getFirstLine(e.getMessage()));
        }

        if (e instanceof McpEvalsException) {
            return String.format("❌ Evaluation error: %s", getFirstLine(e.getMessage()));
        }

        // Common network exceptions
        if (e instanceof java.net.SocketTimeoutException) {
            return "⏱️ Connection timeout. Please try again in a few seconds.";
        }

        if (e instanceof java.net.ConnectException) {
            return "🌐 Connectivity issue. Please check your network connection.";
        }

        if (e instanceof java.io.IOException) {
            return String.format("📡 I/O problem: %s", getFirstLine(e.getMessage()));
        }

        return String.format("❌ Unexpected error: %s", getFirstLine(e.getMessage()));
    }

    /**
     * First line of a message, so stack-trace-like details stay in the log files
     */
    private static String getFirstLine(String technicalMessage) {
        if (technicalMessage == null || technicalMessage.isEmpty()) {
            return "unknown error";
        }
        return technicalMessage.split("\n")[0];
    }
}
