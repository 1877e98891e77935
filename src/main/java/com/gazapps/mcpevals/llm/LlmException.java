package com.gazapps.mcpevals.llm;

/**
 * Base exception for every language model failure, independent of the provider.
 */
public class LlmException extends RuntimeException {

    private final LlmProvider provider;
    private final ErrorType errorType;

    public enum ErrorType {
        COMMUNICATION("Communication error with the language model"),
        RATE_LIMIT("Rate limit reached"),
        TIMEOUT("Request timed out"),
        INVALID_REQUEST("Invalid request"),
        AUTHENTICATION("Authentication error"),
        UNKNOWN("Unknown error");

        private final String description;

        ErrorType(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    public LlmException(LlmProvider provider, ErrorType errorType, String message) {
        super(message);
        this.provider = provider;
        this.errorType = errorType;
    }

    public LlmException(LlmProvider provider, ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.errorType = errorType;
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public String toString() {
        return String.format("LlmException{provider='%s', type=%s, message='%s'}",
                           provider, errorType, getMessage());
    }
}
