package com.gazapps.mcpevals.llm.providers;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazapps.mcpevals.config.Config;
import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.llm.LanguageModel;
import com.gazapps.mcpevals.llm.LlmException;
import com.gazapps.mcpevals.llm.LlmProvider;
import com.gazapps.mcpevals.llm.LlmRequest;

/**
 * Shared plumbing for JSON-over-HTTP chat APIs: request logging, cancellable
 * sending and mapping of failures onto {@link LlmException.ErrorType}.
 */
abstract class HttpLanguageModel implements LanguageModel {

    private static final Logger logger = LoggerFactory.getLogger(HttpLanguageModel.class);
    protected static final ObjectMapper objectMapper = new ObjectMapper();

    protected final String model;
    protected final String apiKey;
    protected final Duration timeout;
    private final HttpClient httpClient;
    private final Logger conversationLogger;

    protected HttpLanguageModel(LlmProvider provider, String model, String apiKey, int timeoutSeconds, HttpClient httpClient) {
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 60);
        this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
        this.conversationLogger = Config.getLlmConversationLogger(provider.getConfigName());
    }

    protected abstract URI endpoint();

    protected abstract Map<String, String> headers();

    protected abstract Object buildBody(LlmRequest request);

    /**
     * Extracts the completion text from a 2xx response body.
     */
    protected abstract String parseContent(String responseBody) throws IOException;

    @Override
    public String getModelName() {
        return model;
    }

    @Override
    public String generate(LlmRequest request, CancellationToken cancellation) {
        String name = getProvider().name();
        try {
            cancellation.throwIfCancelled();

            if (conversationLogger.isInfoEnabled()) {
                conversationLogger.info("=== {} REQUEST ({}) ===", name, model);
                conversationLogger.info("System: {}", request.getSystemPrompt());
                conversationLogger.info("User: {}", request.getUserPrompt());
            }

            HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint())
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(buildBody(request))));
            headers().forEach(builder::header);

            HttpResponse<String> response = send(builder.build(), cancellation);
            if (response.statusCode() >= 400) {
                throw new IOException(name + " API error " + response.statusCode() + ": " + response.body());
            }

            String content = parseContent(response.body());

            if (conversationLogger.isInfoEnabled()) {
                conversationLogger.info("=== {} RESPONSE ===", name);
                conversationLogger.info("Content: {}", content);
            }
            return content;

        } catch (CancellationException | LlmException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(name + " call interrupted");
        } catch (Exception e) {
            conversationLogger.error("=== {} ERROR: {} ===", name, e.getMessage());
            logger.debug("{} call failed", name, e);
            throw new LlmException(getProvider(), determineErrorType(e), e.getMessage(), e);
        }
    }

    private HttpResponse<String> send(HttpRequest request, CancellationToken cancellation)
            throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());

        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException(e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e.getCause());
        }
    }

    protected LlmException.ErrorType determineErrorType(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        if (e instanceof HttpTimeoutException || e instanceof java.net.SocketTimeoutException) {
            return LlmException.ErrorType.TIMEOUT;
        } else if (e instanceof ConnectException) {
            return LlmException.ErrorType.COMMUNICATION;
        } else if (e instanceof IOException && message.contains(" 429")) {
            return LlmException.ErrorType.RATE_LIMIT;
        } else if (e instanceof IOException && (message.contains(" 401") || message.contains(" 403"))) {
            return LlmException.ErrorType.AUTHENTICATION;
        } else if (e instanceof IOException && message.contains(" 400")) {
            return LlmException.ErrorType.INVALID_REQUEST;
        } else if (e instanceof IOException) {
            return LlmException.ErrorType.COMMUNICATION;
        } else {
            return LlmException.ErrorType.UNKNOWN;
        }
    }
}
