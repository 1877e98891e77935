package com.gazapps.mcpevals.llm.providers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.llm.LlmException;
import com.gazapps.mcpevals.llm.LlmRequest;

class OpenAiTest {

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private HttpClient httpClient;
    private OpenAi openAi;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        openAi = new OpenAi(URL, "sk-test", "gpt-4o", 30, httpClient);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(CompletableFuture.completedFuture(response)).when(httpClient).sendAsync(any(), any());
    }

    private void fail(Exception error) {
        doReturn(CompletableFuture.failedFuture(error)).when(httpClient).sendAsync(any(), any());
    }

    @Test
    void generate_returnsFirstChoiceContent() {
        respond(200, "{\"id\":\"c1\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{}\"}}]}");

        String content = openAi.generate(LlmRequest.of("system", "user", 0.1, 500), CancellationToken.none());

        assertThat(content).isEqualTo("{}");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(request.capture(), any());
        assertThat(request.getValue().uri()).hasToString(URL);
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer sk-test");
    }

    @Test
    void chatRequest_carriesJsonResponseFormat() throws Exception {
        LlmRequest request = LlmRequest.of("grade it", "answer", 0.2, 800).asJson();

        JsonNode body = new ObjectMapper().valueToTree(new OpenAi.ChatRequest("gpt-4o", request));

        assertThat(body.get("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.get("messages")).hasSize(2);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("system");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(800);
        assertThat(body.get("response_format").get("type").asText()).isEqualTo("json_object");
    }

    @Test
    void chatRequest_withoutSystemPrompt_sendsUserOnly() {
        JsonNode body = new ObjectMapper().valueToTree(new OpenAi.ChatRequest("gpt-4o", LlmRequest.of(null, "hi", 0.1, 0)));

        assertThat(body.get("messages")).hasSize(1);
        assertThat(body.has("max_tokens")).isFalse();
        assertThat(body.has("response_format")).isFalse();
    }

    @Test
    void unauthorized_mapsToAuthenticationError() {
        respond(401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), CancellationToken.none()))
            .isInstanceOf(LlmException.class)
            .satisfies(e -> assertThat(((LlmException) e).getErrorType()).isEqualTo(LlmException.ErrorType.AUTHENTICATION));
    }

    @Test
    void tooManyRequests_mapsToRateLimit() {
        respond(429, "{\"error\":{\"message\":\"Rate limit reached\"}}");

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), CancellationToken.none()))
            .satisfies(e -> assertThat(((LlmException) e).getErrorType()).isEqualTo(LlmException.ErrorType.RATE_LIMIT));
    }

    @Test
    void timeout_mapsToTimeout() {
        fail(new HttpTimeoutException("request timed out"));

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), CancellationToken.none()))
            .satisfies(e -> assertThat(((LlmException) e).getErrorType()).isEqualTo(LlmException.ErrorType.TIMEOUT));
    }

    @Test
    void refusedConnection_mapsToCommunication() {
        fail(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), CancellationToken.none()))
            .satisfies(e -> assertThat(((LlmException) e).getErrorType()).isEqualTo(LlmException.ErrorType.COMMUNICATION));
    }

    @Test
    void emptyChoices_isCommunicationError() {
        respond(200, "{\"choices\":[]}");

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), CancellationToken.none()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("No response from OPENAI");
    }

    @Test
    void cancelledToken_neverSends() {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();

        assertThatThrownBy(() -> openAi.generate(LlmRequest.of("s", "u", 0.1, 10), cancellation))
            .isInstanceOf(CancellationException.class);
        verify(httpClient, never()).sendAsync(any(), any());
    }

    @Test
    void cancellingDuringCall_abortsPendingRequest() throws Exception {
        CompletableFuture<HttpResponse<String>> pending = new CompletableFuture<>();
        doReturn(pending).when(httpClient).sendAsync(any(), any());
        CancellationToken cancellation = new CancellationToken();

        CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                openAi.generate(LlmRequest.of("s", "u", 0.1, 10), cancellation);
                return null;
            } catch (RuntimeException e) {
                return e;
            }
        });
        while (!mockingDetails(httpClient).getInvocations().stream()
                .anyMatch(invocation -> invocation.getMethod().getName().equals("sendAsync"))) {
            Thread.sleep(5);
        }
        cancellation.cancel();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(CancellationException.class);
        assertThat(pending.isCancelled()).isTrue();
    }
}
