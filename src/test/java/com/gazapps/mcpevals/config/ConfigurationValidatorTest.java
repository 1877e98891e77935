package com.gazapps.mcpevals.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gazapps.mcpevals.model.EvaluationConfiguration;
import com.gazapps.mcpevals.model.EvaluationRequest;
import com.gazapps.mcpevals.model.ModelConfiguration;
import com.gazapps.mcpevals.model.ServerConfiguration;

class ConfigurationValidatorTest {

    @TempDir
    Path dir;

    private final ConfigurationValidator validator = new ConfigurationValidator();
    private Path serverFile;

    @BeforeEach
    void setUp() throws IOException {
        serverFile = Files.writeString(dir.resolve("index.js"), "// server");
    }

    private EvaluationConfiguration suite(ServerConfiguration server, EvaluationRequest... requests) {
        return new EvaluationConfiguration(new ModelConfiguration("openai", "gpt-4o"), server,
                new ArrayList<>(List.of(requests)));
    }

    private EvaluationRequest request() {
        return new EvaluationRequest("addition", "Adds numbers", "add 5 and 3");
    }

    @Test
    void validSuite_hasNoErrors() {
        assertThat(validator.validate(suite(ServerConfiguration.stdio(serverFile.toString()), request()))).isEmpty();
    }

    @Test
    void httpSuite_withUrlOnly_isValid() {
        assertThat(validator.validate(suite(ServerConfiguration.http("https://mcp.example.com/mcp"), request()))).isEmpty();
    }

    @Test
    void modelProblems_areAllReported() {
        EvaluationConfiguration config = suite(ServerConfiguration.stdio(serverFile.toString()), request());
        config.model.provider = "cohere";
        config.model.name = " ";
        config.model.maxTokens = 200_000;
        config.model.temperature = 2.5;

        assertThat(validator.validate(config)).containsExactly(
            "Provider must be one of: openai, anthropic, azure-openai",
            "Model name is required",
            "MaxTokens must not exceed 100000",
            "Temperature must be between 0.0 and 2.0");
    }

    @Test
    void providerCheck_ignoresCase() {
        EvaluationConfiguration config = suite(ServerConfiguration.stdio(serverFile.toString()), request());
        config.model.provider = "Azure-OpenAI";

        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void zeroMaxTokens_isRejected() {
        EvaluationConfiguration config = suite(ServerConfiguration.stdio(serverFile.toString()), request());
        config.model.maxTokens = 0;

        assertThat(validator.validate(config)).containsExactly("MaxTokens must be greater than 0");
    }

    @Test
    void stdioWithoutPath_isRejected() {
        assertThat(validator.validate(suite(new ServerConfiguration("stdio", null, null), request())))
            .containsExactly("Server path is required for stdio transport");
    }

    @Test
    void httpWithoutUrl_isRejected() {
        ServerConfiguration server = new ServerConfiguration("http", serverFile.toString(), null);

        assertThat(validator.validate(suite(server, request())))
            .containsExactly("Url is required for http transport");
    }

    @Test
    void nonHttpUrl_isRejected() {
        assertThat(validator.validate(suite(ServerConfiguration.http("ftp://example.com/mcp"), request())))
            .containsExactly("Url must be a valid HTTP or HTTPS URL");
    }

    @Test
    void unknownTransport_isRejected() {
        ServerConfiguration server = new ServerConfiguration("websocket", serverFile.toString(), null);

        assertThat(validator.validate(suite(server, request())))
            .containsExactly("Transport must be one of: stdio, http");
    }

    @Test
    void missingServerFile_isRejected() {
        String missing = dir.resolve("missing.py").toString();

        assertThat(validator.validate(suite(ServerConfiguration.stdio(missing), request())))
            .containsExactly("Server file not found: " + missing);
    }

    @Test
    void timeoutOutOfRange_isRejected() {
        ServerConfiguration server = ServerConfiguration.stdio(serverFile.toString());
        server.timeout = 601;

        assertThat(validator.validate(suite(server, request())))
            .containsExactly("Timeout must be between 1 and 600 seconds");
    }

    @Test
    void evaluationProblems_carryTheirIndex() {
        EvaluationRequest tooLong = new EvaluationRequest("x".repeat(101), "fine", "p".repeat(10_001));
        EvaluationRequest blank = new EvaluationRequest("ok", "", "add");

        assertThat(validator.validate(suite(ServerConfiguration.stdio(serverFile.toString()), request(), tooLong, blank)))
            .containsExactly(
                "Evaluation #2: name must not exceed 100 characters",
                "Evaluation #2: prompt must not exceed 10000 characters",
                "Evaluation #3: description is required");
    }

    @Test
    void noEvaluations_isRejected() {
        assertThat(validator.validate(suite(ServerConfiguration.stdio(serverFile.toString()))))
            .containsExactly("At least one evaluation is required");
    }

    @Test
    void missingSections_areReported() {
        assertThat(validator.validate(new EvaluationConfiguration(null, null, List.of(request()))))
            .containsExactly("Language model configuration is required", "Server configuration is required");
    }
}
