package com.gazapps.mcpevals.planning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.llm.LlmRequest;
import com.gazapps.mcpevals.mcp.ToolCallResult;
import com.gazapps.mcpevals.mcp.ToolDescriptor;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ToolExecution;
import com.gazapps.mcpevals.support.FakeMcpConnection;
import com.gazapps.mcpevals.support.StubLanguageModel;

class ToolExecutionPlannerTest {

    private final ServerConfiguration server = ServerConfiguration.stdio("calculator/index.js");

    @Test
    void languageModelPlan_isUsedWhenValid() {
        StubLanguageModel model = StubLanguageModel.replying("{\"toolName\": \"add\", \"arguments\": {\"a\": 10, \"b\": 32}}");
        ToolExecutionPlanner planner = new ToolExecutionPlanner(model);

        ExecutionPlan plan = planner.planToolExecutions("sum ten and thirty two", FakeMcpConnection.calculator().listTools(),
                CancellationToken.none());

        assertThat(plan.getSource()).isEqualTo(ExecutionPlan.Source.LANGUAGE_MODEL);
        assertThat(plan.getExecutions()).extracting(ToolExecution::getToolName).containsExactly("add");

        LlmRequest request = model.getRequests().get(0);
        assertThat(request.getTemperature()).isEqualTo(0.1);
        assertThat(request.getMaxTokens()).isEqualTo(500);
        assertThat(request.isJsonObject()).isTrue();
        assertThat(request.getUserPrompt()).isEqualTo("User prompt: sum ten and thirty two");
        assertThat(request.getSystemPrompt()).contains("- add: Add two numbers together", "- echo: Echo back");
    }

    @Test
    void failingLanguageModel_fallsBackToPatterns() {
        FakeMcpConnection server = FakeMcpConnection.calculator();
        ToolExecutionPlanner planner = new ToolExecutionPlanner(StubLanguageModel.failing());

        String response = planner.executeToolInteraction(server, this.server, "add 5 and 3", CancellationToken.none());

        ToolExecution call = server.getCalls().get(0);
        assertThat(call.getToolName()).isEqualTo("add");
        assertThat(((Number) call.getArguments().get("a")).doubleValue()).isEqualTo(5.0);
        assertThat(((Number) call.getArguments().get("b")).doubleValue()).isEqualTo(3.0);
        assertThat(response).isEqualTo("8.0");
    }

    @Test
    void emptyLanguageModelPlan_fallsBackToPatterns() {
        ToolExecutionPlanner planner = new ToolExecutionPlanner(StubLanguageModel.replying("{}"));

        ExecutionPlan plan = planner.planToolExecutions("echo 'hi'", FakeMcpConnection.calculator().listTools(),
                CancellationToken.none());

        assertThat(plan.getSource()).isEqualTo(ExecutionPlan.Source.PATTERN_FALLBACK);
        assertThat(plan.getExecutions()).extracting(ToolExecution::getToolName).containsExactly("echo");
    }

    @Test
    void noLanguageModel_usesPatternsOnly() {
        ToolExecutionPlanner planner = new ToolExecutionPlanner(null);

        ExecutionPlan plan = planner.planToolExecutions("add 1 and 2", FakeMcpConnection.calculator().listTools(),
                CancellationToken.none());

        assertThat(plan.getSource()).isEqualTo(ExecutionPlan.Source.PATTERN_FALLBACK);
    }

    @Test
    void partialFailure_keepsSuccessAndErrorLines() {
        FakeMcpConnection server = FakeMcpConnection.calculator()
            .failingTool("divide", "Divide two numbers", "division by zero");
        ToolExecutionPlanner planner = new ToolExecutionPlanner(StubLanguageModel.replying("""
            {"tools": [
              {"toolName": "add", "arguments": {"a": 2, "b": 3}},
              {"toolName": "divide", "arguments": {"a": 1, "b": 0}}
            ]}
            """));

        String response = planner.executeToolInteraction(server, this.server, "add then divide", CancellationToken.none());

        assertThat(response).isEqualTo("5.0\nError calling tool divide: division by zero");
        assertThat(server.getCalls()).hasSize(2);
    }

    @Test
    void toolReportingError_isRecordedAsErrorLine() {
        FakeMcpConnection server = new FakeMcpConnection()
            .tool("lookup", "Find a record", args -> ToolCallResult.of("record not found", null, true));
        ToolExecutionPlanner planner = new ToolExecutionPlanner(
            StubLanguageModel.replying("{\"toolName\": \"lookup\", \"arguments\": {\"id\": 9}}"));

        String response = planner.executeToolInteraction(server, this.server, "lookup 9", CancellationToken.none());

        assertThat(response).isEqualTo("Error calling tool lookup: record not found");
    }

    @Test
    void jsonOnlyResult_isUsedWhenNoText() {
        FakeMcpConnection server = new FakeMcpConnection()
            .tool("stats", "Server statistics", args -> ToolCallResult.of(null, "{\"uptime\":12}", false));
        ToolExecutionPlanner planner = new ToolExecutionPlanner(
            StubLanguageModel.replying("{\"toolName\": \"stats\", \"arguments\": {}}"));

        assertThat(planner.executeToolInteraction(server, this.server, "stats please", CancellationToken.none()))
            .isEqualTo("{\"uptime\":12}");
    }

    @Test
    void noMatchingTool_returnsNoToolsSentinel() {
        FakeMcpConnection server = FakeMcpConnection.calculator();
        ToolExecutionPlanner planner = new ToolExecutionPlanner(StubLanguageModel.replying("{}"));

        String response = planner.executeToolInteraction(server, this.server, "What is the capital of France?",
                CancellationToken.none());

        assertThat(response).isEqualTo(ToolExecutionPlanner.NO_TOOLS_FOUND);
        assertThat(server.getCalls()).isEmpty();
    }

    @Test
    void blankToolOutput_returnsNoResponsesSentinel() {
        FakeMcpConnection server = new FakeMcpConnection()
            .tool("noop", "Does nothing", args -> ToolCallResult.text("   "));
        ToolExecutionPlanner planner = new ToolExecutionPlanner(
            StubLanguageModel.replying("{\"toolName\": \"noop\", \"arguments\": {}}"));

        assertThat(planner.executeToolInteraction(server, this.server, "noop", CancellationToken.none()))
            .isEqualTo(ToolExecutionPlanner.NO_TOOL_RESPONSES);
    }

    @Test
    void cancelledToken_stopsBeforeListingTools() {
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();
        ToolExecutionPlanner planner = new ToolExecutionPlanner(StubLanguageModel.replying("{}"));

        assertThatThrownBy(() -> planner.executeToolInteraction(FakeMcpConnection.calculator(), server, "add 1 and 2",
                cancellation))
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void systemPrompt_describesToolsWithoutDescription() {
        ToolExecutionPlanner planner = new ToolExecutionPlanner(null);

        String prompt = planner.buildSystemPrompt(List.of(new ToolDescriptor("ping", null)));

        assertThat(prompt).contains("- ping: No description available").contains("If no tools should be called, return: {}");
    }
}
