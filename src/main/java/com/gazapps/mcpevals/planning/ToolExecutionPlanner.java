package com.gazapps.mcpevals.planning;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.PlanningException;
import com.gazapps.mcpevals.llm.LanguageModel;
import com.gazapps.mcpevals.llm.LlmRequest;
import com.gazapps.mcpevals.mcp.McpConnection;
import com.gazapps.mcpevals.mcp.ToolCallResult;
import com.gazapps.mcpevals.mcp.ToolDescriptor;
import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ToolExecution;

/**
 * Decides which tools a prompt calls for, then runs them against a live connection.
 * The language model plans first; when it yields nothing the {@link PatternToolMatcher}
 * takes over.
 */
public class ToolExecutionPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ToolExecutionPlanner.class);

    public static final String NO_TOOLS_FOUND = "No appropriate tools were found for this request.";
    public static final String NO_TOOL_RESPONSES = "No tool responses generated.";

    static final double PLANNING_TEMPERATURE = 0.1;
    static final int PLANNING_MAX_TOKENS = 500;

    private final LanguageModel languageModel;
    private final PatternToolMatcher fallbackMatcher;
    private final PlanParser planParser = new PlanParser();
    private final boolean verbose;

    public ToolExecutionPlanner(LanguageModel languageModel) {
        this(languageModel, new PatternToolMatcher(), false);
    }

    public ToolExecutionPlanner(LanguageModel languageModel, PatternToolMatcher fallbackMatcher, boolean verbose) {
        this.languageModel = languageModel;
        this.fallbackMatcher = fallbackMatcher;
        this.verbose = verbose;
    }

    public ExecutionPlan planToolExecutions(String prompt, List<ToolDescriptor> tools, CancellationToken cancellation) {
        List<ToolExecution> planned = List.of();
        try {
            planned = planWithLanguageModel(prompt, tools, cancellation);
        } catch (PlanningException e) {
            logger.warn("[PLANNER] Language model planning failed, using pattern matching: {}", e.getMessage());
        }

        if (!planned.isEmpty()) {
            ExecutionPlan plan = ExecutionPlan.fromLanguageModel(planned);
            logDecision(plan);
            return plan;
        }

        cancellation.throwIfCancelled();
        ExecutionPlan plan = ExecutionPlan.fromFallback(
            fallbackMatcher.match(prompt, tools).map(List::of).orElse(List.of()));
        logDecision(plan);
        return plan;
    }

    private List<ToolExecution> planWithLanguageModel(String prompt, List<ToolDescriptor> tools,
            CancellationToken cancellation) {
        if (languageModel == null) {
            return List.of();
        }

        LlmRequest request = LlmRequest.of(buildSystemPrompt(tools), "User prompt: " + prompt,
                PLANNING_TEMPERATURE, PLANNING_MAX_TOKENS).asJson();
        String response;
        try {
            response = languageModel.generate(request, cancellation);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PlanningException("Tool planning call failed: " + e.getMessage(), e);
        }
        return planParser.parse(response);
    }

    String buildSystemPrompt(List<ToolDescriptor> tools) {
        String toolLines = tools.stream()
            .map(ToolDescriptor::toPromptLine)
            .collect(Collectors.joining("\n"));

        return """
            You are an AI assistant that determines which tools to call based on user prompts.

            Available tools:
            %s

            Based on the user's prompt, determine which tools should be called and with what parameters.
            Return a JSON object with a single tool execution in this format:
            {
              "toolName": "tool_name",
              "arguments": { "param1": "value1", "param2": "value2" }
            }

            If no tools should be called, return: {}

            Rules:
            1. Only call tools that are directly relevant to the prompt
            2. Use appropriate parameter values based on the prompt content
            3. For mathematical operations (add, multiply), extract numbers from the prompt and use parameters 'a' and 'b'
            4. For echo tools, use parameter 'message' with the quoted text from the prompt, or the whole prompt
            5. Be precise with parameter names and types
            """.formatted(toolLines);
    }

    /**
     * Lists tools, plans, and calls each planned tool in order. A failing tool adds an
     * error line and the remaining tools still run.
     */
    public String executeToolInteraction(McpConnection client, ServerConfiguration config, String prompt,
            CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        List<ToolDescriptor> tools = client.listTools();
        if (verbose) {
            logger.info("Available tools on {}:", config.hasUrl() ? config.url : config.path);
            tools.forEach(tool -> logger.info("  - {}: {}", tool.getName(), tool.getDescription()));
        }

        ExecutionPlan plan = planToolExecutions(prompt, tools, cancellation);
        List<String> responses = new ArrayList<>();

        for (ToolExecution execution : plan.getExecutions()) {
            cancellation.throwIfCancelled();
            try {
                logger.debug("[PLANNER] Calling {} with {}", execution.getToolName(), execution.getArguments());
                ToolCallResult result = client.callTool(execution.getToolName(), execution.getArguments());
                String text = extractText(result);

                if (result.isError()) {
                    responses.add("Error calling tool " + execution.getToolName() + ": "
                            + (text != null ? text : "tool reported an error"));
                } else if (text != null) {
                    responses.add(text);
                }
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Failed to call tool {}: {}", execution.getToolName(), e.getMessage());
                responses.add("Error calling tool " + execution.getToolName() + ": " + e.getMessage());
            }
        }

        if (plan.isEmpty()) {
            responses.add(NO_TOOLS_FOUND);
        }

        String response = responses.isEmpty() ? NO_TOOL_RESPONSES : String.join("\n", responses);
        if (verbose) {
            logger.info("Tool interaction finished ({}): {}", plan.getSource(), response);
        }
        return response;
    }

    /**
     * Text block first, then the serialized result. Blank output counts as nothing.
     */
    private static String extractText(ToolCallResult result) {
        if (result == null) {
            return null;
        }
        if (result.hasText()) {
            return result.getText();
        }
        String json = result.getJson();
        return json != null && !json.isBlank() ? json : null;
    }

    private void logDecision(ExecutionPlan plan) {
        if (verbose || logger.isDebugEnabled()) {
            logger.info("[PLANNER] {} tool execution(s) planned via {}", plan.getExecutions().size(), plan.getSource());
        }
    }
}
