package com.gazapps.mcpevals.planning;

import java.util.List;

import com.gazapps.mcpevals.model.ToolExecution;

/**
 * Ordered tool calls for one prompt, tagged with how they were chosen.
 */
public final class ExecutionPlan {

    public enum Source { LANGUAGE_MODEL, PATTERN_FALLBACK }

    private final Source source;
    private final List<ToolExecution> executions;

    private ExecutionPlan(Source source, List<ToolExecution> executions) {
        this.source = source;
        this.executions = List.copyOf(executions);
    }

    public static ExecutionPlan fromLanguageModel(List<ToolExecution> executions) {
        return new ExecutionPlan(Source.LANGUAGE_MODEL, executions);
    }

    public static ExecutionPlan fromFallback(List<ToolExecution> executions) {
        return new ExecutionPlan(Source.PATTERN_FALLBACK, executions);
    }

    public Source getSource() { return source; }
    public List<ToolExecution> getExecutions() { return executions; }

    public boolean isEmpty() {
        return executions.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ExecutionPlan{source=%s, executions=%s}", source, executions);
    }
}
