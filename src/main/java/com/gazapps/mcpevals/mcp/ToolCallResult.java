package com.gazapps.mcpevals.mcp;

/**
 * What a tool call produced: the first non-blank text block, if any, and the whole
 * result serialized as JSON for everything else.
 */
public final class ToolCallResult {

    private final String text;
    private final String json;
    private final boolean error;

    private ToolCallResult(String text, String json, boolean error) {
        this.text = text;
        this.json = json;
        this.error = error;
    }

    public static ToolCallResult text(String text) {
        return new ToolCallResult(text, null, false);
    }

    public static ToolCallResult of(String text, String json, boolean error) {
        return new ToolCallResult(text, json, error);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public String getText() { return text; }
    public String getJson() { return json; }
    public boolean isError() { return error; }

    @Override
    public String toString() {
        return String.format("ToolCallResult{error=%b, text=%s}", error, text);
    }
}
