package com.gazapps.mcpevals.planning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.gazapps.mcpevals.mcp.ToolDescriptor;
import com.gazapps.mcpevals.model.ToolExecution;

class PatternToolMatcherTest {

    private final PatternToolMatcher matcher = new PatternToolMatcher();

    private final List<ToolDescriptor> tools = List.of(
        new ToolDescriptor("add", "Add two numbers together"),
        new ToolDescriptor("echo", "Echo back the provided message"),
        new ToolDescriptor("get_forecast", "Weather forecast for a city"));

    @Test
    void toolNameInPrompt_matchesWithNumberArguments() {
        Optional<ToolExecution> execution = matcher.match("Please add 5 and 3", tools);

        assertThat(execution).isPresent();
        assertThat(execution.get().getToolName()).isEqualTo("add");
        assertThat(execution.get().getArguments()).containsEntry("a", 5).containsEntry("b", 3);
    }

    @Test
    void quotedText_becomesMessage() {
        ToolExecution execution = matcher.match("echo 'hello world'", tools).orElseThrow();

        assertThat(execution.getToolName()).isEqualTo("echo");
        assertThat(execution.getArguments())
            .containsEntry("message", "hello world")
            .containsEntry("text", "hello world")
            .containsEntry("input", "hello world");
    }

    @Test
    void twoDescriptionWords_match() {
        ToolExecution execution = matcher.match("What is the weather forecast in Lisbon?", tools).orElseThrow();

        assertThat(execution.getToolName()).isEqualTo("get_forecast");
        assertThat(execution.getArguments()).containsEntry("message", "What is the weather forecast in Lisbon?");
    }

    @Test
    void singleDescriptionWord_doesNotMatch() {
        assertThat(matcher.match("Tell me about the weather", tools)).isEmpty();
    }

    @Test
    void firstMatchingToolWins() {
        ToolExecution execution = matcher.match("add then echo", tools).orElseThrow();

        assertThat(execution.getToolName()).isEqualTo("add");
    }

    @Test
    void singleNumber_becomesValueAndNumber() {
        assertThat(matcher.extractArguments("square 7"))
            .containsEntry("value", 7)
            .containsEntry("number", 7)
            .doesNotContainKeys("a", "b");
    }

    @Test
    void decimalsAndNegatives_areParsed() {
        assertThat(PatternToolMatcher.extractNumbers("multiply -2 by 3.5")).containsExactly(-2, 3.5);
    }

    @Test
    void digitsInsideWords_areIgnored() {
        assertThat(PatternToolMatcher.extractNumbers("use mp3 and h264 codecs")).isEmpty();
    }

    @Test
    void noTools_noMatch() {
        assertThat(matcher.match("add 1 and 2", List.of())).isEmpty();
    }
}
