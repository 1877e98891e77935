package com.gazapps.mcpevals.planning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.mcp.ToolDescriptor;
import com.gazapps.mcpevals.model.ToolExecution;

/**
 * Deterministic tool selection used when the language model gives no plan.
 * <p>
 * A tool matches when the prompt contains its name, or at least
 * {@value #MIN_DESCRIPTION_WORDS} distinct description words longer than
 * {@value #MIN_WORD_LENGTH} characters. The first matching tool wins.
 */
public class PatternToolMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PatternToolMatcher.class);

    static final int MIN_DESCRIPTION_WORDS = 2;
    static final int MIN_WORD_LENGTH = 3;

    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])-?\\d+(?:\\.\\d+)?(?![\\w])");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"|'([^']*)'");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");

    public Optional<ToolExecution> match(String prompt, List<ToolDescriptor> tools) {
        String promptLower = prompt.toLowerCase(Locale.ROOT);

        for (ToolDescriptor tool : tools) {
            if (matches(promptLower, tool)) {
                ToolExecution execution = new ToolExecution(tool.getName(), extractArguments(prompt));
                logger.debug("[FALLBACK] '{}' matched tool {}", prompt, execution);
                return Optional.of(execution);
            }
        }
        return Optional.empty();
    }

    private boolean matches(String promptLower, ToolDescriptor tool) {
        if (promptLower.contains(tool.getName().toLowerCase(Locale.ROOT))) {
            return true;
        }

        Set<String> hits = new HashSet<>();
        for (String word : WORD_SEPARATOR.split(tool.getDescription().toLowerCase(Locale.ROOT))) {
            if (word.length() > MIN_WORD_LENGTH && promptLower.contains(word)) {
                hits.add(word);
                if (hits.size() >= MIN_DESCRIPTION_WORDS) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Two numbers become {@code a}/{@code b}, a single one {@code value}/{@code number};
     * the first quoted text, or the whole prompt, becomes {@code message}, {@code text}
     * and {@code input}, since the tool's schema is not known here.
     */
    Map<String, Object> extractArguments(String prompt) {
        Map<String, Object> arguments = new LinkedHashMap<>();

        List<Number> numbers = extractNumbers(prompt);
        if (numbers.size() >= 2) {
            arguments.put("a", numbers.get(0));
            arguments.put("b", numbers.get(1));
        } else if (numbers.size() == 1) {
            arguments.put("value", numbers.get(0));
            arguments.put("number", numbers.get(0));
        }

        String message = firstQuoted(prompt).orElse(prompt);
        arguments.put("message", message);
        arguments.put("text", message);
        arguments.put("input", message);
        return arguments;
    }

    static List<Number> extractNumbers(String text) {
        List<Number> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            numbers.add(toNumber(matcher.group()));
        }
        return numbers;
    }

    private static Number toNumber(String literal) {
        if (literal.contains(".")) {
            return Double.parseDouble(literal);
        }
        try {
            long value = Long.parseLong(literal);
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Number) (int) value : (Number) value;
        } catch (NumberFormatException e) {
            return Double.parseDouble(literal);
        }
    }

    static Optional<String> firstQuoted(String text) {
        Matcher matcher = QUOTED.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
    }
}
