package com.gazapps.mcpevals.evaluation;

import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazapps.mcpevals.core.CancellationToken;
import com.gazapps.mcpevals.exceptions.ScoringException;
import com.gazapps.mcpevals.llm.LanguageModel;
import com.gazapps.mcpevals.llm.LlmRequest;
import com.gazapps.mcpevals.model.EvaluationScore;
import com.gazapps.mcpevals.model.ModelConfiguration;

/**
 * Scores a response by asking a language model to grade it on five 1-5 scales.
 * A failed call, or output that cannot be read as a valid score, yields
 * {@link EvaluationScore#neutral} with a comment saying why.
 */
public class LlmEvaluationScorer implements EvaluationScorer {

    private static final Logger logger = LoggerFactory.getLogger(LlmEvaluationScorer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final int RAW_RESULT_PREVIEW = 200;

    static final String SYSTEM_PROMPT = """
        You are an expert evaluator assessing how well an LLM answers a given question.
        Review the provided answer and score it from 1 to 5 in each of the following categories:

        Accuracy: Does the answer contain factual errors or hallucinations?
        Completeness: Does the answer fully address all parts of the question?
        Relevance: Is the information directly related to the question?
        Clarity: Is the explanation easy to understand and well-structured?
        Reasoning: Does the answer show logical thinking or provide evidence or rationale?

        Return your evaluation as a JSON object in the exact format:
        {
            "accuracy": 1-5,
            "completeness": 1-5,
            "relevance": 1-5,
            "clarity": 1-5,
            "reasoning": 1-5,
            "overall_comments": "A short paragraph summarizing the strengths and weaknesses of the answer."
        }

        Important: Return ONLY the JSON object, no additional text or formatting.
        """;

    private final LanguageModel languageModel;
    private final double temperature;
    private final int maxTokens;

    public LlmEvaluationScorer(LanguageModel languageModel) {
        this(languageModel, new ModelConfiguration());
    }

    public LlmEvaluationScorer(LanguageModel languageModel, ModelConfiguration modelConfig) {
        this.languageModel = languageModel;
        this.temperature = modelConfig.temperature;
        this.maxTokens = modelConfig.maxTokens;
    }

    @Override
    public EvaluationScore score(String prompt, String response, String expectedResult, CancellationToken cancellation) {
        logger.debug("Scoring response for prompt of length {}", prompt.length());

        EvaluationScore score;
        try {
            score = parse(requestEvaluation(prompt, response, expectedResult, cancellation));
        } catch (ScoringException e) {
            logger.warn("⚠️ {}, using neutral score", e.getMessage());
            return EvaluationScore.neutral(e.getMessage());
        }
        logger.debug("Scoring completed with average score {}", String.format("%.2f", score.getAverageScore()));
        return score;
    }

    private String requestEvaluation(String prompt, String response, String expectedResult,
            CancellationToken cancellation) {
        try {
            LlmRequest request = LlmRequest.of(SYSTEM_PROMPT, buildUserPrompt(prompt, response, expectedResult),
                    temperature, maxTokens).asJson();
            return languageModel.generate(request, cancellation);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to score evaluation response: {}", e.getMessage());
            throw new ScoringException("Failed to score response: " + e.getMessage(), e);
        }
    }

    static String buildUserPrompt(String prompt, String response, String expectedResult) {
        StringBuilder text = new StringBuilder()
            .append("Here is the user input: ").append(prompt).append('\n')
            .append("Here is the LLM's answer: ").append(response);
        if (expectedResult != null && !expectedResult.isEmpty()) {
            text.append("\nExpected result for reference: ").append(expectedResult);
        }
        return text.toString();
    }

    EvaluationScore parse(String result) {
        String raw = result != null ? result : "";
        try {
            JsonNode node = objectMapper.readTree(extractJsonObject(raw));
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("evaluation result is not a JSON object");
            }
            String comments = node.path("overall_comments").asText("");
            return new EvaluationScore(
                    readScore(node, "accuracy"),
                    readScore(node, "completeness"),
                    readScore(node, "relevance"),
                    readScore(node, "clarity"),
                    readScore(node, "reasoning"),
                    comments.isEmpty() ? "No comments provided" : comments);
        } catch (Exception e) {
            logger.warn("Failed to parse evaluation result, using fallback scoring: {}", e.getMessage());
            return EvaluationScore.neutral("Failed to parse evaluation result. Raw result: "
                    + raw.substring(0, Math.min(RAW_RESULT_PREVIEW, raw.length())));
        }
    }

    private static int readScore(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("missing or non-integer " + field);
        }
        return value.asInt();
    }

    /**
     * Drops Markdown fences and any text around the outermost braces.
     */
    static String extractJsonObject(String result) {
        String cleaned = result.replace("```json", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        return start >= 0 && end > start ? cleaned.substring(start, end + 1) : cleaned;
    }
}
