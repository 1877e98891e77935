package com.gazapps.mcpevals.report;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gazapps.mcpevals.model.EvaluationResult;
import com.gazapps.mcpevals.model.EvaluationScore;
import com.gazapps.mcpevals.model.EvaluationSummary;

/**
 * Renders a finished batch as JSON, plain text or Markdown and writes it out.
 */
public class ReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);
    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final int PROMPT_PREVIEW = 100;
    private static final int RESPONSE_PREVIEW = 200;
    private static final String NO_COMMENTS = "No comments provided";

    private final PrintStream console;

    public ReportWriter() {
        this(System.out);
    }

    public ReportWriter(PrintStream console) {
        this.console = console;
    }

    /**
     * Writes to {@code outputPath}, or to the console when it is {@code null}. Markdown
     * printed to the console is also saved as {@code <config-name>.md} beside the config.
     *
     * @return the file written, if any
     */
    public Path write(EvaluationSummary summary, Duration totalDuration, ReportFormat format,
            Path outputPath, Path configPath) throws IOException {
        String report = render(summary, totalDuration, format);

        if (outputPath != null) {
            writeFile(outputPath, report);
            logger.info("Results written to: {}", outputPath);
            return outputPath;
        }

        console.println(report);
        if (format == ReportFormat.CLEAN && configPath != null) {
            Path markdown = markdownPathFor(configPath);
            writeFile(markdown, report);
            logger.info("Results automatically saved to markdown file: {}", markdown);
            console.println("📄 Results saved to: " + markdown);
            return markdown;
        }
        return null;
    }

    public String render(EvaluationSummary summary, Duration totalDuration, ReportFormat format) {
        return switch (format) {
            case JSON -> renderJson(summary, totalDuration);
            case SUMMARY -> renderSummary(summary, totalDuration);
            case DETAILED -> renderDetailed(summary, totalDuration);
            case CLEAN -> renderClean(summary, totalDuration);
        };
    }

    static Path markdownPathFor(Path configPath) {
        String fileName = configPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path directory = configPath.toAbsolutePath().getParent();
        return directory != null ? directory.resolve(baseName + ".md") : Path.of(baseName + ".md");
    }

    String renderJson(EvaluationSummary summary, Duration totalDuration) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode totals = root.putObject("summary");
        totals.put("totalEvaluations", summary.getTotal());
        totals.put("successfulEvaluations", summary.getSuccessCount());
        totals.put("failedEvaluations", summary.getFailureCount());
        totals.put("averageScore", summary.getAverageScore());
        totals.put("totalDuration", seconds(totalDuration));
        totals.put("timestamp", Instant.now().toString());

        ArrayNode results = root.putArray("results");
        for (EvaluationResult result : summary.getResults()) {
            ObjectNode node = results.addObject();
            node.put("name", result.getName());
            node.put("description", result.getDescription());
            node.put("isSuccess", result.isSuccess());
            node.put("errorMessage", result.getErrorMessage());
            node.put("duration", seconds(result.getDuration()));
            if (result.isSuccess()) {
                EvaluationScore score = result.getScore();
                ObjectNode scoreNode = node.putObject("score");
                scoreNode.put("accuracy", score.getAccuracy());
                scoreNode.put("completeness", score.getCompleteness());
                scoreNode.put("relevance", score.getRelevance());
                scoreNode.put("clarity", score.getClarity());
                scoreNode.put("reasoning", score.getReasoning());
                scoreNode.put("average", score.getAverageScore());
                scoreNode.put("overallComments", score.getOverallComments());
            } else {
                node.putNull("score");
            }
            node.put("prompt", result.getPrompt());
            node.put("response", result.getResponse());
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    String renderSummary(EvaluationSummary summary, Duration totalDuration) {
        StringBuilder out = new StringBuilder();
        out.append("MCP Evaluations Summary\n");
        out.append("======================\n\n");
        out.append("Total Evaluations: ").append(summary.getTotal()).append('\n');
        out.append("Successful: ").append(summary.getSuccessCount()).append('\n');
        out.append("Failed: ").append(summary.getFailureCount()).append('\n');
        out.append("Success Rate: ").append(successRate(summary)).append('\n');
        out.append('\n');
        out.append("Average Score: ").append(format2(summary.getAverageScore())).append("/5.0\n");
        out.append("Total Duration: ").append(format1(seconds(totalDuration))).append(" seconds\n\n");

        List<EvaluationResult> failed = summary.getResults().stream()
            .filter(r -> !r.isSuccess())
            .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            out.append("Failed Evaluations:\n");
            failed.forEach(r -> out.append("  ❌ ").append(r.getName()).append(": ").append(r.getErrorMessage()).append('\n'));
            out.append('\n');
        }

        out.append("Successful Evaluations:\n");
        summary.getResults().stream()
            .filter(EvaluationResult::isSuccess)
            .sorted(Comparator.comparingDouble((EvaluationResult r) -> r.getScore().getAverageScore()).reversed())
            .forEach(r -> out.append("  ✅ ").append(r.getName()).append(": ")
                .append(format2(r.getScore().getAverageScore())).append("/5.0 (")
                .append(format1(seconds(r.getDuration()))).append("s)\n"));
        return out.toString();
    }

    String renderDetailed(EvaluationSummary summary, Duration totalDuration) {
        StringBuilder out = new StringBuilder(renderSummary(summary, totalDuration));
        out.append("\n\nDetailed Results:\n");
        out.append("================\n\n");

        for (EvaluationResult result : summary.getResults()) {
            out.append("Evaluation: ").append(result.getName()).append('\n');
            out.append("Description: ").append(result.getDescription()).append('\n');
            out.append("Status: ").append(result.isSuccess() ? "✅ Success" : "❌ Failed").append('\n');
            out.append("Duration: ").append(format2(seconds(result.getDuration()))).append(" seconds\n");

            if (result.isSuccess()) {
                EvaluationScore score = result.getScore();
                out.append("Scores:\n");
                out.append("  Accuracy: ").append(score.getAccuracy()).append("/5\n");
                out.append("  Completeness: ").append(score.getCompleteness()).append("/5\n");
                out.append("  Relevance: ").append(score.getRelevance()).append("/5\n");
                out.append("  Clarity: ").append(score.getClarity()).append("/5\n");
                out.append("  Reasoning: ").append(score.getReasoning()).append("/5\n");
                out.append("  Average: ").append(format2(score.getAverageScore())).append("/5\n");
                out.append("Comments: ").append(score.getOverallComments()).append('\n');
            } else {
                out.append("Error: ").append(result.getErrorMessage()).append('\n');
            }

            out.append("Prompt: ").append(preview(result.getPrompt(), PROMPT_PREVIEW)).append('\n');
            if (!result.getResponse().isEmpty()) {
                out.append("Response: ").append(preview(result.getResponse(), RESPONSE_PREVIEW)).append('\n');
            }
            out.append('\n').append("-".repeat(50)).append("\n\n");
        }
        return out.toString();
    }

    String renderClean(EvaluationSummary summary, Duration totalDuration) {
        StringBuilder out = new StringBuilder();
        out.append("# 🔍 MCP Evaluation Results\n\n");
        out.append("*Generated on ").append(TIMESTAMP.format(Instant.now())).append(" UTC*\n\n");

        out.append("## 📊 Summary\n\n");
        out.append("- **Total Evaluations:** ").append(summary.getTotal()).append('\n');
        out.append("- **Successful:** ").append(summary.getSuccessCount()).append(" ✅\n");
        out.append("- **Failed:** ").append(summary.getFailureCount()).append(" ❌\n");
        out.append("- **Success Rate:** ").append(successRate(summary)).append('\n');
        out.append("- **Average Score:** ").append(format2(summary.getAverageScore())).append("/5.0 ")
            .append(rating(summary.getAverageScore())).append('\n');
        out.append("- **Total Duration:** ").append(format1(seconds(totalDuration))).append(" seconds\n\n");

        out.append("## 📋 Detailed Results\n\n");
        for (EvaluationResult result : summary.getResults()) {
            if (result.isSuccess()) {
                EvaluationScore score = result.getScore();
                out.append("### ✅ ").append(result.getName()).append("\n\n");
                out.append("**Score:** ").append(format1(score.getAverageScore())).append("/5.0 ")
                    .append(rating(score.getAverageScore())).append("  \n");
                out.append("**Duration:** ").append(format1(seconds(result.getDuration()))).append("s  \n\n");

                out.append("| Metric | Score |\n");
                out.append("|--------|-------|\n");
                out.append("| Accuracy | ").append(score.getAccuracy()).append("/5 |\n");
                out.append("| Completeness | ").append(score.getCompleteness()).append("/5 |\n");
                out.append("| Relevance | ").append(score.getRelevance()).append("/5 |\n");
                out.append("| Clarity | ").append(score.getClarity()).append("/5 |\n");
                out.append("| Reasoning | ").append(score.getReasoning()).append("/5 |\n\n");

                out.append("**Test Prompt:**\n");
                out.append("> ").append(result.getPrompt()).append("\n\n");

                if (!result.getResponse().isEmpty()) {
                    out.append("**Response:**\n");
                    out.append("```\n").append(preview(result.getResponse(), RESPONSE_PREVIEW)).append("\n```\n\n");
                }

                String comments = score.getOverallComments();
                if (!comments.isEmpty() && !NO_COMMENTS.equals(comments)) {
                    out.append("**Evaluation Comments:**\n");
                    out.append("> ").append(comments).append("\n\n");
                }
            } else {
                out.append("### ❌ ").append(result.getName()).append("\n\n");
                out.append("**Error:** ").append(result.getErrorMessage()).append("  \n");
                out.append("**Duration:** ").append(format1(seconds(result.getDuration()))).append("s  \n\n");
            }
            out.append("---\n\n");
        }
        return out.toString();
    }

    static String rating(double score) {
        if (score >= 4.5) return "🌟 Excellent";
        if (score >= 3.5) return "🟢 Good";
        if (score >= 2.5) return "🟡 Fair";
        if (score >= 1.5) return "🟠 Poor";
        return "🔴 Critical";
    }

    private static String successRate(EvaluationSummary summary) {
        double rate = summary.getTotal() == 0 ? 0.0 : summary.getSuccessCount() * 100.0 / summary.getTotal();
        return format1(rate) + "%";
    }

    private static String preview(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    private static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String format2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static void writeFile(Path path, String content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
