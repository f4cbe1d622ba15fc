package com.docqa.rag.learning;

import com.docqa.rag.error.InvalidRequestException;
import com.docqa.rag.json.Json;
import com.docqa.rag.llm.GenerationResult;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.metrics.RagMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds a week-by-week learning path for a set of goals. The provider is asked
 * for a JSON plan; steps outside the requested duration are dropped and the
 * rest are ordered by week. A reply that is not a readable plan is returned as
 * one free-text step rather than failing the request.
 */
@Slf4j
public class LearningPathOrchestrator {

    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)```");

    private final LlmGateway gateway;
    private final int maxTokens;
    private final int maxDurationWeeks;
    private final int maxGoals;
    private final RagMetrics metrics;

    public LearningPathOrchestrator(LlmGateway gateway,
                                    int maxTokens,
                                    int maxDurationWeeks,
                                    int maxGoals,
                                    RagMetrics metrics) {
        this.gateway = gateway;
        this.maxTokens = maxTokens;
        this.maxDurationWeeks = maxDurationWeeks;
        this.maxGoals = maxGoals;
        this.metrics = metrics;
    }

    public LearningPath generate(List<LearningGoal> goals, String background, int durationWeeks,
                                 List<String> providerOrder) {
        long start = System.currentTimeMillis();
        validate(goals, durationWeeks);

        String prompt = buildPrompt(goals, background, durationWeeks);
        GenerationResult result = gateway.generate(prompt, providerOrder, maxTokens);
        LearningPath path = parse(result.text(), result.provider(), goals, durationWeeks);

        long totalMs = System.currentTimeMillis() - start;
        metrics.recordLearningPath(totalMs);
        log.info("[TIMING] Learning path for {} goal(s) over {} weeks: {} step(s), structured={}, provider={}, {}ms",
                goals.size(), durationWeeks, path.steps().size(), path.structured(), path.providerUsed(), totalMs);
        return path;
    }

    private void validate(List<LearningGoal> goals, int durationWeeks) {
        if (goals == null || goals.isEmpty()) {
            throw new InvalidRequestException("at least one goal is required");
        }
        if (goals.size() > maxGoals) {
            throw new InvalidRequestException("at most " + maxGoals + " goals are allowed, got " + goals.size());
        }
        for (LearningGoal goal : goals) {
            if (goal == null || goal.topic() == null || goal.topic().isBlank()) {
                throw new InvalidRequestException("every goal needs a topic");
            }
        }
        if (durationWeeks < 1 || durationWeeks > maxDurationWeeks) {
            throw new InvalidRequestException("duration_weeks must be between 1 and " + maxDurationWeeks
                    + ", got " + durationWeeks);
        }
    }

    String buildPrompt(List<LearningGoal> goals, String background, int durationWeeks) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an expert curriculum designer. Create a week-by-week learning path.\n\n");
        sb.append("## Learner\n");
        sb.append("Background: ").append(background == null || background.isBlank() ? "not specified" : background.trim())
                .append("\n");
        sb.append("Duration: ").append(durationWeeks).append(" weeks\n\n");

        sb.append("## Goals\n");
        for (LearningGoal goal : goals) {
            sb.append("- ").append(goal.topic().trim())
                    .append(" (current level: ").append(levelOf(goal).label());
            if (goal.timeCommitment() != null && !goal.timeCommitment().isBlank()) {
                sb.append(", time: ").append(goal.timeCommitment().trim());
            }
            sb.append(")\n");
        }

        sb.append("\n## Response Format\n");
        sb.append("Respond with JSON ONLY (no markdown, no explanation):\n");
        sb.append("{\n");
        sb.append("  \"path_title\": \"Short title for the whole path\",\n");
        sb.append("  \"prerequisites\": [\"What the learner should know or have before starting\"],\n");
        sb.append("  \"steps\": [\n");
        sb.append("    {\"week\": 1, \"title\": \"...\", \"description\": \"...\", ");
        sb.append("\"objectives\": [\"...\"], \"resources\": [\"...\"]}\n");
        sb.append("  ]\n");
        sb.append("}\n\n");

        sb.append("## Rules\n");
        sb.append("- One step per week, numbered 1 to ").append(durationWeeks).append("\n");
        sb.append("- Start from the learner's current level and build towards the goals\n");
        sb.append("- Keep the weekly workload within the stated time commitment\n");
        return sb.toString();
    }

    LearningPath parse(String reply, String provider, List<LearningGoal> goals, int durationWeeks) {
        String json = extractJsonObject(reply == null ? "" : reply);
        if (json != null) {
            try {
                JsonNode root = Json.MAPPER.readTree(json);
                List<LearningStep> steps = readSteps(root.path("steps"), durationWeeks);
                if (!steps.isEmpty()) {
                    String title = text(root, "path_title", text(root, "title", defaultTitle(goals)));
                    return new LearningPath(title, durationWeeks, steps, textList(root.path("prerequisites")),
                            provider, true);
                }
                log.warn("Learning path reply from {} has no usable steps", provider);
            } catch (JsonProcessingException e) {
                log.warn("Learning path reply from {} is not valid JSON: {}", provider, e.getOriginalMessage());
            }
        } else {
            log.warn("Learning path reply from {} contains no JSON object", provider);
        }

        LearningStep overview = new LearningStep(1, "Plan overview", reply == null ? "" : reply.trim(),
                List.of(), List.of());
        return new LearningPath(defaultTitle(goals), durationWeeks, List.of(overview), List.of(), provider, false);
    }

    private List<LearningStep> readSteps(JsonNode stepsNode, int durationWeeks) {
        if (!stepsNode.isArray()) return List.of();

        // first step wins when a week is repeated
        Map<Integer, LearningStep> byWeek = new LinkedHashMap<>();
        for (int i = 0; i < stepsNode.size(); i++) {
            JsonNode node = stepsNode.get(i);
            if (!node.isObject()) continue;
            int week = node.path("week").asInt(i + 1);
            if (week < 1 || week > durationWeeks) continue;
            byWeek.putIfAbsent(week, new LearningStep(
                    week,
                    text(node, "title", "Week " + week),
                    text(node, "description", ""),
                    textList(node.path("objectives")),
                    textList(node.path("resources"))));
        }
        return byWeek.values().stream()
                .sorted(Comparator.comparingInt(LearningStep::week))
                .toList();
    }

    static String extractJsonObject(String reply) {
        String candidate = reply;
        Matcher matcher = CODE_BLOCK.matcher(reply);
        if (matcher.find()) {
            candidate = matcher.group(1);
        }
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        // \' is not a valid JSON escape
        return candidate.substring(start, end + 1).replace("\\'", "'");
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return fallback;
        String s = value.asText().trim();
        return s.isEmpty() ? fallback : s;
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    out.add(item.asText().trim());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            out.add(node.asText().trim());
        }
        return List.copyOf(out);
    }

    private static String defaultTitle(List<LearningGoal> goals) {
        return "Learning path: " + goals.stream()
                .map(g -> g.topic().trim())
                .collect(Collectors.joining(", "));
    }

    private static ProficiencyLevel levelOf(LearningGoal goal) {
        return goal.proficiencyLevel() == null ? ProficiencyLevel.BEGINNER : goal.proficiencyLevel();
    }
}
