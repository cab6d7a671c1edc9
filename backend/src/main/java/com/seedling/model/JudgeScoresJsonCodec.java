package com.seedling.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parses and writes the jsonb score aggregates and feedback lists stored on submissions.
 */
public final class JudgeScoresJsonCodec {

    private static final String FIELD_JUDGES = "judges";
    private static final String FIELD_AVERAGE = "average";
    private static final String FIELD_JUDGE_ID = "judge_id";
    private static final String FIELD_JUDGE_NAME = "judge_name";
    private static final String FIELD_CRITERIA_SCORES = "criteria_scores";
    private static final String FIELD_OVERALL = "overall";
    private static final String FIELD_FEEDBACK = "feedback";
    private static final String FIELD_SUBMITTED_AT = "submitted_at";

    private JudgeScoresJsonCodec() {
    }

    public static ScoreAggregate aggregateFromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return ScoreAggregate.empty();
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("Score aggregate JSON must be an object");
        }

        JsonNode judgesNode = json.get(FIELD_JUDGES);
        if (judgesNode == null || judgesNode.isNull()) {
            return ScoreAggregate.empty();
        }
        if (!judgesNode.isArray()) {
            throw new IllegalArgumentException("Score aggregate '" + FIELD_JUDGES + "' must be an array");
        }

        List<JudgeScore> judges = new ArrayList<>(judgesNode.size());
        for (JsonNode judgeNode : judgesNode) {
            judges.add(parseJudgeScore(judgeNode));
        }

        JsonNode averageNode = json.get(FIELD_AVERAGE);
        double average = averageNode != null && averageNode.isNumber()
                ? averageNode.doubleValue()
                : ScoreAggregate.meanOverall(judges);
        return new ScoreAggregate(judges, average);
    }

    public static ObjectNode toJson(ScoreAggregate aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("Score aggregate is required");
        }
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ArrayNode judges = root.putArray(FIELD_JUDGES);
        for (JudgeScore judgeScore : aggregate.judges()) {
            ObjectNode judge = judges.addObject();
            judge.put(FIELD_JUDGE_ID, judgeScore.judgeId().toString());
            judge.put(FIELD_JUDGE_NAME, judgeScore.judgeName());
            ObjectNode criteria = judge.putObject(FIELD_CRITERIA_SCORES);
            judgeScore.criteriaScores().forEach(criteria::put);
            judge.put(FIELD_OVERALL, judgeScore.overall());
            judge.put(FIELD_FEEDBACK, judgeScore.feedback());
            putTimestamp(judge, judgeScore.submittedAt());
        }
        root.put(FIELD_AVERAGE, aggregate.average());
        return root;
    }

    public static List<JudgeFeedback> feedbackFromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return List.of();
        }
        if (!json.isArray()) {
            throw new IllegalArgumentException("Judge feedback JSON must be an array");
        }
        List<JudgeFeedback> feedback = new ArrayList<>(json.size());
        for (JsonNode entry : json) {
            if (!entry.isObject()) {
                throw new IllegalArgumentException("Judge feedback entries must be objects");
            }
            feedback.add(new JudgeFeedback(
                    requireJudgeId(entry),
                    optionalText(entry, FIELD_JUDGE_NAME),
                    optionalText(entry, FIELD_FEEDBACK),
                    optionalTimestamp(entry)
            ));
        }
        return List.copyOf(feedback);
    }

    public static ArrayNode feedbackToJson(List<JudgeFeedback> feedback) {
        ArrayNode root = JsonNodeFactory.instance.arrayNode();
        for (JudgeFeedback entry : feedback) {
            ObjectNode node = root.addObject();
            node.put(FIELD_JUDGE_ID, entry.judgeId().toString());
            node.put(FIELD_JUDGE_NAME, entry.judgeName());
            node.put(FIELD_FEEDBACK, entry.feedback());
            putTimestamp(node, entry.submittedAt());
        }
        return root;
    }

    /**
     * Replaces the feedback of the same judge, or appends it.
     */
    public static List<JudgeFeedback> upsertFeedback(List<JudgeFeedback> existing, JudgeFeedback feedback) {
        List<JudgeFeedback> updated = new ArrayList<>(existing.size() + 1);
        boolean replaced = false;
        for (JudgeFeedback entry : existing) {
            if (entry.judgeId().equals(feedback.judgeId())) {
                updated.add(feedback);
                replaced = true;
            } else {
                updated.add(entry);
            }
        }
        if (!replaced) {
            updated.add(feedback);
        }
        return updated;
    }

    private static JudgeScore parseJudgeScore(JsonNode judgeNode) {
        if (!judgeNode.isObject()) {
            throw new IllegalArgumentException("Judge score entries must be objects");
        }

        JsonNode criteriaNode = judgeNode.get(FIELD_CRITERIA_SCORES);
        if (criteriaNode == null || !criteriaNode.isObject()) {
            throw new IllegalArgumentException("Judge score '" + FIELD_CRITERIA_SCORES + "' must be an object");
        }
        Map<String, Double> criteriaScores = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = criteriaNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new IllegalArgumentException("Criterion score '" + field.getKey() + "' must be numeric");
            }
            criteriaScores.put(field.getKey(), field.getValue().doubleValue());
        }

        JsonNode overallNode = judgeNode.get(FIELD_OVERALL);
        if (overallNode == null || !overallNode.isNumber()) {
            throw new IllegalArgumentException("Judge score '" + FIELD_OVERALL + "' must be numeric");
        }

        return new JudgeScore(
                requireJudgeId(judgeNode),
                optionalText(judgeNode, FIELD_JUDGE_NAME),
                Map.copyOf(criteriaScores),
                overallNode.doubleValue(),
                optionalText(judgeNode, FIELD_FEEDBACK),
                optionalTimestamp(judgeNode)
        );
    }

    private static UUID requireJudgeId(JsonNode node) {
        JsonNode idNode = node.get(FIELD_JUDGE_ID);
        if (idNode == null || !idNode.isTextual()) {
            throw new IllegalArgumentException("'" + FIELD_JUDGE_ID + "' must be a UUID string");
        }
        try {
            return UUID.fromString(idNode.asText());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("'" + FIELD_JUDGE_ID + "' must be a UUID string", ex);
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("'" + field + "' must be a string");
        }
        return value.asText();
    }

    private static OffsetDateTime optionalTimestamp(JsonNode node) {
        String text = optionalText(node, FIELD_SUBMITTED_AT);
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("'" + FIELD_SUBMITTED_AT + "' must be an ISO-8601 timestamp", ex);
        }
    }

    private static void putTimestamp(ObjectNode node, OffsetDateTime timestamp) {
        if (timestamp == null) {
            node.putNull(FIELD_SUBMITTED_AT);
        } else {
            node.put(FIELD_SUBMITTED_AT, timestamp.toString());
        }
    }
}
