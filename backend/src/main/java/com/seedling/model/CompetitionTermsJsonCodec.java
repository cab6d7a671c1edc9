package com.seedling.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the rubric and prize structure jsonb documents of a competition.
 */
public final class CompetitionTermsJsonCodec {

    public static final double DEFAULT_CRITERION_WEIGHT = 1.0;

    private static final String FIELD_CRITERIA = "criteria";
    private static final String FIELD_WEIGHT = "weight";

    private CompetitionTermsJsonCodec() {
    }

    /**
     * Place label to fraction of the prize pool, in declaration order.
     */
    public static Map<String, Double> prizeStructure(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return Collections.emptyMap();
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("Prize structure must be an object of place to fraction");
        }
        Map<String, Double> places = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new IllegalArgumentException("Prize fraction for place '" + field.getKey() + "' must be numeric");
            }
            double fraction = field.getValue().doubleValue();
            if (fraction < 0) {
                throw new IllegalArgumentException("Prize fraction for place '" + field.getKey() + "' must be non-negative");
            }
            places.put(field.getKey(), fraction);
        }
        return Collections.unmodifiableMap(places);
    }

    /**
     * Criterion name to weight, or {@code null} when the rubric is absent or not an object.
     * Accepts {@code {"c": 2}}, {@code {"c": {"weight": 2}}} and either form nested under {@code "criteria"}.
     */
    public static Map<String, Double> rubricWeights(JsonNode json) {
        if (json == null || !json.isObject()) {
            return null;
        }
        JsonNode criteria = json.has(FIELD_CRITERIA) && json.get(FIELD_CRITERIA).isObject()
                ? json.get(FIELD_CRITERIA)
                : json;

        Map<String, Double> weights = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = criteria.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            weights.put(field.getKey(), weightOf(field.getValue()));
        }
        return Collections.unmodifiableMap(weights);
    }

    private static double weightOf(JsonNode entry) {
        if (entry.isNumber()) {
            return entry.doubleValue();
        }
        if (entry.isObject()) {
            JsonNode weight = entry.get(FIELD_WEIGHT);
            if (weight != null && weight.isNumber()) {
                return weight.doubleValue();
            }
        }
        return DEFAULT_CRITERION_WEIGHT;
    }
}
