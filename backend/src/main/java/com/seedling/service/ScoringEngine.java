package com.seedling.service;

import com.seedling.model.JudgeScore;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.web.SettlementException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Validates a judge's rubric scores and computes the judge's weighted overall.
 */
@Component
public class ScoringEngine {

    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 10.0;

    public JudgeScore score(
            UUID judgeId,
            String judgeName,
            Map<String, Double> rubricWeights,
            Map<String, Double> criteriaScores,
            String feedback,
            OffsetDateTime submittedAt
    ) {
        validateCriteria(rubricWeights, criteriaScores);
        return new JudgeScore(
                judgeId,
                judgeName,
                Map.copyOf(criteriaScores),
                weightedOverall(rubricWeights, criteriaScores),
                feedback,
                submittedAt
        );
    }

    /**
     * Σ(score·weight)/Σ(weight); plain mean when the weights sum to zero.
     */
    public static double weightedOverall(Map<String, Double> rubricWeights, Map<String, Double> criteriaScores) {
        if (criteriaScores.isEmpty()) {
            return 0.0;
        }
        double weightedTotal = 0.0;
        double totalWeight = 0.0;
        double plainTotal = 0.0;
        for (Map.Entry<String, Double> entry : criteriaScores.entrySet()) {
            double weight = rubricWeights == null
                    ? CompetitionTermsJsonCodec.DEFAULT_CRITERION_WEIGHT
                    : rubricWeights.getOrDefault(entry.getKey(), CompetitionTermsJsonCodec.DEFAULT_CRITERION_WEIGHT);
            weightedTotal += entry.getValue() * weight;
            totalWeight += weight;
            plainTotal += entry.getValue();
        }
        if (totalWeight == 0.0) {
            return plainTotal / criteriaScores.size();
        }
        return weightedTotal / totalWeight;
    }

    private static void validateCriteria(Map<String, Double> rubricWeights, Map<String, Double> criteriaScores) {
        TreeSet<String> expected = new TreeSet<>(rubricWeights.keySet());
        TreeSet<String> missing = new TreeSet<>(expected);
        missing.removeAll(criteriaScores.keySet());
        TreeSet<String> unknown = new TreeSet<>(criteriaScores.keySet());
        unknown.removeAll(expected);

        if (!missing.isEmpty() || !unknown.isEmpty()) {
            List<String> parts = new ArrayList<>(2);
            if (!missing.isEmpty()) {
                parts.add("Missing criteria: " + String.join(", ", missing) + ".");
            }
            if (!unknown.isEmpty()) {
                parts.add("Unknown criteria: " + String.join(", ", unknown) + ".");
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("missing", List.copyOf(missing));
            details.put("extra", List.copyOf(unknown));
            details.put("expected", List.copyOf(expected));
            throw SettlementException.validationFailed(
                    "Criteria mismatch. " + String.join(" ", parts) + " Expected: " + String.join(", ", expected),
                    details
            );
        }

        for (Map.Entry<String, Double> entry : criteriaScores.entrySet()) {
            Double value = entry.getValue();
            if (value == null || value.isNaN() || value < MIN_SCORE || value > MAX_SCORE) {
                throw SettlementException.validationFailed(
                        "Score for '" + entry.getKey() + "' must be between 0 and 10",
                        Map.of("criterion", entry.getKey())
                );
            }
        }
    }
}
