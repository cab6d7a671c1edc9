package com.seedling.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-judge scores for one submission plus the plain mean of their overalls.
 */
public record ScoreAggregate(
        List<JudgeScore> judges,
        double average
) {

    public ScoreAggregate {
        judges = List.copyOf(judges);
    }

    public static ScoreAggregate empty() {
        return new ScoreAggregate(List.of(), 0.0);
    }

    /**
     * Replaces the entry with the same judge id, or appends it, then recomputes the average.
     */
    public ScoreAggregate upsert(JudgeScore judgeScore) {
        List<JudgeScore> updated = new ArrayList<>(judges.size() + 1);
        boolean replaced = false;
        for (JudgeScore existing : judges) {
            if (existing.judgeId().equals(judgeScore.judgeId())) {
                updated.add(judgeScore);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(judgeScore);
        }
        return new ScoreAggregate(updated, meanOverall(updated));
    }

    static double meanOverall(List<JudgeScore> judges) {
        if (judges.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (JudgeScore judge : judges) {
            total += judge.overall();
        }
        return total / judges.size();
    }
}
