package com.seedling.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Orders submissions and assigns ranks with tie detection.
 * Fully judged entries sort first, then final score descending (unscored last), then submission id.
 * Scored entries take their 1-based position among scored entries, or share the previous rank when
 * their score is equal to it. Unscored entries get {@link #UNRANKED}.
 */
@Component
public class LeaderboardRanker {

    public static final int UNRANKED = 999;

    private static final Comparator<RankingCandidate> ORDERING = Comparator
            .comparing(RankingCandidate::judgingComplete, Comparator.<Boolean>reverseOrder())
            .thenComparing(RankingCandidate::finalScore, Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
            .thenComparing(candidate -> candidate.submissionId().toString());

    public List<RankedEntry> rank(Collection<RankingCandidate> candidates) {
        List<RankingCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(ORDERING);

        int size = sorted.size();
        int[] ranks = new int[size];
        boolean[] ties = new boolean[size];

        int scoredSeen = 0;
        int previousIndex = -1;
        for (int i = 0; i < size; i++) {
            BigDecimal score = sorted.get(i).finalScore();
            if (score == null) {
                ranks[i] = UNRANKED;
                continue;
            }
            scoredSeen++;
            if (previousIndex >= 0 && score.compareTo(sorted.get(previousIndex).finalScore()) == 0) {
                ranks[i] = ranks[previousIndex];
                ties[i] = true;
                ties[previousIndex] = true;
            } else {
                ranks[i] = scoredSeen;
            }
            previousIndex = i;
        }

        List<RankedEntry> ranked = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ranked.add(new RankedEntry(sorted.get(i), ranks[i], ties[i]));
        }
        return ranked;
    }

    public record RankingCandidate(
            UUID submissionId,
            BigDecimal finalScore,
            int judgesAssigned,
            int judgesCompleted
    ) {
        public boolean judgingComplete() {
            return judgesAssigned > 0 && judgesCompleted == judgesAssigned;
        }
    }

    public record RankedEntry(
            RankingCandidate candidate,
            int rank,
            boolean hasTie
    ) {
    }
}
