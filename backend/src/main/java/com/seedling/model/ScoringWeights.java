package com.seedling.model;

/**
 * Blend of AI and human judge averages used for {@link Submission#getFinalScore()}.
 */
public final class ScoringWeights {

    public static final double AI_WEIGHT = 0.0;
    public static final double HUMAN_WEIGHT = 1.0;

    private ScoringWeights() {
    }
}
