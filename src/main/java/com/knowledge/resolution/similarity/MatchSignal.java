package com.knowledge.resolution.similarity;

import com.knowledge.resolution.core.model.ResolutionMethod;

/**
 * Outcome of comparing two mentions: whether they match, which signal fired, and its score.
 *
 * @param matched whether the pair is judged equivalent
 * @param method  the first signal that fired, or {@code null} when no signal fired
 * @param score   strength of the firing signal in [0, 1]; 0.0 when nothing fired
 */
public record MatchSignal(boolean matched, ResolutionMethod method, double score) {

    private static final MatchSignal NONE = new MatchSignal(false, null, 0.0);

    public MatchSignal {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        if (matched && method == null) {
            throw new IllegalArgumentException("a match needs a method");
        }
    }

    public static MatchSignal none() {
        return NONE;
    }

    public static MatchSignal match(ResolutionMethod method, double score) {
        return new MatchSignal(true, method, score);
    }

    /**
     * A signal that fired but was vetoed by the type gate.
     */
    MatchSignal rejected() {
        return new MatchSignal(false, method, score);
    }
}
