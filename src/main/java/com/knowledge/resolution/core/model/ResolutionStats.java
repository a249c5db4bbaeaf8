package com.knowledge.resolution.core.model;

/**
 * Summary counts of one resolution build.
 * {@code resolvedCount} and {@code clusterCount} are always equal; both are kept
 * because downstream consumers read either name.
 */
public record ResolutionStats(int mentionCount, int relationCount, int clusterCount, int resolvedCount) {

    public ResolutionStats {
        if (mentionCount < 0 || relationCount < 0 || clusterCount < 0 || resolvedCount < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (clusterCount != resolvedCount) {
            throw new IllegalArgumentException(
                    "clusterCount (" + clusterCount + ") must equal resolvedCount (" + resolvedCount + ")");
        }
        if (clusterCount > mentionCount) {
            throw new IllegalArgumentException("clusterCount cannot exceed mentionCount");
        }
    }

    /**
     * Number of mentions that were folded into another mention's canonical ID.
     */
    public int mergedMentionCount() {
        return mentionCount - clusterCount;
    }
}
