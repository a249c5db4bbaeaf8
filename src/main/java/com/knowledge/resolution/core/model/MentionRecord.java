package com.knowledge.resolution.core.model;

import java.util.Objects;

/**
 * Provenance of one original mention under its canonical entity.
 *
 * @param mentionId  the originating mention ID
 * @param text       the raw surface text
 * @param chunkIndex source chunk the mention came from
 * @param confidence similarity of this mention to its canonical mention, 0.0 to 1.0
 * @param method     signal that tied this mention to the canonical mention
 */
public record MentionRecord(
        String mentionId,
        String text,
        int chunkIndex,
        double confidence,
        ResolutionMethod method
) {
    public MentionRecord {
        Objects.requireNonNull(mentionId, "mentionId is required");
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(method, "method is required");
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0, got " + chunkIndex);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
    }
}
