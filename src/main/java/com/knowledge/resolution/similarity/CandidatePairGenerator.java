package com.knowledge.resolution.similarity;

import com.knowledge.resolution.core.model.EntityMention;

import java.util.List;

/**
 * Chooses which mention pairs get scored during clustering.
 * Each pair is reported at most once, as input positions {@code i < j}.
 */
public interface CandidatePairGenerator {

    void generate(List<EntityMention> mentions, PairVisitor visitor);

    @FunctionalInterface
    interface PairVisitor {
        void visit(int i, int j);
    }
}
