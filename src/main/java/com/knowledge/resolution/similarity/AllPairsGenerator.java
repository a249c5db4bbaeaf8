package com.knowledge.resolution.similarity;

import com.knowledge.resolution.core.model.EntityMention;

import java.util.List;

/**
 * Every unordered pair of distinct mentions, in input order. O(n^2) comparisons.
 */
public class AllPairsGenerator implements CandidatePairGenerator {

    @Override
    public void generate(List<EntityMention> mentions, PairVisitor visitor) {
        int n = mentions.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                visitor.visit(i, j);
            }
        }
    }
}
