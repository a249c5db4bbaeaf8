package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;

import java.util.List;

/**
 * Deterministic rule for picking a cluster's representative mention.
 * Both rules depend only on cluster membership and input order, so identical
 * input always yields identical canonical IDs.
 */
public enum CanonicalSelection {

    /**
     * The member that appears first in input order.
     */
    FIRST_SEEN {
        @Override
        public int select(List<Integer> members, List<EntityMention> mentions) {
            int best = Integer.MAX_VALUE;
            for (int member : members) {
                best = Math.min(best, member);
            }
            return best;
        }
    },

    /**
     * The member with the longest surface text, usually the most complete name.
     * Ties go to the member that appears first in input order.
     */
    LONGEST_MENTION {
        @Override
        public int select(List<Integer> members, List<EntityMention> mentions) {
            int best = -1;
            int bestLength = -1;
            for (int member : members) {
                int length = mentions.get(member).getMention().length();
                if (length > bestLength || (length == bestLength && member < best)) {
                    best = member;
                    bestLength = length;
                }
            }
            return best;
        }
    };

    /**
     * Picks the representative of a non-empty cluster.
     *
     * @param members  input positions of the cluster's mentions
     * @param mentions all mentions of the batch, in input order
     * @return input position of the representative
     */
    public abstract int select(List<Integer> members, List<EntityMention> mentions);
}
