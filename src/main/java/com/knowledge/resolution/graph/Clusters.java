package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.ResolutionMethod;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Partition of one batch's mentions into equivalence classes, plus the match edges
 * that produced it. Exists only while a graph is being built.
 *
 * <p>Clusters are ordered by their first member's input position; members within a
 * cluster are in ascending input order. Every mention belongs to exactly one cluster.</p>
 */
public final class Clusters {

    private final List<EntityMention> mentions;
    private final List<List<Integer>> members;
    private final int[] clusterOf;
    private final List<MatchEdge> edges;

    Clusters(List<EntityMention> mentions, List<List<Integer>> members, int[] clusterOf, List<MatchEdge> edges) {
        this.mentions = mentions;
        this.members = members;
        this.clusterOf = clusterOf;
        this.edges = edges;
    }

    public List<EntityMention> mentions() {
        return mentions;
    }

    public int size() {
        return members.size();
    }

    /**
     * Input positions of the members of cluster {@code cluster}.
     */
    public List<Integer> members(int cluster) {
        return members.get(cluster);
    }

    /**
     * Cluster index of the mention at input position {@code mention}.
     */
    public int clusterOf(int mention) {
        return clusterOf[mention];
    }

    /**
     * Lowest match score among all matching pairs inside the cluster; 1.0 when the cluster has no edges.
     */
    public double minSimilarity(int cluster) {
        double min = 1.0;
        for (MatchEdge edge : edges) {
            if (clusterOf[edge.a()] == cluster) {
                min = Math.min(min, edge.score());
            }
        }
        return min;
    }

    /**
     * Signals behind all matching pairs inside the cluster.
     */
    public Set<ResolutionMethod> methods(int cluster) {
        Set<ResolutionMethod> methods = EnumSet.noneOf(ResolutionMethod.class);
        for (MatchEdge edge : edges) {
            if (clusterOf[edge.a()] == cluster) {
                methods.add(edge.method());
            }
        }
        return methods;
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * A pair of mentions judged equivalent.
     */
    record MatchEdge(int a, int b, ResolutionMethod method, double score) {
    }
}
