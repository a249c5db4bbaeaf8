package com.knowledge.resolution.graph;

/**
 * Disjoint-set forest over dense indices {@code 0..n-1}, with path compression and
 * union by rank.
 */
final class UnionFind {

    private final int[] parent;
    private final byte[] rank;
    private int components;

    UnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.parent = new int[size];
        this.rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        this.components = size;
    }

    int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return true if they were in different sets
     */
    boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
        components--;
        return true;
    }

    boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    int size() {
        return parent.length;
    }

    int componentCount() {
        return components;
    }
}
