package com.knowledge.resolution.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnionFind Tests")
class UnionFindTest {

    @Test
    @DisplayName("Every index starts in its own set")
    void singletons() {
        UnionFind sets = new UnionFind(4);

        assertEquals(4, sets.size());
        assertEquals(4, sets.componentCount());
        for (int i = 0; i < 4; i++) {
            assertEquals(i, sets.find(i));
        }
    }

    @Test
    @DisplayName("Union is transitive and reports whether it merged")
    void transitiveUnion() {
        UnionFind sets = new UnionFind(5);

        assertTrue(sets.union(0, 1));
        assertTrue(sets.union(1, 2));
        assertFalse(sets.union(0, 2));

        assertTrue(sets.connected(0, 2));
        assertFalse(sets.connected(0, 3));
        assertEquals(3, sets.componentCount());
    }

    @Test
    @DisplayName("Long chains collapse to one root")
    void longChain() {
        UnionFind sets = new UnionFind(1000);
        for (int i = 1; i < 1000; i++) {
            sets.union(i - 1, i);
        }

        int root = sets.find(999);
        for (int i = 0; i < 1000; i++) {
            assertEquals(root, sets.find(i));
        }
        assertEquals(1, sets.componentCount());
    }

    @Test
    @DisplayName("Empty forest is allowed, negative size is not")
    void sizes() {
        assertEquals(0, new UnionFind(0).componentCount());
        assertThrows(IllegalArgumentException.class, () -> new UnionFind(-1));
    }
}
