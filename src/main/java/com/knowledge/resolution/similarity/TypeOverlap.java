package com.knowledge.resolution.similarity;

import java.util.Set;

/**
 * Type compatibility gate.
 * A mention with no declared types overlaps with nothing, not even another untyped mention.
 */
public final class TypeOverlap {

    private TypeOverlap() {
    }

    public static boolean overlaps(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String type : smaller) {
            if (larger.contains(type)) {
                return true;
            }
        }
        return false;
    }
}
