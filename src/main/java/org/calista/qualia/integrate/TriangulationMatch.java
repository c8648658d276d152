package org.calista.qualia.integrate;

import java.util.List;

/**
 * Patterns from the triangulation catalog that hold on one turn.
 */
public record TriangulationMatch(int turnId, List<TriangulationPattern> patterns, String preview) {
    public TriangulationMatch {
        patterns = List.copyOf(patterns);
    }

    public int count() {
        return patterns.size();
    }
}
