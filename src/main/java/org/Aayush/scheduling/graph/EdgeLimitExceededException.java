package org.Aayush.scheduling.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised by {@link CompatibilityGraph#build(java.util.List, int)} when the
 * counting pass finds more edges than allowed.
 */
@Getter
@Accessors(fluent = true)
public final class EdgeLimitExceededException extends RuntimeException {
    /** Edges counted when construction stopped; a lower bound when {@code partial}. */
    private final long countedEdges;
    private final int limit;
    /** Whether counting stopped before visiting every vertex. */
    private final boolean partial;

    EdgeLimitExceededException(long countedEdges, int limit, boolean partial) {
        super("edge count " + (partial ? "at least " : "") + countedEdges + " exceeds limit " + limit);
        this.countedEdges = countedEdges;
        this.limit = limit;
        this.partial = partial;
    }
}
