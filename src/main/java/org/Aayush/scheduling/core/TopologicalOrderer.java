package org.Aayush.scheduling.core;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.Aayush.scheduling.graph.CompatibilityGraph;

/**
 * Kahn's algorithm with FIFO tie-breaking.
 *
 * <p>Roots are enqueued by increasing vertex index; a target is enqueued the
 * moment its remaining in-degree reaches zero, and out-edges are scanned by
 * increasing target index, so simultaneous zeros also enter in index order.
 * The queue choice only affects which of several equally optimal schedules is
 * reported.</p>
 */
final class TopologicalOrderer {
    static final String REASON_ORDER_INCOMPLETE = "WIS_TOPOLOGICAL_ORDER_INCOMPLETE";

    /**
     * Computes one topological order of all graph vertices.
     *
     * @throws InvariantViolationException when some vertex was never released (cycle).
     */
    int[] order(CompatibilityGraph graph) {
        int n = graph.vertexCount();
        int[] remaining = graph.copyInDegrees();
        IntArrayFIFOQueue ready = new IntArrayFIFOQueue(Math.max(n, 1));
        for (int v = 0; v < n; v++) {
            if (remaining[v] == 0) {
                ready.enqueue(v);
            }
        }

        int[] order = new int[n];
        int placed = 0;
        while (!ready.isEmpty()) {
            int u = ready.dequeueInt();
            order[placed++] = u;
            int end = graph.outEdgeEnd(u);
            for (int e = graph.firstOutEdge(u); e < end; e++) {
                int v = graph.edgeTarget(e);
                if (--remaining[v] == 0) {
                    ready.enqueue(v);
                }
            }
        }

        if (placed != n) {
            throw new InvariantViolationException(
                    REASON_ORDER_INCOMPLETE,
                    "topological order placed " + placed + " of " + n + " vertices; compatibility graph is cyclic"
            );
        }
        return order;
    }
}
