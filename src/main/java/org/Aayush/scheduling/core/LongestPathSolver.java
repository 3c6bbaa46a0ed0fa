package org.Aayush.scheduling.core;

import org.Aayush.scheduling.graph.CompatibilityGraph;

import java.util.Arrays;

/**
 * Maximum-weight path relaxation over a vertex-weighted DAG.
 *
 * <p>Every vertex starts as a one-vertex path ({@code bestCost[v] = weight(v)}),
 * which is equivalent to a virtual zero-cost super-root linked to all roots.
 * Relaxation is strict: the first predecessor to reach a cost keeps it.</p>
 */
final class LongestPathSolver {
    static final int NONE = -1;

    /**
     * Per-solve relaxation state.
     *
     * @param bestCost best path cost ending at each vertex.
     * @param predecessor previous vertex on that path, or {@link #NONE}.
     * @param bestVertex endpoint with maximal cost (smallest index on ties), or {@link #NONE} when empty.
     */
    record Relaxation(double[] bestCost, int[] predecessor, int bestVertex) {
        /**
         * Returns the overall best cost, {@code 0} for an empty graph.
         */
        double bestTotal() {
            return bestVertex == NONE ? 0.0d : bestCost[bestVertex];
        }
    }

    /**
     * Relaxes all vertices in the given topological order.
     *
     * @param graph compatibility graph.
     * @param topologicalOrder order produced by {@link TopologicalOrderer}.
     * @return cost/predecessor arrays and the selected endpoint.
     */
    Relaxation solve(CompatibilityGraph graph, int[] topologicalOrder) {
        int n = graph.vertexCount();
        if (topologicalOrder.length != n) {
            throw new InvariantViolationException(
                    TopologicalOrderer.REASON_ORDER_INCOMPLETE,
                    "order length " + topologicalOrder.length + " does not match vertex count " + n
            );
        }

        double[] bestCost = new double[n];
        int[] predecessor = new int[n];
        for (int v = 0; v < n; v++) {
            bestCost[v] = graph.weight(v);
        }
        Arrays.fill(predecessor, NONE);

        for (int u : topologicalOrder) {
            double costU = bestCost[u];
            int end = graph.outEdgeEnd(u);
            for (int e = graph.firstOutEdge(u); e < end; e++) {
                int v = graph.edgeTarget(e);
                double candidate = costU + graph.weight(v);
                if (candidate > bestCost[v]) {
                    bestCost[v] = candidate;
                    predecessor[v] = u;
                }
            }
        }

        return new Relaxation(bestCost, predecessor, selectBestVertex(bestCost));
    }

    /**
     * Returns the index of the maximal cost, preferring the smallest index on ties.
     */
    private static int selectBestVertex(double[] bestCost) {
        int best = NONE;
        for (int v = 0; v < bestCost.length; v++) {
            if (best == NONE || bestCost[v] > bestCost[best]) {
                best = v;
            }
        }
        return best;
    }
}
