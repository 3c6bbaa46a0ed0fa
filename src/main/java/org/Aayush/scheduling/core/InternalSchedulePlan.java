package org.Aayush.scheduling.core;

/**
 * Internal solve output in vertex-index space.
 *
 * @param vertexPath chosen vertices in schedule order (empty when there are no intervals).
 * @param totalCost best cost at the path endpoint ({@code 0} when empty).
 * @param vertexCount number of vertices in the solved graph.
 * @param edgeCount number of compatibility edges.
 * @param rootCount number of vertices without predecessors.
 */
record InternalSchedulePlan(
        int[] vertexPath,
        double totalCost,
        int vertexCount,
        int edgeCount,
        int rootCount
) {
    /**
     * Creates the canonical plan for an empty interval set.
     */
    static InternalSchedulePlan empty() {
        return new InternalSchedulePlan(new int[0], 0.0d, 0, 0, 0);
    }
}
