package org.Aayush.scheduling.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Walks predecessor links back from the selected endpoint.
 */
final class PathReconstructor {
    static final String REASON_PREDECESSOR_CHAIN = "WIS_PREDECESSOR_CHAIN_BROKEN";

    /**
     * Rebuilds the winning vertex path in schedule order.
     *
     * @return vertex indices from first to last interval (empty when there is no endpoint).
     */
    int[] reconstruct(LongestPathSolver.Relaxation relaxation) {
        int[] predecessor = relaxation.predecessor();
        IntArrayList reversed = new IntArrayList();
        int vertex = relaxation.bestVertex();
        while (vertex != LongestPathSolver.NONE) {
            if (reversed.size() >= predecessor.length) {
                throw new InvariantViolationException(
                        REASON_PREDECESSOR_CHAIN,
                        "predecessor chain longer than vertex count " + predecessor.length
                );
            }
            reversed.add(vertex);
            vertex = predecessor[vertex];
        }

        int length = reversed.size();
        int[] path = new int[length];
        for (int i = 0; i < length; i++) {
            path[i] = reversed.getInt(length - 1 - i);
        }
        return path;
    }
}
