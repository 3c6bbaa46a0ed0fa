package org.Aayush.scheduling.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.scheduling.interval.Interval;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Vertex-weighted forward-compatibility DAG over one interval snapshot.
 *
 * <p>Vertex {@code i} is the {@code i}-th interval of the snapshot. Edge
 * {@code u -> v} exists iff {@code finish(u) <= start(v)}. Because every
 * interval has positive length the graph is acyclic and has no self-loops.</p>
 *
 * <p>Layout:</p>
 * <ul>
 * <li>CSR (Compressed Sparse Row): {@code firstEdge[v]..firstEdge[v + 1]} is the
 * out-edge range of {@code v} inside {@code edgeTarget}.</li>
 * <li>Targets inside one range are sorted by increasing vertex index.</li>
 * <li>In-degrees are precomputed; callers that consume them get a copy.</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared across threads, but each solve
 * builds its own graph.</p>
 */
public final class CompatibilityGraph {
    /** Largest edge count the CSR target array can hold. */
    public static final int MAX_EDGES = Integer.MAX_VALUE - 8;

    private final double[] weights;
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final int[] inDegree;

    @Getter
    @Accessors(fluent = true)
    private final int vertexCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private CompatibilityGraph(double[] weights, int[] firstEdge, int[] edgeTarget, int[] inDegree) {
        this.weights = weights;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.inDegree = inDegree;
        this.vertexCount = weights.length;
        this.edgeCount = edgeTarget.length;
    }

    /**
     * Builds the compatibility graph for one finalized interval sequence.
     *
     * <p>O(n^2) time; up to n(n-1)/2 edges when all intervals are mutually disjoint.</p>
     *
     * @param intervals vertex-ordered intervals.
     * @return immutable graph.
     * @throws EdgeLimitExceededException when the edges do not fit in {@link #MAX_EDGES}.
     */
    public static CompatibilityGraph build(List<Interval> intervals) {
        return build(intervals, MAX_EDGES);
    }

    /**
     * Builds the graph, giving up during the counting pass once the edge count
     * passes {@code maxEdges}. Nothing edge-sized is allocated before the count
     * is known to fit.
     *
     * @param intervals vertex-ordered intervals.
     * @param maxEdges largest accepted edge count; values above {@link #MAX_EDGES} are clamped.
     * @return immutable graph.
     * @throws EdgeLimitExceededException when the count passes the limit.
     */
    public static CompatibilityGraph build(List<Interval> intervals, int maxEdges) {
        Objects.requireNonNull(intervals, "intervals");
        if (maxEdges < 0) {
            throw new IllegalArgumentException("maxEdges must be >= 0");
        }
        int limit = Math.min(maxEdges, MAX_EDGES);
        int n = intervals.size();

        double[] starts = new double[n];
        double[] finishes = new double[n];
        double[] weights = new double[n];
        for (int v = 0; v < n; v++) {
            Interval interval = Objects.requireNonNull(intervals.get(v), "intervals[" + v + "]");
            starts[v] = interval.getStart();
            finishes[v] = interval.getFinish();
            weights[v] = interval.getWeight();
        }

        // Pass 1: degrees.
        int[] outDegree = new int[n];
        int[] inDegree = new int[n];
        long total = 0L;
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                if (u != v && finishes[u] <= starts[v]) {
                    outDegree[u]++;
                    inDegree[v]++;
                }
            }
            total += outDegree[u];
            if (total > limit) {
                throw new EdgeLimitExceededException(total, limit, u + 1 < n);
            }
        }

        int[] firstEdge = new int[n + 1];
        int cursor = 0;
        for (int u = 0; u < n; u++) {
            firstEdge[u] = cursor;
            cursor += outDegree[u];
        }
        firstEdge[n] = cursor;

        // Pass 2: fill targets in increasing index order.
        int[] edgeTarget = new int[cursor];
        for (int u = 0; u < n; u++) {
            int position = firstEdge[u];
            for (int v = 0; v < n; v++) {
                if (u != v && finishes[u] <= starts[v]) {
                    edgeTarget[position++] = v;
                }
            }
        }
        return new CompatibilityGraph(weights, firstEdge, edgeTarget, inDegree);
    }

    /**
     * Returns the weight of one vertex.
     */
    public double weight(int vertex) {
        validateVertex(vertex);
        return weights[vertex];
    }

    /**
     * Returns the start index (inclusive) of one vertex's out-edge range.
     */
    public int firstOutEdge(int vertex) {
        validateVertex(vertex);
        return firstEdge[vertex];
    }

    /**
     * Returns the end index (exclusive) of one vertex's out-edge range.
     */
    public int outEdgeEnd(int vertex) {
        validateVertex(vertex);
        return firstEdge[vertex + 1];
    }

    /**
     * UNCHECKED - caller must pass an edge index from a valid out-edge range.
     */
    public int edgeTarget(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    public int outDegree(int vertex) {
        validateVertex(vertex);
        return firstEdge[vertex + 1] - firstEdge[vertex];
    }

    public int inDegree(int vertex) {
        validateVertex(vertex);
        return inDegree[vertex];
    }

    /**
     * Returns whether no interval can precede this vertex.
     */
    public boolean isRoot(int vertex) {
        return inDegree(vertex) == 0;
    }

    /**
     * Counts vertices with in-degree zero.
     */
    public int rootCount() {
        int roots = 0;
        for (int degree : inDegree) {
            if (degree == 0) {
                roots++;
            }
        }
        return roots;
    }

    /**
     * Returns a mutable copy of all in-degrees, indexed by vertex.
     */
    public int[] copyInDegrees() {
        return Arrays.copyOf(inDegree, inDegree.length);
    }

    /**
     * Visits out-neighbors of one vertex in increasing vertex index.
     */
    public void forEachOutNeighbor(int vertex, IntConsumer action) {
        int end = outEdgeEnd(vertex);
        for (int e = firstOutEdge(vertex); e < end; e++) {
            action.accept(edgeTarget[e]);
        }
    }

    @Override
    public String toString() {
        return String.format("CompatibilityGraph[vertices=%d, edges=%d, roots=%d]",
                vertexCount, edgeCount, rootCount());
    }

    private void validateVertex(int vertex) {
        if (vertex < 0 || vertex >= vertexCount) {
            throw new IndexOutOfBoundsException("vertex " + vertex + " out of bounds [0, " + vertexCount + ")");
        }
    }
}
