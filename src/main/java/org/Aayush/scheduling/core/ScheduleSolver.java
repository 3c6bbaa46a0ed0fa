package org.Aayush.scheduling.core;

import lombok.Builder;
import org.Aayush.scheduling.graph.CompatibilityGraph;
import org.Aayush.scheduling.graph.EdgeLimitExceededException;
import org.Aayush.scheduling.interval.Interval;
import org.Aayush.scheduling.interval.IntervalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main weighted-interval scheduling entry point.
 *
 * <p>Execution flow per call:</p>
 * <ul>
 * <li>Snapshot the interval store (or validate raw triples into a fresh store).</li>
 * <li>Enforce the interval budget, then build the {@link CompatibilityGraph};
 * the edge budget stops construction before the edge array is allocated.</li>
 * <li>Compute a FIFO Kahn topological order.</li>
 * <li>Relax vertices in that order and pick the best endpoint.</li>
 * <li>Rebuild the winning path and map vertex indices back to intervals.</li>
 * </ul>
 *
 * <p>The solver holds only immutable configuration. All graph, cost and
 * predecessor state is allocated per call, so one instance may serve
 * concurrent callers.</p>
 */
public final class ScheduleSolver implements SchedulerService {
    public static final String REASON_STORE_REQUIRED = "WIS_STORE_REQUIRED";
    public static final String REASON_TRIPLES_REQUIRED = "WIS_TRIPLES_REQUIRED";
    public static final String REASON_TRIPLE_SHAPE = "WIS_TRIPLE_SHAPE";
    public static final String REASON_INTERVAL_BUDGET_EXCEEDED = "WIS_INTERVAL_BUDGET_EXCEEDED";
    public static final String REASON_EDGE_BUDGET_EXCEEDED = "WIS_EDGE_BUDGET_EXCEEDED";

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleSolver.class);

    private final SolveBudget budget;
    private final TopologicalOrderer orderer = new TopologicalOrderer();
    private final LongestPathSolver longestPathSolver = new LongestPathSolver();
    private final PathReconstructor pathReconstructor = new PathReconstructor();

    /**
     * Creates a solver with budgets loaded from system properties.
     */
    public ScheduleSolver() {
        this(null);
    }

    /**
     * Creates a solver.
     *
     * @param budget optional graph-size budget; defaults to {@link SolveBudget#defaults()}.
     */
    @Builder
    public ScheduleSolver(SolveBudget budget) {
        this.budget = budget == null ? SolveBudget.defaults() : budget;
    }

    /**
     * Solves the store's contents as of this call.
     *
     * @throws SchedulingException when the store is missing or a budget is exceeded.
     */
    @Override
    public ScheduleResponse solve(IntervalStore store) {
        if (store == null) {
            throw new SchedulingException(REASON_STORE_REQUIRED, "interval store must be provided");
        }
        return solveSnapshot(store.snapshot());
    }

    /**
     * Validates the triples in order and solves them.
     *
     * @throws SchedulingException when the array or a row is malformed, or a budget is exceeded.
     * @throws org.Aayush.scheduling.interval.IntervalValidationException on the first invalid triple.
     */
    @Override
    public ScheduleResponse solve(double[][] triples) {
        if (triples == null) {
            throw new SchedulingException(REASON_TRIPLES_REQUIRED, "triples must be provided");
        }
        IntervalStore store = new IntervalStore();
        for (int i = 0; i < triples.length; i++) {
            double[] row = triples[i];
            if (row == null || row.length != 3) {
                throw new SchedulingException(
                        REASON_TRIPLE_SHAPE,
                        "triple #" + i + " must hold exactly 3 values (start, finish, weight)"
                );
            }
            store.add(row[0], row[1], row[2], "triple #" + i);
        }
        return solveSnapshot(store.snapshot());
    }

    /**
     * Exposes the effective budget.
     */
    public SolveBudget budget() {
        return budget;
    }

    private ScheduleResponse solveSnapshot(List<Interval> snapshot) {
        InternalSchedulePlan plan = computeInternal(snapshot);

        ScheduleResponse.ScheduleResponseBuilder builder = ScheduleResponse.builder()
                .totalCost(plan.totalCost())
                .intervalCount(plan.vertexCount())
                .edgeCount(plan.edgeCount())
                .rootCount(plan.rootCount());
        for (int vertex : plan.vertexPath()) {
            builder.interval(snapshot.get(vertex));
        }
        ScheduleResponse response = builder.build();

        LOG.debug("Solved {} intervals ({} edges, {} roots): chose {} with total cost {}",
                plan.vertexCount(), plan.edgeCount(), plan.rootCount(), response.size(), plan.totalCost());
        return response;
    }

    /**
     * Runs the graph pipeline on one immutable snapshot.
     *
     * <p>Budget exceptions are normalized to facade reason codes; invariant
     * violations propagate untouched.</p>
     */
    InternalSchedulePlan computeInternal(List<Interval> snapshot) {
        if (snapshot.isEmpty()) {
            return InternalSchedulePlan.empty();
        }
        try {
            budget.checkIntervalCount(snapshot.size());
        } catch (SolveBudget.BudgetExceededException ex) {
            throw new SchedulingException(
                    REASON_INTERVAL_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        CompatibilityGraph graph;
        try {
            graph = CompatibilityGraph.build(snapshot, budget.maxEdges());
        } catch (EdgeLimitExceededException ex) {
            throw new SchedulingException(
                    REASON_EDGE_BUDGET_EXCEEDED,
                    "edge budget exceeded: " + ex.getMessage(),
                    ex
            );
        }

        int[] order = orderer.order(graph);
        LongestPathSolver.Relaxation relaxation = longestPathSolver.solve(graph, order);
        int[] path = pathReconstructor.reconstruct(relaxation);
        return new InternalSchedulePlan(
                path,
                relaxation.bestTotal(),
                graph.vertexCount(),
                graph.edgeCount(),
                graph.rootCount()
        );
    }
}
