package org.Aayush.scheduling.core;

import org.Aayush.scheduling.graph.CompatibilityGraph;
import org.Aayush.scheduling.interval.Interval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LongestPathSolver Tests")
class LongestPathSolverTest {

    private final TopologicalOrderer orderer = new TopologicalOrderer();
    private final LongestPathSolver solver = new LongestPathSolver();

    private LongestPathSolver.Relaxation relax(List<Interval> intervals) {
        CompatibilityGraph graph = CompatibilityGraph.build(intervals);
        return solver.solve(graph, orderer.order(graph));
    }

    @Test
    @DisplayName("Costs accumulate vertex weights along compatible chains")
    void testChainCosts() {
        LongestPathSolver.Relaxation relaxation = relax(List.of(
                Interval.of(10, 20, 2),
                Interval.of(20, 30, 2),
                Interval.of(15, 25, 5),
                Interval.of(-17, -6, 1.1)
        ));

        assertEquals(3.1, relaxation.bestCost()[0], 1e-9);
        assertEquals(5.1, relaxation.bestCost()[1], 1e-9);
        assertEquals(6.1, relaxation.bestCost()[2], 1e-9);
        assertEquals(1.1, relaxation.bestCost()[3], 1e-9);
        assertArrayEquals(new int[]{3, 0, 3, LongestPathSolver.NONE}, relaxation.predecessor());
        assertEquals(2, relaxation.bestVertex());
        assertEquals(6.1, relaxation.bestTotal(), 1e-9);
    }

    @Test
    @DisplayName("Strict relaxation keeps the first predecessor on equal cost")
    void testStrictRelaxationTie() {
        LongestPathSolver.Relaxation relaxation = relax(List.of(
                Interval.of(0, 1, 2),
                Interval.of(0, 1, 2),
                Interval.of(1, 2, 1)
        ));
        assertEquals(3.0, relaxation.bestCost()[2]);
        assertEquals(0, relaxation.predecessor()[2]);
        assertEquals(2, relaxation.bestVertex());
    }

    @Test
    @DisplayName("Final scan prefers the smallest index among equal best costs")
    void testSmallestIndexTie() {
        LongestPathSolver.Relaxation relaxation = relax(List.of(
                Interval.of(2, 12, 5),
                Interval.of(0, 10, 5)
        ));
        assertEquals(0, relaxation.bestVertex());
    }

    @Test
    @DisplayName("Empty graph has no endpoint and zero cost")
    void testEmpty() {
        LongestPathSolver.Relaxation relaxation = relax(List.of());
        assertEquals(LongestPathSolver.NONE, relaxation.bestVertex());
        assertEquals(0.0, relaxation.bestTotal());
    }

    @Test
    @DisplayName("Truncated order is an invariant violation")
    void testTruncatedOrder() {
        CompatibilityGraph graph = CompatibilityGraph.build(List.of(Interval.of(0, 1, 1), Interval.of(1, 2, 1)));
        InvariantViolationException ex = assertThrows(
                InvariantViolationException.class,
                () -> solver.solve(graph, new int[]{0})
        );
        assertEquals(TopologicalOrderer.REASON_ORDER_INCOMPLETE, ex.reasonCode());
    }
}
