package org.Aayush.scheduling.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-solve bounds on graph size.
 *
 * <p>Graph construction is quadratic in the interval count, so callers facing
 * untrusted input can cap both the vertex count (checked before the graph is
 * built) and the edge count (checked by the graph's counting pass, before any
 * edge storage is allocated).</p>
 */
public final class SolveBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_INTERVALS_EXCEEDED = "WIS_BUDGET_INTERVALS_EXCEEDED";

    static final String PROP_MAX_INTERVALS = "wis.solver.maxIntervals";
    static final String PROP_MAX_EDGES = "wis.solver.maxEdges";

    private static final Logger LOG = LoggerFactory.getLogger(SolveBudget.class);

    private final int maxIntervals;
    private final int maxEdges;

    private SolveBudget(int maxIntervals, int maxEdges) {
        this.maxIntervals = normalizeBound(maxIntervals);
        this.maxEdges = normalizeBound(maxEdges);
    }

    /**
     * Creates a budget with explicit bounds. Non-positive bounds mean unbounded.
     */
    public static SolveBudget of(int maxIntervals, int maxEdges) {
        return new SolveBudget(maxIntervals, maxEdges);
    }

    /**
     * Returns a budget without limits.
     */
    public static SolveBudget unbounded() {
        return new SolveBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties; missing or malformed values are unbounded.
     */
    public static SolveBudget defaults() {
        return SolveBudget.of(readBound(PROP_MAX_INTERVALS), readBound(PROP_MAX_EDGES));
    }

    public int maxIntervals() {
        return maxIntervals;
    }

    public int maxEdges() {
        return maxEdges;
    }

    /**
     * Validates interval count before graph construction.
     */
    void checkIntervalCount(int intervalCount) {
        if (intervalCount > maxIntervals) {
            throw new BudgetExceededException(
                    REASON_INTERVALS_EXCEEDED,
                    "interval budget exceeded: " + intervalCount + " > " + maxIntervals
            );
        }
    }

    @Override
    public String toString() {
        return "SolveBudget[maxIntervals=" + describe(maxIntervals) + ", maxEdges=" + describe(maxEdges) + "]";
    }

    private static String describe(int bound) {
        return bound == UNBOUNDED ? "unbounded" : Integer.toString(bound);
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring malformed {}={}; using unbounded", property, raw);
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
