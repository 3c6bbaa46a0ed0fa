package org.Aayush.scheduling.interval;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion point for weighted intervals.
 *
 * <p>Accepted intervals keep their insertion order; that order is the vertex
 * numbering every downstream stage uses for deterministic tie-breaking. A
 * rejected add throws and leaves the store untouched.</p>
 *
 * <p>With {@code mergeDuplicates} enabled, re-adding an existing
 * {@code (start, finish)} span keeps one interval at the original index and
 * raises its weight to the larger of the two.</p>
 *
 * <p>This class is a mutable builder and is NOT thread-safe. Solvers consume
 * {@link #snapshot()} and never read the live store.</p>
 */
public final class IntervalStore {
    private static final int NOT_PRESENT = -1;

    /**
     * Duplicate-lookup key. Record equality compares doubles bitwise, so
     * {@code -0.0} is folded into {@code 0.0}.
     */
    private record Span(double start, double finish) {
        static Span of(double start, double finish) {
            return new Span(start + 0.0d, finish + 0.0d);
        }
    }

    private final List<Interval> intervals = new ArrayList<>();
    private final boolean mergeDuplicates;
    private final Object2IntOpenHashMap<Span> indexBySpan;
    private int attempts;

    /**
     * Creates an empty store with one vertex per accepted add.
     */
    public IntervalStore() {
        this(false);
    }

    /**
     * Creates an empty store.
     *
     * @param mergeDuplicates whether identical spans collapse into one interval.
     */
    public IntervalStore(boolean mergeDuplicates) {
        this.mergeDuplicates = mergeDuplicates;
        if (mergeDuplicates) {
            this.indexBySpan = new Object2IntOpenHashMap<>();
            this.indexBySpan.defaultReturnValue(NOT_PRESENT);
        } else {
            this.indexBySpan = null;
        }
    }

    /**
     * Validates and appends one interval.
     *
     * @return vertex index of the stored interval.
     * @throws IntervalValidationException when the triple is rejected.
     */
    public int add(double start, double finish, double weight) {
        return add(start, finish, weight, null);
    }

    /**
     * Validates and appends one interval, tagging failures with a source label.
     *
     * @param sourceLabel input identity for error reporting, for example {@code "line 3"}.
     * @return vertex index of the stored interval.
     * @throws IntervalValidationException when the triple is rejected.
     */
    public int add(double start, double finish, double weight, String sourceLabel) {
        int position = attempts++;
        IntervalCheck check = Interval.check(start, finish, weight);
        if (!check.valid()) {
            throw new IntervalValidationException(check.violation(), position, sourceLabel, start, finish, weight);
        }

        Interval interval = check.interval();
        if (mergeDuplicates) {
            Span span = Span.of(start, finish);
            int existing = indexBySpan.getInt(span);
            if (existing != NOT_PRESENT) {
                intervals.set(existing, intervals.get(existing).withMaxWeight(weight));
                return existing;
            }
            indexBySpan.put(span, intervals.size());
        }
        intervals.add(interval);
        return intervals.size() - 1;
    }

    /**
     * Returns the interval stored at one vertex index.
     */
    public Interval get(int index) {
        return intervals.get(index);
    }

    /**
     * Returns the number of stored intervals.
     */
    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean mergesDuplicates() {
        return mergeDuplicates;
    }

    /**
     * Returns an immutable copy of the current contents in insertion order.
     */
    public List<Interval> snapshot() {
        return List.copyOf(intervals);
    }
}
