package org.Aayush.scheduling.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.scheduling.interval.Interval;

import java.util.List;

/**
 * Client-facing schedule result.
 *
 * <p>An empty input yields an empty schedule with {@code totalCost = 0}.</p>
 */
@Value
@Builder
public class ScheduleResponse {
    /** Chosen intervals in schedule order (pairwise non-overlapping). */
    @Singular
    List<Interval> intervals;
    /** Sum of the chosen intervals' weights. */
    double totalCost;
    /** Number of intervals in the solved snapshot. */
    int intervalCount;
    /** Number of compatibility edges in the solved graph. */
    int edgeCount;
    /** Number of intervals no other interval can precede. */
    int rootCount;

    /**
     * Returns the number of chosen intervals.
     */
    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }
}
