package org.Aayush.scheduling.core;

import org.Aayush.scheduling.interval.IntervalStore;

/**
 * Public weighted-interval scheduling contract.
 *
 * <p>Implementations must treat every call as pure with respect to its input
 * snapshot: no state is shared between calls, so a caller may run solves
 * concurrently or discard a superseded result without coordination.</p>
 */
public interface SchedulerService {
    /**
     * Solves the current contents of an interval store.
     *
     * @param store interval store; its contents are snapshotted at call time.
     * @return maximum-weight non-overlapping schedule.
     */
    ScheduleResponse solve(IntervalStore store);

    /**
     * Validates and solves an ordered sequence of {@code {start, finish, weight}} triples.
     *
     * @param triples input rows; the first invalid row aborts the call.
     * @return maximum-weight non-overlapping schedule.
     */
    ScheduleResponse solve(double[][] triples);
}
