package com.digitalgroup.reportscheduler.job;

import com.digitalgroup.reportscheduler.domain.common.enums.Priority;

/**
 * Queue entry of the dispatch pool: higher priority first, then submission order.
 */
public final class PrioritizedTask implements Runnable, Comparable<PrioritizedTask> {

    private final Priority priority;
    private final long sequence;
    private final Runnable delegate;

    public PrioritizedTask(Priority priority, long sequence, Runnable delegate) {
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.sequence = sequence;
        this.delegate = delegate;
    }

    @Override
    public void run() {
        delegate.run();
    }

    @Override
    public int compareTo(PrioritizedTask other) {
        int byPriority = Integer.compare(other.priority.getValue(), priority.getValue());
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }

    public Priority getPriority() {
        return priority;
    }
}
