package com.pressplay.orchestration.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of the coordinator: the single active slot plus the bounded history log.
 * Every mutation produces a new instance so observers can compare by identity.
 */
@Value
public class CompressionState {

    public static final int HISTORY_LIMIT = 10;

    public static final CompressionState EMPTY = new CompressionState(null, List.of());

    CompressionJob activeJob;
    /** Terminal jobs, newest first. */
    List<CompressionJob> history;

    public CompressionState(CompressionJob activeJob, List<CompressionJob> history) {
        this.activeJob = activeJob;
        this.history = List.copyOf(history);
    }

    public boolean hasActiveJob() {
        return activeJob != null && activeJob.isActive();
    }

    public CompressionState withActiveJob(CompressionJob job) {
        return new CompressionState(job, history);
    }

    /**
     * Move the given terminal job to the head of the history and clear the active slot.
     * The oldest entry is evicted once the log holds {@value #HISTORY_LIMIT} jobs.
     */
    public CompressionState demote(CompressionJob job) {
        List<CompressionJob> next = new ArrayList<>(HISTORY_LIMIT);
        next.add(job);
        for (CompressionJob previous : history) {
            if (next.size() == HISTORY_LIMIT) {
                break;
            }
            next.add(previous);
        }
        return new CompressionState(null, next);
    }
}
