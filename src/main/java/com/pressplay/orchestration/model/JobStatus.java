package com.pressplay.orchestration.model;

/**
 * Lifecycle of a job held in the coordinator's active slot.
 * RUNNING is the only non-terminal status; every other status leads to demotion into history.
 */
public enum JobStatus {
    /** The backend is working on the job. */
    RUNNING,
    /** The progress stream completed or the awaited call returned normally. */
    COMPLETED,
    /** A call or stream failed; the job carries the error message. */
    FAILED,
    /** Cancelled locally; the backend was notified best-effort. */
    CANCELLED;

    public boolean isActive() {
        return this == RUNNING;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
