package com.pressplay.orchestration.model;

import java.util.EnumSet;
import java.util.Set;

public enum AutomationJobStatus {
    PENDING,
    WAITING_FOR_SETTLE,
    WAITING_FOR_IDLE,
    COMPRESSING,
    COMPLETED,
    FAILED,
    SKIPPED;

    private static final Set<AutomationJobStatus> WAITING = EnumSet.of(PENDING, WAITING_FOR_SETTLE, WAITING_FOR_IDLE);

    /** @return true for statuses counted as queued work that has not started yet */
    public boolean isWaiting() {
        return WAITING.contains(this);
    }
}
