package com.pressplay.orchestration.model;

/**
 * Phase of the backend's automation scheduler. Relayed as-is; the core never acts on it.
 */
public enum SchedulerState {
    IDLE,
    SETTLING,
    WAITING_FOR_IDLE,
    SAFETY_CHECK,
    COMPRESSING,
    PAUSED,
    BACKOFF
}
