package com.pressplay.orchestration.service;

/**
 * How the game list was brought up to date after a successful job.
 */
public enum ReconcileOutcome {
    /** The backend returned the refreshed game and it replaced the listed entry. */
    HYDRATED,
    /** Targeted hydration was unavailable, so a full listing refresh was requested. */
    REFRESHED
}
