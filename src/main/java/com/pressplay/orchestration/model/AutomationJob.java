package com.pressplay.orchestration.model;

import java.time.Instant;

/**
 * Entry of the backend's automation queue, as streamed to the core.
 */
public record AutomationJob(String gamePath,
                            String gameName,
                            AutomationJobKind kind,
                            AutomationJobStatus status,
                            Instant queuedAt,
                            Instant startedAt,
                            String error) {
}
