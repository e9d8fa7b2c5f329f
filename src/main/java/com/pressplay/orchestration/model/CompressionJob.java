package com.pressplay.orchestration.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Immutable view of a single compression or decompression job.
 * <p>
 * Owned by the coordinator while it sits in the active slot; once it reaches a terminal
 * status it is copied unchanged into the history log.
 * </p>
 */
@Value
@With
@Builder(toBuilder = true)
public class CompressionJob {
    @NonNull String gamePath;
    @NonNull String gameName;
    @NonNull JobKind kind;
    /** Algorithm requested from the backend; decompression records the fast default only as a marker. */
    @NonNull CompressionAlgorithm algorithm;
    @NonNull JobStatus status;
    /** Latest progress tick; only compression jobs receive one. */
    CompressionProgress progress;
    /** Human readable failure, set only when {@link #status} is FAILED. */
    String error;

    public boolean isActive() {
        return status.isActive();
    }

    public static CompressionJob running(String gamePath, String gameName, JobKind kind, CompressionAlgorithm algorithm) {
        return CompressionJob.builder()
                .gamePath(gamePath)
                .gameName(gameName)
                .kind(kind)
                .algorithm(algorithm)
                .status(JobStatus.RUNNING)
                .build();
    }
}
