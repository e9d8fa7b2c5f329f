package com.pressplay.orchestration.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Installed game as reported by the backend. Sizes are in bytes.
 *
 * @param compressedSize on-disk size after compression, or null when never measured
 */
@Builder(toBuilder = true)
public record GameInfo(String name,
                       String path,
                       Platform platform,
                       long sizeBytes,
                       Long compressedSize,
                       boolean compressed,
                       boolean directStorage,
                       boolean excluded,
                       Instant lastPlayed) {

    public long bytesSaved() {
        if (compressedSize == null) {
            return 0;
        }
        return Math.max(0, sizeBytes - compressedSize);
    }

    public double savingsRatio() {
        if (sizeBytes == 0 || !compressed) {
            return 0.0;
        }
        return (double) bytesSaved() / sizeBytes;
    }
}
