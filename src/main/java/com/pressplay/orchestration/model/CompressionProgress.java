package com.pressplay.orchestration.model;

import java.time.Duration;

/**
 * Progress tick produced by the backend while a compression runs.
 * The coordinator does not interpret these values; it only keeps the latest one.
 */
public record CompressionProgress(String gameName,
                                  long filesTotal,
                                  long filesProcessed,
                                  long bytesOriginal,
                                  long bytesCompressed,
                                  long bytesSaved,
                                  Duration estimatedTimeRemaining,
                                  boolean complete) {

    public double fraction() {
        if (filesTotal == 0) {
            return 0.0;
        }
        return (double) filesProcessed / filesTotal;
    }

    public int percent() {
        return (int) Math.max(0, Math.min(100, fraction() * 100));
    }
}
