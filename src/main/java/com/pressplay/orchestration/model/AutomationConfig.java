package com.pressplay.orchestration.model;

import java.util.List;

/**
 * Complete automation configuration pushed to the backend in a single call.
 */
public record AutomationConfig(double cpuThresholdPercent,
                               long idleDurationSeconds,
                               long cooldownSeconds,
                               List<String> watchPaths,
                               List<String> excludedPaths,
                               CompressionAlgorithm algorithm) {

    public AutomationConfig {
        watchPaths = List.copyOf(watchPaths);
        excludedPaths = List.copyOf(excludedPaths);
    }
}
