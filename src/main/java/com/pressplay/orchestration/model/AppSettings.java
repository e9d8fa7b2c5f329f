package com.pressplay.orchestration.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * User settings as held by the settings store. Only the automation fields are read by the
 * core; the remaining fields exist so unrelated edits flow through the same stream.
 */
@Value
@With
@Builder(toBuilder = true)
public class AppSettings {
    @Builder.Default
    CompressionAlgorithm algorithm = CompressionAlgorithm.BASELINE;
    @Builder.Default
    boolean autoCompress = false;
    @Builder.Default
    double cpuThreshold = 10.0;
    @Builder.Default
    int idleDurationMinutes = 5;
    @Builder.Default
    int cooldownMinutes = 5;
    @Builder.Default
    List<String> customFolders = List.of();
    @Builder.Default
    List<String> excludedPaths = List.of();
    @Builder.Default
    boolean notificationsEnabled = true;
    @Builder.Default
    String themeVariant = "cinematicDesert";
    String steamGridDbApiKey;

    public static AppSettings defaults() {
        return AppSettings.builder().build();
    }
}
