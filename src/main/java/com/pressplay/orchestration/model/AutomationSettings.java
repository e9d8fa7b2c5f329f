package com.pressplay.orchestration.model;

import java.util.List;

/**
 * Projection of the settings fields that drive backend automation.
 * Every component is null while the settings are not loaded.
 */
public record AutomationSettings(Boolean autoCompressEnabled,
                                 Double cpuThresholdPercent,
                                 Integer idleDurationMinutes,
                                 Integer cooldownMinutes,
                                 List<String> customFolders,
                                 List<String> excludedPaths,
                                 CompressionAlgorithm algorithm) {

    public static final AutomationSettings UNKNOWN = new AutomationSettings(null, null, null, null, null, null, null);

    public static AutomationSettings from(SettingsSnapshot snapshot) {
        if (snapshot == null || !snapshot.loaded() || snapshot.settings() == null) {
            return UNKNOWN;
        }
        AppSettings s = snapshot.settings();
        return new AutomationSettings(
                s.isAutoCompress(),
                s.getCpuThreshold(),
                s.getIdleDurationMinutes(),
                s.getCooldownMinutes(),
                s.getCustomFolders(),
                s.getExcludedPaths(),
                s.getAlgorithm());
    }
}
