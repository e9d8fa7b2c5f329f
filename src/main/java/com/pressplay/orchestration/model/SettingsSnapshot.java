package com.pressplay.orchestration.model;

/**
 * What the settings store currently exposes. {@code settings} is null until the store has loaded.
 */
public record SettingsSnapshot(boolean loaded, AppSettings settings) {

    public static final SettingsSnapshot NOT_LOADED = new SettingsSnapshot(false, null);

    public static SettingsSnapshot loaded(AppSettings settings) {
        return new SettingsSnapshot(true, settings);
    }
}
