package com.pressplay.orchestration.model;

public enum WatcherEventType {
    INSTALLED,
    MODIFIED,
    UNINSTALLED
}
