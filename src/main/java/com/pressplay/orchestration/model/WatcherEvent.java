package com.pressplay.orchestration.model;

import java.time.Instant;

/** Filesystem change reported by the backend's library watcher. */
public record WatcherEvent(WatcherEventType type, String gamePath, String gameName, Instant timestamp) {
}
