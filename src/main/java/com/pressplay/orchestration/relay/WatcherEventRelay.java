package com.pressplay.orchestration.relay;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.WatcherEvent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Filesystem events from the backend's library watcher. Only the most recent event is cached.
 */
@Component
public class WatcherEventRelay extends StreamRelay<WatcherEvent> {

    public WatcherEventRelay(BridgePort bridge, @Qualifier("orchestrationLoop") Scheduler loop) {
        super("watcher-events", bridge::watchWatcherEvents, loop);
    }
}
