package com.pressplay.orchestration.relay;

import com.pressplay.orchestration.bridge.BridgePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Whether backend automation is currently running.
 */
@Component
public class AutomationStatusRelay extends StreamRelay<Boolean> {

    public AutomationStatusRelay(BridgePort bridge, @Qualifier("orchestrationLoop") Scheduler loop) {
        super("automation-status", bridge::watchAutomationStatus, loop);
    }

    /** @return false until the backend reports otherwise */
    public boolean isRunning() {
        return latest().orElse(false);
    }
}
