package com.pressplay.orchestration.relay;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.AutomationJob;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/** Latest snapshot of the backend's automation queue. */
@Component
public class AutomationQueueRelay extends StreamRelay<List<AutomationJob>> {

    public AutomationQueueRelay(BridgePort bridge, @Qualifier("orchestrationLoop") Scheduler loop) {
        super("automation-queue", bridge::watchAutomationQueue, loop);
    }
}
