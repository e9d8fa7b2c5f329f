package com.pressplay.orchestration.relay;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.model.SchedulerState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

@Component
public class SchedulerStateRelay extends StreamRelay<SchedulerState> {

    public SchedulerStateRelay(BridgePort bridge, @Qualifier("orchestrationLoop") Scheduler loop) {
        super("scheduler-state", bridge::watchSchedulerState, loop);
    }
}
