package com.pressplay.orchestration.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Shared infrastructure for the orchestration core.
 */
@Configuration
public class OrchestrationConfig {

    /**
     * Single-threaded loop on which every state mutation of the core runs. Backend callbacks,
     * timers and public requests are all re-scheduled here, so state needs no locking.
     */
    @Bean(name = "orchestrationLoop", destroyMethod = "dispose")
    public Scheduler orchestrationLoop() {
        return Schedulers.newSingle("orchestration-loop");
    }
}
