package com.pressplay.orchestration;

import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.processor.JobCoordinator;
import com.pressplay.orchestration.relay.AutomationQueueRelay;
import com.pressplay.orchestration.relay.AutomationStatusRelay;
import com.pressplay.orchestration.relay.SchedulerStateRelay;
import com.pressplay.orchestration.relay.WatcherEventRelay;
import com.pressplay.orchestration.service.GameLibrary;
import com.pressplay.orchestration.settings.InMemorySettingsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

/**
 * Spring Boot entry point. On startup it loads the settings, connects the backend streams
 * and compresses one demo game against the simulated backend so the whole flow can be
 * watched in the log.
 */
@Slf4j
@SpringBootApplication
public class OrchestrationApplication {

    static final String DEMO_GAME_PATH = "C:/g/Foo";
    static final String DEMO_GAME_NAME = "Foo";

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(OrchestrationApplication.class, args);
        connectStreams(context);

        context.getBean(InMemorySettingsStore.class).loadDefaults();
        context.getBean(GameLibrary.class).refresh();

        JobCoordinator coordinator = context.getBean(JobCoordinator.class);
        coordinator.states()
                .filter(state -> !state.getHistory().isEmpty())
                .next()
                .subscribe(state -> log.info("Demo finished: {}", state.getHistory().get(0)));
        coordinator.startCompression(DEMO_GAME_PATH, DEMO_GAME_NAME, CompressionAlgorithm.XPRESS_8K);
    }

    /** Subscribe every relay to its backend stream. */
    static void connectStreams(ApplicationContext context) {
        context.getBean(AutomationQueueRelay.class).connect();
        context.getBean(AutomationStatusRelay.class).connect();
        context.getBean(SchedulerStateRelay.class).connect();
        context.getBean(WatcherEventRelay.class).connect();
    }
}
