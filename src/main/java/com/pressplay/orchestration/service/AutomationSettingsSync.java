package com.pressplay.orchestration.service;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.bridge.ErrorMessages;
import com.pressplay.orchestration.model.AutomationConfig;
import com.pressplay.orchestration.model.AutomationSettings;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.settings.SettingsStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Keeps the backend's automation in line with the user's settings.
 * <p>
 * Each automation field is compared on its own against the previously observed value, so
 * edits to unrelated settings (theme, notifications, API keys) never reach the backend.
 * When a watched field changes and automation is enabled, a complete config is pushed and
 * automation is started; when disabled, automation is stopped. Failures are logged only:
 * the next watched change pushes again.
 * </p>
 */
@Slf4j
@Service
public class AutomationSettingsSync {

    static final double BASELINE_CPU_THRESHOLD = 10.0;

    /** Fields whose changes are relevant to the backend. */
    private static final List<Function<AutomationSettings, Object>> WATCHED_FIELDS = List.of(
            AutomationSettings::autoCompressEnabled,
            AutomationSettings::cpuThresholdPercent,
            AutomationSettings::idleDurationMinutes,
            AutomationSettings::cooldownMinutes,
            AutomationSettings::customFolders,
            AutomationSettings::excludedPaths,
            AutomationSettings::algorithm);

    private final BridgePort bridge;
    private final SettingsStore settingsStore;
    private final Scheduler loop;

    private final AtomicInteger pushCount = new AtomicInteger();
    private volatile Disposable subscription;
    /** Null until the first settings snapshot has been observed. */
    private AutomationSettings lastObserved;
    private volatile AutomationConfig lastPushedConfig;

    @Autowired
    public AutomationSettingsSync(BridgePort bridge,
                                  SettingsStore settingsStore,
                                  @Qualifier("orchestrationLoop") Scheduler loop) {
        this.bridge = bridge;
        this.settingsStore = settingsStore;
        this.loop = loop;
    }

    @PostConstruct
    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = settingsStore.observe()
                .map(AutomationSettings::from)
                .publishOn(loop)
                .subscribe(this::onSettings,
                        error -> log.warn("Settings stream terminated: {}", ErrorMessages.describe(error)));
    }

    @PreDestroy
    public synchronized void stop() {
        Disposable current = subscription;
        subscription = null;
        if (current != null) {
            current.dispose();
        }
    }

    /** @return the last config handed to the backend, or null if none was pushed yet */
    public AutomationConfig lastPushedConfig() {
        return lastPushedConfig;
    }

    /** @return how many configs have been pushed since startup */
    public int pushCount() {
        return pushCount.get();
    }

    void onSettings(AutomationSettings settings) {
        AutomationSettings previous = lastObserved;
        lastObserved = settings;
        if (previous != null && !changed(previous, settings)) {
            return;
        }
        Boolean enabled = settings.autoCompressEnabled();
        if (enabled == null) {
            log.debug("Settings not loaded yet, automation left untouched");
            return;
        }
        if (enabled) {
            AutomationConfig config = toConfig(settings);
            lastPushedConfig = config;
            pushCount.incrementAndGet();
            Mono.defer(() -> bridge.updateAutomationConfig(config))
                    .then(Mono.defer(bridge::startAutomation))
                    .subscribe(
                            null,
                            error -> log.warn("Could not push automation config: {}", ErrorMessages.describe(error)),
                            () -> log.info("Automation running with {}", config));
        } else {
            Mono.defer(bridge::stopAutomation)
                    .subscribe(
                            null,
                            error -> log.warn("Could not stop automation: {}", ErrorMessages.describe(error)),
                            () -> log.info("Automation stopped"));
        }
    }

    static boolean changed(AutomationSettings previous, AutomationSettings next) {
        for (Function<AutomationSettings, Object> field : WATCHED_FIELDS) {
            if (!Objects.equals(field.apply(previous), field.apply(next))) {
                return true;
            }
        }
        return false;
    }

    static AutomationConfig toConfig(AutomationSettings settings) {
        return new AutomationConfig(
                settings.cpuThresholdPercent() != null ? settings.cpuThresholdPercent() : BASELINE_CPU_THRESHOLD,
                minutesToSeconds(settings.idleDurationMinutes()),
                minutesToSeconds(settings.cooldownMinutes()),
                settings.customFolders() != null ? settings.customFolders() : List.of(),
                settings.excludedPaths() != null ? settings.excludedPaths() : List.of(),
                settings.algorithm() != null ? settings.algorithm() : CompressionAlgorithm.BASELINE);
    }

    private static long minutesToSeconds(Integer minutes) {
        return minutes == null ? 0L : minutes * 60L;
    }
}
