package com.pressplay.orchestration.settings;

import com.pressplay.orchestration.model.AppSettings;
import com.pressplay.orchestration.model.SettingsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.function.UnaryOperator;

/**
 * Settings store held in memory. Starts unloaded; {@link #load(AppSettings)} marks it loaded.
 */
@Slf4j
@Component
public class InMemorySettingsStore implements SettingsStore {

    private final Sinks.Many<SettingsSnapshot> sink = Sinks.many().replay().latest();
    private volatile SettingsSnapshot current = SettingsSnapshot.NOT_LOADED;

    @Value("${settings.auto-compress:false}")
    private boolean initialAutoCompress;

    public InMemorySettingsStore() {
        sink.tryEmitNext(current);
    }

    @Override
    public SettingsSnapshot current() {
        return current;
    }

    @Override
    public Flux<SettingsSnapshot> observe() {
        return sink.asFlux();
    }

    /** Load the configured defaults, as a persistence layer would on startup. */
    public void loadDefaults() {
        load(AppSettings.defaults().withAutoCompress(initialAutoCompress));
    }

    public synchronized void load(AppSettings settings) {
        emit(SettingsSnapshot.loaded(settings));
        log.info("Settings loaded (autoCompress={})", settings.isAutoCompress());
    }

    /**
     * Apply an edit to the loaded settings. Edits before the first load are ignored.
     */
    public synchronized void update(UnaryOperator<AppSettings> edit) {
        SettingsSnapshot snapshot = current;
        if (!snapshot.loaded()) {
            log.debug("Ignoring settings edit before load");
            return;
        }
        emit(SettingsSnapshot.loaded(edit.apply(snapshot.settings())));
    }

    private void emit(SettingsSnapshot next) {
        current = next;
        Sinks.EmitResult result = sink.tryEmitNext(next);
        if (result.isFailure()) {
            log.warn("Settings change not published: {}", result);
        }
    }
}
