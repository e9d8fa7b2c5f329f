package com.pressplay.orchestration.settings;

import com.pressplay.orchestration.model.SettingsSnapshot;
import reactor.core.publisher.Flux;

/**
 * Read side of the settings store. Persistence lives elsewhere; the core only observes.
 */
public interface SettingsStore {

    /** @return the current snapshot, {@link SettingsSnapshot#NOT_LOADED} before the first load */
    SettingsSnapshot current();

    /** @return the current snapshot followed by every later change */
    Flux<SettingsSnapshot> observe();
}
