package com.pressplay.orchestration.settings;

import com.pressplay.orchestration.model.AppSettings;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.SettingsSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySettingsStoreTest {

    @Test
    void testStartsUnloaded() {
        InMemorySettingsStore store = new InMemorySettingsStore();

        assertSame(SettingsSnapshot.NOT_LOADED, store.current());
        StepVerifier.create(store.observe().take(1))
                .expectNext(SettingsSnapshot.NOT_LOADED)
                .verifyComplete();
    }

    @Test
    void testEditsBeforeLoadAreIgnored() {
        InMemorySettingsStore store = new InMemorySettingsStore();

        store.update(s -> s.withAutoCompress(true));

        assertFalse(store.current().loaded());
    }

    @Test
    void testLoadDefaultsUsesConfiguredAutoCompress() {
        InMemorySettingsStore store = new InMemorySettingsStore();
        ReflectionTestUtils.setField(store, "initialAutoCompress", true);

        store.loadDefaults();

        assertTrue(store.current().loaded());
        assertTrue(store.current().settings().isAutoCompress());
        assertEquals(CompressionAlgorithm.XPRESS_8K, store.current().settings().getAlgorithm());
    }

    @Test
    void testUpdatesArePublishedInOrder() {
        InMemorySettingsStore store = new InMemorySettingsStore();

        StepVerifier.create(store.observe().skip(1).take(2).map(s -> s.settings().getCooldownMinutes()))
                .then(() -> store.load(AppSettings.defaults()))
                .then(() -> store.update(s -> s.withCooldownMinutes(15)))
                .expectNext(5, 15)
                .verifyComplete();
    }
}
