package com.pressplay.orchestration.bridge;

import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.model.WatcherEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedBridgeTest {

    private SimulatedBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new SimulatedBridge();
        ReflectionTestUtils.setField(bridge, "tickMs", 10L);
        ReflectionTestUtils.setField(bridge, "filesPerGame", 4);
    }

    @Test
    void testCompressionReportsEveryFileAndMarksGame() {
        StepVerifier.create(bridge.compressGame("C:/g/Foo", "Foo", CompressionAlgorithm.LZX))
                .expectNextCount(3)
                .assertNext(progress -> {
                    assertThat(progress.complete()).isTrue();
                    assertThat(progress.percent()).isEqualTo(100);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        GameInfo hydrated = bridge.hydrateGame("C:/g/Foo", "Foo", Platform.STEAM).block();
        assertThat(hydrated.compressed()).isTrue();
        assertThat(hydrated.bytesSaved()).isPositive();
    }

    @Test
    void testUnknownGameFailsSynchronously() {
        assertThatThrownBy(() -> bridge.compressGame("C:/g/Missing", "Missing", CompressionAlgorithm.LZX))
                .isInstanceOf(BridgeException.class)
                .hasMessageContaining("C:/g/Missing");
        StepVerifier.create(bridge.decompressGame("C:/g/Missing"))
                .expectError(BridgeException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testCancelEndsStream() {
        ReflectionTestUtils.setField(bridge, "tickMs", 200L);
        ReflectionTestUtils.setField(bridge, "filesPerGame", 1_000);

        StepVerifier.create(bridge.compressGame("C:/g/Foo", "Foo", CompressionAlgorithm.XPRESS_4K))
                .expectNextMatches(progress -> !progress.complete())
                .then(() -> bridge.cancelCompression().block())
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testRegisterEmitsInstallEvent() {
        GameInfo game = GameInfo.builder().name("New").path("C:/g/New").platform(Platform.CUSTOM).sizeBytes(10).build();

        StepVerifier.create(bridge.watchWatcherEvents().take(1))
                .then(() -> bridge.register(game))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WatcherEventType.INSTALLED);
                    assertThat(event.gamePath()).isEqualTo("C:/g/New");
                })
                .verifyComplete();
        assertThat(bridge.listGames().block()).contains(game);
    }

    @Test
    void testHydrateUnknownIsEmpty() {
        StepVerifier.create(bridge.hydrateGame("C:/g/Missing", "Missing", Platform.STEAM))
                .verifyComplete();
    }
}
