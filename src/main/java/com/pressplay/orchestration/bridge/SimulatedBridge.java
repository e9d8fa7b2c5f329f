package com.pressplay.orchestration.bridge;

import com.pressplay.orchestration.model.AutomationConfig;
import com.pressplay.orchestration.model.AutomationJob;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.CompressionProgress;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.model.SchedulerState;
import com.pressplay.orchestration.model.WatcherEvent;
import com.pressplay.orchestration.model.WatcherEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process stand-in for the execution backend.
 * <p>
 * Compression is simulated with a timed sequence of progress ticks; nothing touches the
 * disk. Automation start/stop only flips the reported status. Used by the runnable
 * application and by context tests.
 * </p>
 */
@Slf4j
@Component
public class SimulatedBridge implements BridgePort {

    /** Share of the original size kept after a simulated compression. */
    private static final double SIMULATED_RATIO = 0.6;

    private final Map<String, GameInfo> games = new ConcurrentHashMap<>();
    private final Sinks.Many<List<AutomationJob>> queue = Sinks.many().replay().latest();
    private final Sinks.Many<Boolean> automationStatus = Sinks.many().replay().latest();
    private final Sinks.Many<SchedulerState> schedulerState = Sinks.many().replay().latest();
    private final Sinks.Many<WatcherEvent> watcherEvents = Sinks.many().multicast().directBestEffort();
    private final AtomicBoolean compressing = new AtomicBoolean(false);
    private final AtomicBoolean automationRunning = new AtomicBoolean(false);
    private volatile Sinks.Empty<Void> cancelSignal = Sinks.empty();
    private volatile AutomationConfig automationConfig;

    @Value("${bridge.simulated.tick.ms:250}")
    private long tickMs;

    @Value("${bridge.simulated.files:20}")
    private int filesPerGame;

    public SimulatedBridge() {
        register(GameInfo.builder().name("Foo").path("C:/g/Foo").platform(Platform.STEAM).sizeBytes(40_000_000_000L).build());
        register(GameInfo.builder().name("Bar Quest").path("C:/g/Bar Quest").platform(Platform.EPIC_GAMES).sizeBytes(12_000_000_000L).build());
        register(GameInfo.builder().name("Baz Racing").path("C:/g/Baz Racing").platform(Platform.GOG_GALAXY).sizeBytes(8_000_000_000L).build());
        queue.tryEmitNext(List.of());
        automationStatus.tryEmitNext(false);
        schedulerState.tryEmitNext(SchedulerState.IDLE);
    }

    /** Add a game as if the watcher had just discovered its install folder. */
    public void register(GameInfo game) {
        games.put(game.path(), game);
        watcherEvents.tryEmitNext(new WatcherEvent(WatcherEventType.INSTALLED, game.path(), game.name(), Instant.now()));
    }

    public AutomationConfig automationConfig() {
        return automationConfig;
    }

    @Override
    public Flux<CompressionProgress> compressGame(String gamePath, String gameName, CompressionAlgorithm algorithm) {
        GameInfo game = games.get(gamePath);
        if (game == null) {
            throw new BridgeException("Unknown game folder: " + gamePath);
        }
        if (!compressing.compareAndSet(false, true)) {
            throw new BridgeException("A compression is already running");
        }
        Sinks.Empty<Void> cancel = Sinks.empty();
        cancelSignal = cancel;
        int files = Math.max(1, filesPerGame);
        long original = game.sizeBytes();
        return Flux.interval(Duration.ofMillis(Math.max(1, tickMs)))
                .take(files)
                .map(i -> {
                    long processed = i + 1;
                    long bytesOriginal = original * processed / files;
                    long bytesCompressed = (long) (bytesOriginal * SIMULATED_RATIO);
                    return new CompressionProgress(gameName, files, processed, bytesOriginal, bytesCompressed,
                            bytesOriginal - bytesCompressed, Duration.ofMillis(tickMs * (files - processed)), processed == files);
                })
                .takeUntilOther(cancel.asMono())
                .doOnNext(progress -> {
                    if (progress.complete()) {
                        games.computeIfPresent(gamePath, (path, g) -> g.toBuilder()
                                .compressed(true)
                                .compressedSize((long) (g.sizeBytes() * SIMULATED_RATIO))
                                .build());
                    }
                })
                .doFinally(signal -> compressing.set(false));
    }

    @Override
    public Mono<Void> cancelCompression() {
        return Mono.fromRunnable(() -> {
            cancelSignal.tryEmitEmpty();
            log.debug("Simulated compression cancelled");
        });
    }

    @Override
    public Mono<Void> decompressGame(String gamePath) {
        return Mono.defer(() -> {
            GameInfo game = games.get(gamePath);
            if (game == null) {
                return Mono.error(new BridgeException("Unknown game folder: " + gamePath));
            }
            return Mono.delay(Duration.ofMillis(Math.max(1, tickMs)))
                    .doOnNext(tick -> games.put(gamePath, game.toBuilder().compressed(false).compressedSize(null).build()))
                    .then();
        });
    }

    @Override
    public Mono<GameInfo> hydrateGame(String gamePath, String gameName, Platform platform) {
        return Mono.justOrEmpty(games.get(gamePath));
    }

    @Override
    public Mono<List<GameInfo>> listGames() {
        return Mono.fromSupplier(() -> List.copyOf(games.values()));
    }

    @Override
    public Mono<Void> updateAutomationConfig(AutomationConfig config) {
        return Mono.fromRunnable(() -> automationConfig = config);
    }

    @Override
    public Mono<Void> startAutomation() {
        return Mono.fromRunnable(() -> {
            if (automationRunning.compareAndSet(false, true)) {
                automationStatus.tryEmitNext(true);
                schedulerState.tryEmitNext(SchedulerState.WAITING_FOR_IDLE);
            }
        });
    }

    @Override
    public Mono<Void> stopAutomation() {
        return Mono.fromRunnable(() -> {
            if (automationRunning.compareAndSet(true, false)) {
                automationStatus.tryEmitNext(false);
                schedulerState.tryEmitNext(SchedulerState.IDLE);
            }
        });
    }

    @Override
    public Flux<List<AutomationJob>> watchAutomationQueue() {
        return queue.asFlux();
    }

    @Override
    public Flux<Boolean> watchAutomationStatus() {
        return automationStatus.asFlux();
    }

    @Override
    public Flux<SchedulerState> watchSchedulerState() {
        return schedulerState.asFlux();
    }

    @Override
    public Flux<WatcherEvent> watchWatcherEvents() {
        return watcherEvents.asFlux();
    }
}
