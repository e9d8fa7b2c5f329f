package com.pressplay.orchestration.bridge;

import com.pressplay.orchestration.model.AutomationConfig;
import com.pressplay.orchestration.model.AutomationJob;
import com.pressplay.orchestration.model.CompressionAlgorithm;
import com.pressplay.orchestration.model.CompressionProgress;
import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;
import com.pressplay.orchestration.model.SchedulerState;
import com.pressplay.orchestration.model.WatcherEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asynchronous interface to the external execution backend.
 * <p>
 * Calls return a {@link Mono} that completes or errors; subscriptions return a {@link Flux}
 * that may terminate on its own. Implementations are unreliable by contract: any call may
 * fail, and a call may also throw synchronously before returning a publisher.
 * </p>
 */
public interface BridgePort {

    /**
     * Ask the backend to compress a game folder.
     * @return the progress stream for this call; completion without error means success
     */
    Flux<CompressionProgress> compressGame(String gamePath, String gameName, CompressionAlgorithm algorithm);

    /** Best-effort request to stop the running compression. */
    Mono<Void> cancelCompression();

    /** Decompress a game folder; completes when the backend is done. */
    Mono<Void> decompressGame(String gamePath);

    /**
     * Re-read a single game from disk.
     * @return the refreshed entity, or empty when the backend cannot resolve it
     */
    Mono<GameInfo> hydrateGame(String gamePath, String gameName, Platform platform);

    /** Full discovery pass over every known platform and custom folder. */
    Mono<List<GameInfo>> listGames();

    Mono<Void> updateAutomationConfig(AutomationConfig config);

    Mono<Void> startAutomation();

    Mono<Void> stopAutomation();

    /** Snapshots of the automation queue, each one replacing the previous. */
    Flux<List<AutomationJob>> watchAutomationQueue();

    Flux<Boolean> watchAutomationStatus();

    Flux<SchedulerState> watchSchedulerState();

    Flux<WatcherEvent> watchWatcherEvents();
}
