package com.pressplay.orchestration.service;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.bridge.ErrorMessages;
import com.pressplay.orchestration.model.CompressionJob;
import com.pressplay.orchestration.model.GameInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Refreshes the affected game after a job succeeded: hydrate the single entry when possible,
 * otherwise fall back to a full listing refresh. One of the two always happens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionReconciler {

    private final BridgePort bridge;
    private final GameListing listing;

    public Mono<ReconcileOutcome> reconcile(CompressionJob job) {
        Optional<GameInfo> existing = listing.findByPath(job.getGamePath());
        if (existing.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("{} is not listed, refreshing the whole library", job.getGamePath());
            }
            return Mono.fromCallable(this::refresh);
        }
        GameInfo game = existing.get();
        return Mono.defer(() -> bridge.hydrateGame(game.path(), game.name(), game.platform()))
                .map(hydrated -> {
                    listing.update(hydrated);
                    return ReconcileOutcome.HYDRATED;
                })
                .onErrorResume(error -> {
                    log.warn("Hydration of {} failed, falling back to a full refresh: {}",
                            game.path(), ErrorMessages.describe(error));
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.fromCallable(this::refresh));
    }

    private ReconcileOutcome refresh() {
        listing.refresh();
        return ReconcileOutcome.REFRESHED;
    }
}
