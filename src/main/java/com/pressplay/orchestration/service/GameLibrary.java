package com.pressplay.orchestration.service;

import com.pressplay.orchestration.bridge.BridgePort;
import com.pressplay.orchestration.bridge.ErrorMessages;
import com.pressplay.orchestration.model.GameInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory game list backed by the bridge's discovery call.
 * <p>
 * Every change publishes a new unmodifiable list instance, so views that memoise on list
 * identity recompute exactly when the content may have changed.
 * </p>
 * <p>
 * Each refresh and each applied update bumps a request generation. A listing that arrives
 * for an older generation is dropped, so an overlapping refresh or a hydrated entry is
 * never overwritten by data fetched earlier.
 * </p>
 */
@Slf4j
@Service
public class GameLibrary implements GameListing {

    private final BridgePort bridge;
    private final Scheduler loop;
    private final Sinks.Many<List<GameInfo>> sink = Sinks.many().replay().latest();
    /** Bumped by every refresh and applied update; listings fetched for an older value are stale. */
    private final AtomicLong requestGeneration = new AtomicLong();

    /** Null until the first successful discovery. */
    private volatile List<GameInfo> games;

    @Autowired
    public GameLibrary(BridgePort bridge, @Qualifier("orchestrationLoop") Scheduler loop) {
        this.bridge = bridge;
        this.loop = loop;
    }

    @Override
    public Optional<List<GameInfo>> games() {
        return Optional.ofNullable(games);
    }

    /** @return every published list, starting with the current one if loaded */
    public Flux<List<GameInfo>> updates() {
        return sink.asFlux();
    }

    @Override
    public Optional<GameInfo> findByPath(String gamePath) {
        List<GameInfo> current = games;
        if (current == null) {
            return Optional.empty();
        }
        return current.stream().filter(g -> g.path().equals(gamePath)).findFirst();
    }

    @Override
    public void update(GameInfo game) {
        Objects.requireNonNull(game, "game");
        loop.schedule(() -> {
            List<GameInfo> current = games;
            if (current == null) {
                log.debug("Ignoring update for {} before the library has loaded", game.path());
                return;
            }
            List<GameInfo> next = new ArrayList<>(current.size());
            boolean replaced = false;
            for (GameInfo existing : current) {
                if (!replaced && existing.path().equals(game.path())) {
                    next.add(game);
                    replaced = true;
                } else {
                    next.add(existing);
                }
            }
            if (!replaced) {
                log.debug("Game {} is no longer listed, update dropped", game.path());
                return;
            }
            requestGeneration.incrementAndGet();
            publish(next);
        });
    }

    @Override
    public void refresh() {
        long requestId = requestGeneration.incrementAndGet();
        bridge.listGames()
                .publishOn(loop)
                .subscribe(
                        listed -> {
                            if (requestId != requestGeneration.get()) {
                                log.debug("Dropping superseded game listing (request {})", requestId);
                                return;
                            }
                            publish(listed);
                        },
                        error -> log.warn("Game discovery failed: {}", ErrorMessages.describe(error)));
    }

    private void publish(List<GameInfo> next) {
        List<GameInfo> snapshot = Collections.unmodifiableList(new ArrayList<>(next));
        games = snapshot;
        sink.tryEmitNext(snapshot);
        if (log.isDebugEnabled()) {
            log.debug("Library now lists {} games", snapshot.size());
        }
    }
}
