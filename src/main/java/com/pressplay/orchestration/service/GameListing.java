package com.pressplay.orchestration.service;

import com.pressplay.orchestration.model.GameInfo;

import java.util.List;
import java.util.Optional;

/**
 * The game list the coordinator keeps fresh after a job completes.
 */
public interface GameListing {

    /**
     * @return the current list, or empty when the listing has not loaded yet
     */
    Optional<List<GameInfo>> games();

    /**
     * Lookup a game by its absolute path.
     * @return the game if the listing is loaded and contains it; empty otherwise
     */
    Optional<GameInfo> findByPath(String gamePath);

    /** Replace the entry with the same path by the given, freshly hydrated game. */
    void update(GameInfo game);

    /** Request a full re-discovery. Returns immediately; the list updates when the backend answers. */
    void refresh();
}
