package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;
import com.pressplay.orchestration.model.Platform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Library grid projection: sort once per source list and sort key, then filter the sorted
 * list by search text, platform and compression state.
 * <p>
 * Sorting is memoised on the source list identity plus sort key, so typing in the search
 * box or toggling a filter only re-runs the cheap filter pass.
 * </p>
 */
public class LibraryProjection {

    private List<GameInfo> lastGames;
    private InventorySortField lastSortField;
    private boolean lastDescending;
    private List<GameInfo> lastSorted = List.of();

    public List<GameInfo> apply(List<GameInfo> games, LibraryFilter filter) {
        Objects.requireNonNull(games, "games");
        Objects.requireNonNull(filter, "filter");
        String query = InventoryProjection.normalize(filter.searchQuery());
        boolean filterPlatforms = !filter.platforms().isEmpty();

        List<GameInfo> result = new ArrayList<>();
        for (GameInfo game : sorted(games, filter.sortField(), filter.descending())) {
            if (!query.isEmpty() && !game.name().toLowerCase(Locale.ROOT).contains(query)) {
                continue;
            }
            if (filterPlatforms && !filter.platforms().contains(game.platform())) {
                continue;
            }
            if (!filter.compression().matches(game)) {
                continue;
            }
            result.add(game);
        }
        return Collections.unmodifiableList(result);
    }

    /** Number of games per platform; platforms without games are absent. */
    public static Map<Platform, Integer> platformCounts(List<GameInfo> games) {
        Map<Platform, Integer> counts = new EnumMap<>(Platform.class);
        for (GameInfo game : games) {
            counts.merge(game.platform(), 1, Integer::sum);
        }
        return counts;
    }

    public static LibraryTotals totals(List<GameInfo> games) {
        long total = 0;
        long saved = 0;
        for (GameInfo game : games) {
            total += game.sizeBytes();
            saved += game.bytesSaved();
        }
        return new LibraryTotals(total, saved);
    }

    List<GameInfo> sorted(List<GameInfo> games, InventorySortField sortField, boolean descending) {
        if (games == lastGames && sortField == lastSortField && descending == lastDescending) {
            return lastSorted;
        }
        List<GameInfo> copy = new ArrayList<>(games);
        copy.sort(sortField.comparator(descending));
        lastGames = games;
        lastSortField = sortField;
        lastDescending = descending;
        lastSorted = Collections.unmodifiableList(copy);
        return lastSorted;
    }
}
