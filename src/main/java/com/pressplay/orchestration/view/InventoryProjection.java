package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Filtered and sorted inventory listing, memoised on its inputs.
 * <p>
 * The source list is compared by identity, the query after normalisation, the sort field and
 * direction by value. While none of them changes, the previously returned list instance is
 * returned again so consumers comparing by identity see no change.
 * </p>
 * Not thread-safe; use from the orchestration loop or a single UI thread.
 */
public class InventoryProjection {

    private List<GameInfo> lastSource;
    private String lastQuery;
    private InventorySortField lastSortField;
    private boolean lastDescending;
    private List<GameInfo> lastResult = List.of();

    public List<GameInfo> project(List<GameInfo> games, String query, InventorySortField sortField, boolean descending) {
        Objects.requireNonNull(games, "games");
        Objects.requireNonNull(sortField, "sortField");
        String normalized = normalize(query);
        if (games == lastSource
                && normalized.equals(lastQuery)
                && sortField == lastSortField
                && descending == lastDescending) {
            return lastResult;
        }

        List<GameInfo> visible = new ArrayList<>(games.size());
        for (GameInfo game : games) {
            if (normalized.isEmpty() || game.name().toLowerCase(Locale.ROOT).contains(normalized)) {
                visible.add(game);
            }
        }
        // List.sort is stable
        visible.sort(sortField.comparator(descending));

        lastSource = games;
        lastQuery = normalized;
        lastSortField = sortField;
        lastDescending = descending;
        lastResult = Collections.unmodifiableList(visible);
        return lastResult;
    }

    /** Trim and lower-case; null reads as empty. */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().toLowerCase(Locale.ROOT);
    }
}
