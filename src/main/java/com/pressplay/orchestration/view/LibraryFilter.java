package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.Platform;

import java.util.Set;

/**
 * Filter and sort inputs of the library grid.
 *
 * @param platforms platforms to keep; empty keeps every platform
 */
public record LibraryFilter(String searchQuery,
                            Set<Platform> platforms,
                            CompressionFilter compression,
                            InventorySortField sortField,
                            boolean descending) {

    public static final LibraryFilter DEFAULT = new LibraryFilter("", Set.of(), CompressionFilter.ALL, InventorySortField.NAME, false);

    public LibraryFilter {
        searchQuery = searchQuery == null ? "" : searchQuery;
        platforms = platforms == null ? Set.of() : Set.copyOf(platforms);
        compression = compression == null ? CompressionFilter.ALL : compression;
        sortField = sortField == null ? InventorySortField.NAME : sortField;
    }
}
