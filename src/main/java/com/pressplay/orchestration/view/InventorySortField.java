package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;

import java.util.Comparator;

/**
 * Single sort key of the inventory listing.
 */
public enum InventorySortField {
    NAME(Comparator.comparing(GameInfo::name)),
    ORIGINAL_SIZE(Comparator.comparingLong(GameInfo::sizeBytes)),
    SAVINGS_PERCENT(Comparator.comparingDouble(GameInfo::savingsRatio)),
    PLATFORM(Comparator.comparing(game -> game.platform().getDisplayName()));

    private final Comparator<GameInfo> comparator;

    InventorySortField(Comparator<GameInfo> comparator) {
        this.comparator = comparator;
    }

    /**
     * Comparator for this key. Descending order negates the ascending result; there is no
     * secondary key, so equal elements keep their input order.
     */
    public Comparator<GameInfo> comparator(boolean descending) {
        if (!descending) {
            return comparator;
        }
        return (a, b) -> -comparator.compare(a, b);
    }
}
