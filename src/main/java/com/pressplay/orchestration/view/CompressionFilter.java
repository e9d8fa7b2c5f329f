package com.pressplay.orchestration.view;

import com.pressplay.orchestration.model.GameInfo;

public enum CompressionFilter {
    ALL,
    COMPRESSED,
    /** Not compressed and eligible for compression (DirectStorage titles are left out). */
    UNCOMPRESSED;

    public boolean matches(GameInfo game) {
        return switch (this) {
            case ALL -> true;
            case COMPRESSED -> game.compressed();
            case UNCOMPRESSED -> !game.compressed() && !game.directStorage();
        };
    }
}
