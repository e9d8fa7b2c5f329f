package com.pressplay.orchestration.model;

/**
 * Compression algorithms understood by the execution backend.
 */
public enum CompressionAlgorithm {
    XPRESS_4K("XPRESS 4K (Fast)"),
    XPRESS_8K("XPRESS 8K (Balanced)"),
    XPRESS_16K("XPRESS 16K (Better Ratio)"),
    LZX("LZX (Maximum)");

    /** Used whenever neither the caller nor the settings name an algorithm. */
    public static final CompressionAlgorithm BASELINE = XPRESS_8K;

    private final String displayName;

    CompressionAlgorithm(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
