package com.pressplay.orchestration.view;

/** Aggregate sizes over the whole library, in bytes. */
public record LibraryTotals(long totalBytes, long savedBytes) {
}
