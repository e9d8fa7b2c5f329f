package com.pressplay.orchestration.model;

public enum JobKind {
    COMPRESSION,
    DECOMPRESSION
}
