package com.certprep.rag.index;

public enum IndexStatus {
    READY,
    EMPTY,
    UNAVAILABLE
}
