package io.ingest4j.core;

public enum DispatchMode {
    SEQUENTIAL,
    CONCURRENT
}
