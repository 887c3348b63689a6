package dev.ebullient.sagakeeper.memory;

import java.util.Locale;

public enum IndexCollection {
    CHAPTERS,
    EVENTS,
    THREADS;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
