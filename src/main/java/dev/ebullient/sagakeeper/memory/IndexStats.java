package dev.ebullient.sagakeeper.memory;

public record IndexStats(int chapters, int events, int threads) {
}
