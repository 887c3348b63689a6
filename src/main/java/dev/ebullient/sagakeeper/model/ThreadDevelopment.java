package dev.ebullient.sagakeeper.model;

public record ThreadDevelopment(
        String chapterId,
        String description) {
}
