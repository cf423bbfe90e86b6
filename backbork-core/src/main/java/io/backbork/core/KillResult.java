package io.backbork.core;

public record KillResult(int queuedRemoved, int runningCancelled) {
}
