package io.backbork.core;

public record QueueStats(int queued, int processing, int completed, int failed, int cancelled) {

    public int total() {
        return queued + processing + completed + failed + cancelled;
    }
}
