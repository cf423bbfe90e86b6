package io.backbork.core;

import java.util.List;

/**
 * Totals of one retention pruning run.
 */
public record PruneResult(int pruned, int failed, int schedulesSkipped, List<String> deletedPaths) {

    public PruneResult {
        deletedPaths = deletedPaths == null ? List.of() : List.copyOf(deletedPaths);
    }

    public static PruneResult empty() {
        return new PruneResult(0, 0, 0, List.of());
    }
}
