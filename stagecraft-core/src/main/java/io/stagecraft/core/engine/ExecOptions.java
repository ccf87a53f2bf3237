package io.stagecraft.core.engine;

import java.util.Set;
import java.util.TreeSet;

/// Execution knobs for {@link Engine#executePlan(ExecutePlanRequest)}.
///
/// @param dryRun      report every step as skipped without invoking any executor
/// @param maxParallel maximum number of host plans executed concurrently, at least 1
/// @param stepFilter  when non-empty, only these step ids are executed; others are
///                    reported skipped
public record ExecOptions(boolean dryRun, int maxParallel, Set<String> stepFilter) {

    public ExecOptions {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        stepFilter = stepFilter == null ? Set.of() : Set.copyOf(new TreeSet<>(stepFilter));
    }

    /// Sequential, non-dry-run, unfiltered execution.
    public static ExecOptions defaults() {
        return new ExecOptions(false, 1, Set.of());
    }

    /// Returns whether the given step passes the filter.
    ///
    /// @param stepId step identifier
    /// @return true when no filter is set or the id is listed
    public boolean selects(String stepId) {
        return stepFilter.isEmpty() || stepFilter.contains(stepId);
    }
}
