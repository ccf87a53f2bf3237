package io.stagecraft.core.plan;

import io.stagecraft.core.util.Immutables;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/// The complete partition of a {@link Plan} produced by {@link PlanSlicer}.
///
/// Every input step appears exactly once: either inside one {@link HostPlan} or in
/// {@link #globalSteps()}. Both maps iterate in key order, and {@link #globalSteps()}
/// / {@link #globalStepIds()} follow {@link PlanStep#CANONICAL_ORDER}, so two slices
/// of the same plan encode identically.
///
/// ### Global step sequencing
/// The slicer does not execute anything. The composing layer must run every global
/// step listed in {@code globalDependencyRefs.get(hostStepId)} to completion before it
/// dispatches the host plan containing {@code hostStepId}.
///
/// @param hostPlans            host logical id to host plan, key-sorted
/// @param globalSteps          steps without host affinity, canonical order
/// @param globalStepIds        IDs of {@code globalSteps}, same order
/// @param globalDependencyRefs host step id to the sorted global step IDs it depends on
public record SliceResult(
        Map<String, HostPlan> hostPlans,
        List<PlanStep> globalSteps,
        List<String> globalStepIds,
        Map<String, List<String>> globalDependencyRefs) {

    public SliceResult {
        hostPlans = sortedCopy(hostPlans);
        globalSteps = Immutables.copyOf(globalSteps);
        globalStepIds = Immutables.copyOf(globalStepIds);
        TreeMap<String, List<String>> refs = new TreeMap<>();
        if (globalDependencyRefs != null) {
            globalDependencyRefs.forEach((stepId, ids) -> refs.put(stepId, Immutables.copyOf(ids)));
        }
        globalDependencyRefs = Collections.unmodifiableMap(refs);
    }

    /// Returns the logical IDs of all hosts that received a plan, in sorted order.
    ///
    /// @return host IDs, never null
    public Set<String> hostIds() {
        return hostPlans.keySet();
    }

    /// Returns the global step IDs a host plan waits for, across all of its steps.
    ///
    /// @param hostId host logical id
    /// @return sorted, deduplicated global step IDs; empty when none or unknown host
    public List<String> globalDependenciesOf(String hostId) {
        HostPlan hostPlan = hostPlans.get(hostId);
        if (hostPlan == null) {
            return List.of();
        }
        return hostPlan.steps().stream()
                .flatMap(step -> globalDependencyRefs.getOrDefault(step.id(), List.of()).stream())
                .distinct()
                .sorted()
                .toList();
    }

    /// Returns the total number of steps across host plans and global steps.
    ///
    /// @return step count
    public int stepCount() {
        return globalSteps.size()
                + hostPlans.values().stream().mapToInt(hp -> hp.steps().size()).sum();
    }

    private static Map<String, HostPlan> sortedCopy(Map<String, HostPlan> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
