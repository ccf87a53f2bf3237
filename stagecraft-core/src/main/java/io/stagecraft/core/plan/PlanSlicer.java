package io.stagecraft.core.plan;

import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// Deterministically partitions a {@link Plan} into per-host {@link HostPlan}s and
/// host-agnostic global steps.
///
/// ### Rules
/// - Steps are assigned by {@code host.logicalId}; an empty id makes the step global
/// - Global steps and each host plan's steps are ordered by index, then id
/// - A dependency on a step of the same host stays in {@code dependsOn} (sorted)
/// - A dependency on a global step moves to {@link SliceResult#globalDependencyRefs()}
/// - A dependency on another host's step is rejected
/// - A dependency on an ID that does not exist is rejected
///
/// ### Contracts
/// - **Precondition**: the plan is not mutated concurrently (it is a record, so this holds
///   unless a caller smuggles in a mutable payload)
/// - **Postcondition**: on success every input step appears exactly once in the result;
///   on failure a {@link PlanSliceException} is thrown and nothing is returned
/// - **Invariant**: the input plan is never modified; all output structures are fresh
///
/// ### Usage
/// {@snippet :
/// SliceResult result = new PlanSlicer().slice(plan);
/// for (String stepId : result.globalStepIds()) {
///     runGlobal(stepId);
/// }
/// result.hostPlans().forEach(agentClient::dispatch);
/// }
///
/// @implNote Stateless and thread-safe. Pure computation: no I/O, no logging, no locks.
/// @see SliceResult for the output shape
public final class PlanSlicer {

    /// Slices a plan into host plans and global steps.
    ///
    /// @param plan the plan to slice, not null
    /// @return the complete partition, never null
    /// @throws DuplicateStepIdException if two steps share an id
    /// @throws UnknownStepReferenceException if a host step depends on a missing id
    /// @throws CrossHostDependencyException if a host step depends on another host's step
    public SliceResult slice(Plan plan) throws PlanSliceException {
        Objects.requireNonNull(plan, "plan must not be null");
        List<PlanStep> steps = plan.steps();

        // Owning host per step id; global steps own the empty host.
        Map<String, String> ownerByStepId = new HashMap<>(steps.size() * 2);
        List<PlanStep> globalSteps = new ArrayList<>();
        for (PlanStep step : steps) {
            String hostId = step.host().logicalId();
            if (ownerByStepId.putIfAbsent(step.id(), hostId) != null) {
                throw new DuplicateStepIdException(step.id());
            }
            if (hostId.isEmpty()) {
                globalSteps.add(step);
            }
        }

        globalSteps.sort(PlanStep.CANONICAL_ORDER);
        List<String> globalStepIds = new ArrayList<>(globalSteps.size());
        for (PlanStep step : globalSteps) {
            globalStepIds.add(step.id());
        }

        Map<String, HostRef> hostRefs = new HashMap<>();
        Map<String, List<HostPlanStep>> stepsByHost = new TreeMap<>();
        Map<String, List<String>> globalDependencyRefs = new TreeMap<>();

        for (PlanStep step : steps) {
            String hostId = step.host().logicalId();
            if (hostId.isEmpty()) {
                continue;
            }

            SortedSet<String> localDeps = new TreeSet<>();
            SortedSet<String> globalDeps = new TreeSet<>();
            for (String depId : step.dependsOn()) {
                String depHostId = ownerByStepId.get(depId);
                if (depHostId == null) {
                    throw new UnknownStepReferenceException(step.id(), depId);
                }
                if (depHostId.isEmpty()) {
                    globalDeps.add(depId);
                } else if (!depHostId.equals(hostId)) {
                    throw new CrossHostDependencyException(step.id(), hostId, depId, depHostId);
                } else {
                    localDeps.add(depId);
                }
            }

            if (!globalDeps.isEmpty()) {
                globalDependencyRefs.put(step.id(), List.copyOf(globalDeps));
            }

            hostRefs.putIfAbsent(hostId, step.host());
            stepsByHost
                    .computeIfAbsent(hostId, ignored -> new ArrayList<>())
                    .add(
                            new HostPlanStep(
                                    step.id(),
                                    step.index(),
                                    step.action(),
                                    step.target(),
                                    step.inputs(),
                                    List.copyOf(localDeps),
                                    Immutables.copyOf(step.meta())));
        }

        Map<String, HostPlan> hostPlans = new TreeMap<>();
        stepsByHost.forEach(
                (hostId, hostSteps) -> {
                    hostSteps.sort(HostPlanStep.CANONICAL_ORDER);
                    hostPlans.put(
                            hostId,
                            new HostPlan(
                                    HostPlan.SCHEMA_VERSION,
                                    plan.id(),
                                    hostRefs.get(hostId),
                                    hostSteps,
                                    Map.of()));
                });

        return new SliceResult(hostPlans, globalSteps, globalStepIds, globalDependencyRefs);
    }
}
