package io.stagecraft.core.engine;

/// Stable facade over planning, execution and state inspection.
///
/// Implementations never touch the network or the filesystem themselves; all I/O is
/// delegated to the collaborators they are built with.
///
/// @see DefaultEngine for the default composition
public interface Engine {

    /// Computes a plan from the desired topology and observed state.
    ///
    /// @param request planning input, not null
    /// @return the computed plan, never null
    /// @throws EngineException if the planner fails or returns an unsupported plan
    ComputePlanResponse computePlan(ComputePlanRequest request) throws EngineException;

    /// Executes a plan and reports the outcome of every step.
    ///
    /// @param request plan and execution options, not null
    /// @return aggregated report, never null
    /// @throws EngineException if the plan cannot be sliced or an executor breaks down
    ExecutePlanResponse executePlan(ExecutePlanRequest request) throws EngineException;

    /// Inspects the observed state of one host.
    ///
    /// @param request host and runtime, not null
    /// @return observed state, never null
    /// @throws EngineException if no inspector exists for the runtime or inspection fails
    InspectStateResponse inspectState(InspectStateRequest request) throws EngineException;
}
