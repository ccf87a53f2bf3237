package io.stagecraft.core.plan;

import java.io.Serial;

/// A host step depends on a step assigned to a different host.
///
/// Honouring such an edge would need ordering across independent agents, which the
/// engine does not provide; the plan must be fixed upstream instead.
public class CrossHostDependencyException extends PlanSliceException {

    @Serial private static final long serialVersionUID = 6271946502958421877L;

    private final String hostId;
    private final String dependencyStepId;
    private final String dependencyHostId;

    public CrossHostDependencyException(
            String stepId, String hostId, String dependencyStepId, String dependencyHostId) {
        super(
                stepId,
                String.format(
                        "step \"%s\" on host \"%s\" depends on step \"%s\" on host \"%s\""
                                + " (cross-host dependencies not allowed in v1)",
                        stepId, hostId, dependencyStepId, dependencyHostId));
        this.hostId = hostId;
        this.dependencyStepId = dependencyStepId;
        this.dependencyHostId = dependencyHostId;
    }

    public String getHostId() {
        return hostId;
    }

    public String getDependencyStepId() {
        return dependencyStepId;
    }

    public String getDependencyHostId() {
        return dependencyHostId;
    }
}
