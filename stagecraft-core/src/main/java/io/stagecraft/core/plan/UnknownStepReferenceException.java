package io.stagecraft.core.plan;

import java.io.Serial;

/// A step depends on an ID that no step in the plan carries.
public class UnknownStepReferenceException extends PlanSliceException {

    @Serial private static final long serialVersionUID = -1718006433120385264L;

    private final String missingStepId;

    public UnknownStepReferenceException(String stepId, String missingStepId) {
        super(
                stepId,
                String.format("step \"%s\" depends on unknown step \"%s\"", stepId, missingStepId));
        this.missingStepId = missingStepId;
    }

    public String getMissingStepId() {
        return missingStepId;
    }
}
