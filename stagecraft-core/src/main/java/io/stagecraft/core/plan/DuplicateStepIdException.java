package io.stagecraft.core.plan;

import java.io.Serial;

/// Two steps of one plan share an ID.
public class DuplicateStepIdException extends PlanSliceException {

    @Serial private static final long serialVersionUID = 8855316051790343922L;

    public DuplicateStepIdException(String stepId) {
        super(stepId, String.format("duplicate step id \"%s\" in plan", stepId));
    }
}
