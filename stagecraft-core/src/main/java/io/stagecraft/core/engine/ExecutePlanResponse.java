package io.stagecraft.core.engine;

import io.stagecraft.core.report.ExecutionReport;
import java.util.Objects;

/// Output of {@link Engine#executePlan(ExecutePlanRequest)}.
///
/// @param report aggregated execution report, not null
public record ExecutePlanResponse(ExecutionReport report) {

    public ExecutePlanResponse {
        Objects.requireNonNull(report, "report must not be null");
    }
}
