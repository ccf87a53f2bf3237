package io.stagecraft.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.plan.PlanStep;
import io.stagecraft.core.plan.SliceResult;
import io.stagecraft.core.plan.StepAction;
import io.stagecraft.core.report.ExecutionError;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.core.report.ExecutionStatus;
import io.stagecraft.core.report.LogLine;
import io.stagecraft.core.report.LogStream;
import io.stagecraft.core.report.StepExecution;
import io.stagecraft.core.report.StepStatus;
import io.stagecraft.core.resource.OpaquePayload;
import io.stagecraft.core.resource.ResourceRef;
import io.stagecraft.core.resource.ResourceSpec;
import io.stagecraft.core.resource.ResourceState;
import io.stagecraft.core.resource.StateSnapshot;
import io.stagecraft.core.resource.TopologySnapshot;
import io.stagecraft.core.util.WireEnum;
import io.stagecraft.serialization.mixin.ExecutionErrorMixin;
import io.stagecraft.serialization.mixin.ExecutionReportMixin;
import io.stagecraft.serialization.mixin.HostPlanMixin;
import io.stagecraft.serialization.mixin.HostPlanStepMixin;
import io.stagecraft.serialization.mixin.HostRefMixin;
import io.stagecraft.serialization.mixin.LogLineMixin;
import io.stagecraft.serialization.mixin.PlanMixin;
import io.stagecraft.serialization.mixin.PlanStepMixin;
import io.stagecraft.serialization.mixin.ResourceEntryMixin;
import io.stagecraft.serialization.mixin.ResourceRefMixin;
import io.stagecraft.serialization.mixin.SliceResultMixin;
import io.stagecraft.serialization.mixin.SnapshotMixin;
import io.stagecraft.serialization.mixin.StepExecutionMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the complete Stagecraft wire format in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `OpaquePayload`: raw JSON value, written verbatim and captured as compact text
/// - `StepAction`, `ExecutionStatus`, `StepStatus`, `LogStream`: lower-case wire
///   spellings; unknown spellings are decode errors
///
/// **Mixins** (records bind through their canonical constructors; mixins fix the field
/// order and mark the omit-when-empty fields):
/// - plan types: `Plan`, `PlanStep`, `HostPlan`, `HostPlanStep`, `HostRef`, `SliceResult`
/// - resource types: `ResourceRef`, `ResourceSpec`, `ResourceState`, both snapshots
/// - report types: `ExecutionReport`, `StepExecution`, `ExecutionError`, `LogLine`
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see StrictPlanCodec for the configured mapper and strict decode entry points
public class StagecraftJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2958720041766385012L;

    public StagecraftJacksonModule() {
        super("StagecraftJacksonModule");

        addSerializer(OpaquePayload.class, new OpaquePayloadSerializer());
        addDeserializer(OpaquePayload.class, new OpaquePayloadDeserializer());

        registerWireEnum(StepAction.class);
        registerWireEnum(ExecutionStatus.class);
        registerWireEnum(StepStatus.class);
        registerWireEnum(LogStream.class);
    }

    private <E extends Enum<E> & WireEnum> void registerWireEnum(Class<E> type) {
        addSerializer(type, new WireEnumSerializer<>(type));
        addDeserializer(type, new WireEnumDeserializer<>(type));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ResourceRef.class, ResourceRefMixin.class);
        context.setMixInAnnotations(ResourceSpec.class, ResourceEntryMixin.class);
        context.setMixInAnnotations(ResourceState.class, ResourceEntryMixin.class);
        context.setMixInAnnotations(TopologySnapshot.class, SnapshotMixin.class);
        context.setMixInAnnotations(StateSnapshot.class, SnapshotMixin.class);

        context.setMixInAnnotations(HostRef.class, HostRefMixin.class);
        context.setMixInAnnotations(Plan.class, PlanMixin.class);
        context.setMixInAnnotations(PlanStep.class, PlanStepMixin.class);
        context.setMixInAnnotations(HostPlan.class, HostPlanMixin.class);
        context.setMixInAnnotations(HostPlanStep.class, HostPlanStepMixin.class);
        context.setMixInAnnotations(SliceResult.class, SliceResultMixin.class);

        context.setMixInAnnotations(ExecutionReport.class, ExecutionReportMixin.class);
        context.setMixInAnnotations(StepExecution.class, StepExecutionMixin.class);
        context.setMixInAnnotations(ExecutionError.class, ExecutionErrorMixin.class);
        context.setMixInAnnotations(LogLine.class, LogLineMixin.class);
    }
}
