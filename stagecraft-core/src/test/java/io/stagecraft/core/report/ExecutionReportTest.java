package io.stagecraft.core.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagecraft.core.plan.HostRef;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutionReportTest {

    @Test
    void shouldCombineToMostSevereStatus() {
        assertThat(ExecutionStatus.SUCCEEDED.combine(ExecutionStatus.PARTIAL))
                .isEqualTo(ExecutionStatus.PARTIAL);
        assertThat(ExecutionStatus.FAILED.combine(ExecutionStatus.PARTIAL))
                .isEqualTo(ExecutionStatus.FAILED);
        assertThat(ExecutionStatus.PARTIAL.combine(ExecutionStatus.FAILED))
                .isEqualTo(ExecutionStatus.FAILED);
        assertThat(ExecutionStatus.SUCCEEDED.combine(ExecutionStatus.SUCCEEDED))
                .isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void shouldMergeToFailedWhenAnyReportFailed() {
        HostRef host = HostRef.of("h");
        ExecutionReport failed =
                ExecutionReport.of(
                        "p",
                        ExecutionStatus.FAILED,
                        List.of(
                                StepExecution.failed(
                                        "a",
                                        host,
                                        "t0",
                                        "t1",
                                        new ExecutionError(ExecutionError.EXECUTION_ERROR, "boom"))));
        ExecutionReport partial =
                ExecutionReport.of(
                        "p",
                        ExecutionStatus.PARTIAL,
                        List.of(
                                StepExecution.skipped(
                                        "b", host, new ExecutionError(ExecutionError.NO_EXECUTOR, "x"))));

        assertThat(ExecutionReport.merge("p", List.of(failed, partial)).status())
                .isEqualTo(ExecutionStatus.FAILED);
        assertThat(ExecutionReport.merge("p", List.of(partial, failed)).status())
                .isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    void shouldMergeReportsInOrder() {
        HostRef host = HostRef.of("h");
        ExecutionReport first =
                ExecutionReport.of(
                        "p", ExecutionStatus.SUCCEEDED, List.of(StepExecution.succeeded("a", host, "", "")));
        ExecutionReport second =
                ExecutionReport.of(
                        "p",
                        ExecutionStatus.PARTIAL,
                        List.of(
                                StepExecution.skipped(
                                        "b", host, new ExecutionError(ExecutionError.NO_EXECUTOR, "x"))));

        ExecutionReport merged = ExecutionReport.merge("p", List.of(first, second));

        assertThat(merged.status()).isEqualTo(ExecutionStatus.PARTIAL);
        assertThat(merged.steps()).extracting(StepExecution::stepId).containsExactly("a", "b");
    }

    @Test
    void shouldNormaliseOptionalFields() {
        StepExecution record =
                new StepExecution("a", null, StepStatus.PENDING, null, null, null, null, null);

        assertThat(record.host()).isEqualTo(HostRef.global());
        assertThat(record.startedAt()).isEmpty();
        assertThat(record.logs()).isEmpty();
        assertThat(record.meta()).isEmpty();
        assertThat(record.status().terminal()).isFalse();
    }

    @Test
    void shouldAttachLogs() {
        StepExecution record =
                StepExecution.succeeded("a", HostRef.of("h"), "t0", "t1")
                        .withLogs(List.of(LogLine.system("started")));

        assertThat(record.logs()).containsExactly(new LogLine("", LogStream.SYSTEM, "started"));
    }

    @Test
    void shouldRequireStatus() {
        assertThatThrownBy(() -> new ExecutionReport("p", null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("status");
    }
}
