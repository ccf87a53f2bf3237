package io.stagecraft.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.stagecraft.core.agent.AgentExecutionException;
import io.stagecraft.core.agent.DefaultStepExecutorRegistry;
import io.stagecraft.core.agent.HostPlanAgent;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.core.report.ExecutionStatus;
import io.stagecraft.serialization.inputs.ValidatingStepExecutor;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class AgentRunCommandTest extends BaseCommandTest {

    private static final String HOST_PLAN_JSON =
            """
            {
              "version": "v1",
              "planId": "plan-7",
              "host": {"logicalId": "host-a"},
              "steps": [
                {"id": "rollout", "index": 1, "action": "rollout",
                 "target": {"kind": "service", "name": "api", "provider": "compose"},
                 "inputs": {"mode": "rolling", "batch_size": 1}},
                {"id": "smoke", "index": 2, "action": "rollout",
                 "target": {"kind": "service", "name": "api", "provider": "compose"},
                 "inputs": {"mode": ""}, "dependsOn": ["rollout"]}
              ]
            }
            """;

    @TempDir Path tempDir;

    private AgentRunCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new AgentRunCommand();
        injectField(command, "codec", codec);
    }

    @Nested
    class WithValidatingAgent {

        @BeforeEach
        void setUp() throws Exception {
            DefaultStepExecutorRegistry registry = new DefaultStepExecutorRegistry();
            registry.registerForAllActions(new ValidatingStepExecutor(codec));
            injectField(command, "agent", new HostPlanAgent(registry));
        }

        @Test
        void shouldPrintFailedReportWithoutFailingCommand() throws Exception {
            injectField(command, "hostPlanPath", writeFile(tempDir, "hp.json", HOST_PLAN_JSON));

            command.run();

            assertThat(command.getExitCode()).isZero();
            ExecutionReport report =
                    codec.decodeExecutionReport(outContent.toString().strip().getBytes());
            assertThat(report.planId()).isEqualTo("plan-7");
            assertThat(report.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(report.steps()).hasSize(2);
            assertThat(report.steps().get(1).error().message())
                    .isEqualTo("rollout inputs validation failed: mode is required");
        }

        @Test
        void shouldWriteReportToOutputFile() throws Exception {
            String valid = HOST_PLAN_JSON.replace("{\"mode\": \"\"}", "{\"mode\": \"all\"}");
            Path output = tempDir.resolve("report.json");
            injectField(command, "hostPlanPath", writeFile(tempDir, "hp.json", valid));
            injectField(command, "outputPath", output);

            command.run();

            assertThat(command.getExitCode()).isZero();
            assertThat(outContent.toString()).contains("Execution report written to");
            ExecutionReport report = codec.decodeExecutionReport(Files.readAllBytes(output));
            assertThat(report.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        }

        @Test
        void shouldNamePlanIdInDecodeErrors() throws Exception {
            String bad = HOST_PLAN_JSON.replace("\"planId\": \"plan-7\",", "\"planId\": \"plan-7\", \"extra\": true,");
            injectField(command, "hostPlanPath", writeFile(tempDir, "hp.json", bad));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(1);
            assertThat(errContent.toString())
                    .contains("strict decode host plan (planId: \"plan-7\")")
                    .contains("unknown field \"extra\"");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockAgent {

        @Mock private HostPlanAgent agent;

        @BeforeEach
        void setUp() throws Exception {
            injectField(command, "agent", agent);
        }

        @Test
        void shouldRejectEmptyLogicalId() throws Exception {
            String global = HOST_PLAN_JSON.replace("\"logicalId\": \"host-a\"", "\"logicalId\": \"\"");
            injectField(command, "hostPlanPath", writeFile(tempDir, "hp.json", global));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(1);
            assertThat(errContent.toString()).contains("has empty host.logicalId");
            verifyNoInteractions(agent);
        }

        @Test
        void shouldReportAgentErrors() throws Exception {
            injectField(command, "hostPlanPath", writeFile(tempDir, "hp.json", HOST_PLAN_JSON));
            when(agent.execute(any(HostPlan.class)))
                    .thenThrow(new AgentExecutionException("step \"smoke\" depends on \"x\" which has not completed"));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(1);
            assertThat(errContent.toString()).contains("[FAIL] executing host plan: step \"smoke\"");
        }
    }
}
