package io.stagecraft.cli.commands;

import io.stagecraft.cli.exception.InputFileException;
import io.stagecraft.core.agent.AgentExecutionException;
import io.stagecraft.core.agent.HostPlanAgent;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.serialization.PlanDecodeException;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Executes one host plan with strict input validation and emits the execution report.
///
/// The host plan is strict-decoded (its `planId` is peeked first so decode errors name
/// the plan), must target a host with a non-empty `logicalId`, and runs through
/// {@link HostPlanAgent}. The report is printed as JSON or written to `--output`.
///
/// A report with status `failed` or `partial` is still a successful command run; only
/// input, decode and agent errors make the command fail.
///
/// ### Usage
/// ```
/// stagecraft agent run --hostplan hostplan-web-1.json
/// stagecraft agent run --hostplan hostplan-web-1.json --output report.json
/// ```
@Command(name = "run", description = "Execute a host plan")
public class AgentRunCommand extends StagecraftCommand {

    @Option(
            names = {"-f", "--hostplan"},
            description = "Path to the host plan JSON file",
            required = true)
    private Path hostPlanPath;

    @Option(
            names = {"-o", "--output"},
            description = "Path to write the execution report to (default: stdout)")
    private Path outputPath;

    @Inject private HostPlanAgent agent;

    @Override
    protected void execute() {
        try {
            byte[] data = readInput(hostPlanPath, "host plan");
            String planId = codec().peekPlanId(data).orElse("");

            HostPlan hostPlan;
            try {
                hostPlan = codec().decodeHostPlan(data, planId);
            } catch (PlanDecodeException e) {
                fail("decoding host plan from \"" + hostPlanPath + "\": " + e.getMessage());
                return;
            }
            if (!hostPlan.host().hasLogicalId()) {
                fail(
                        "host plan from \""
                                + hostPlanPath
                                + "\" has empty host.logicalId (required for host plans)");
                return;
            }

            ExecutionReport report = agent.execute(hostPlan);
            if (outputPath == null) {
                printJson(report);
            } else {
                writeJson(outputPath, report);
                System.out.println("Execution report written to " + outputPath);
            }
        } catch (InputFileException e) {
            fail(e.getMessage());
        } catch (AgentExecutionException e) {
            fail("executing host plan: " + e.getMessage());
        } catch (IOException e) {
            fail("writing execution report: " + e.getMessage());
        }
    }
}
