package io.stagecraft.cli.commands;

import io.stagecraft.cli.exception.InputFileException;
import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.plan.PlanSliceException;
import io.stagecraft.core.plan.PlanSlicer;
import io.stagecraft.core.plan.SliceResult;
import io.stagecraft.serialization.PlanDecodeException;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Checks that a plan strict-decodes and slices without errors, then prints a summary.
///
/// ### Usage
/// ```
/// stagecraft validate --plan plan.json
/// ```
@Command(name = "validate", description = "Validate a plan")
public class ValidateCommand extends StagecraftCommand {

    @Option(
            names = {"-p", "--plan"},
            description = "Path to the plan JSON file",
            required = true)
    private Path planPath;

    @Inject private PlanSlicer slicer;

    @Override
    protected void execute() {
        try {
            Plan plan = codec().decodePlan(readInput(planPath, "plan"));
            SliceResult result = slicer.slice(plan);

            System.out.println(" [OK] Plan is valid!");
            System.out.println("   Plan: " + plan.id());
            System.out.println("   Steps: " + plan.steps().size());
            for (String hostId : result.hostIds()) {
                System.out.println(
                        "   Host "
                                + hostId
                                + ": "
                                + result.hostPlans().get(hostId).steps().size()
                                + " step(s)");
                List<String> globalDeps = result.globalDependenciesOf(hostId);
                if (!globalDeps.isEmpty()) {
                    System.out.println("     needs global: " + String.join(", ", globalDeps));
                }
            }
            if (result.globalStepIds().isEmpty()) {
                System.out.println("   Global steps: none");
            } else {
                System.out.println("   Global steps: " + String.join(", ", result.globalStepIds()));
            }
        } catch (InputFileException | PlanDecodeException | PlanSliceException e) {
            fail("Validation failed: " + e.getMessage());
        }
    }
}
