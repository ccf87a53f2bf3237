package io.stagecraft.cli.commands;

import io.stagecraft.cli.exception.InputFileException;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.plan.PlanSliceException;
import io.stagecraft.core.plan.PlanSlicer;
import io.stagecraft.core.plan.SliceResult;
import io.stagecraft.serialization.PlanDecodeException;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Slices a plan into per-host host plans and global steps.
///
/// Without an output directory the whole {@link SliceResult} is printed as JSON.
/// With one, each host plan is written to `hostplan-<host>.json` and, when the plan has
/// global steps, the global steps to `global-steps.json`.
///
/// ### Usage
/// ```
/// stagecraft slice --plan plan.json
/// stagecraft slice --plan plan.json --output-dir build/hostplans
/// ```
@Command(name = "slice", description = "Slice a plan into per-host host plans")
public class SliceCommand extends StagecraftCommand {

    private static final Logger logger = Logger.getLogger(SliceCommand.class.getName());

    static final String GLOBAL_STEPS_FILE = "global-steps.json";

    @Option(
            names = {"-p", "--plan"},
            description = "Path to the plan JSON file",
            required = true)
    private Path planPath;

    @Option(
            names = {"-o", "--output-dir"},
            description = "Directory to write host plans to (default: stdout)")
    private Path outputDir;

    @Inject private PlanSlicer slicer;

    @Override
    protected void execute() {
        try {
            Plan plan = codec().decodePlan(readInput(planPath, "plan"));
            SliceResult result = slicer.slice(plan);
            logger.info(
                    "Sliced plan "
                            + plan.id()
                            + " into "
                            + result.hostPlans().size()
                            + " host plan(s) and "
                            + result.globalSteps().size()
                            + " global step(s)");

            Optional<Path> targetDir = resolveOutputDir(outputDir);
            if (targetDir.isEmpty()) {
                printJson(result);
                return;
            }
            writeFiles(result, targetDir.get());
        } catch (InputFileException | PlanDecodeException e) {
            fail(e.getMessage());
        } catch (PlanSliceException e) {
            fail("slicing plan: " + e.getMessage());
        } catch (IOException e) {
            fail("writing output: " + e.getMessage());
        }
    }

    private void writeFiles(SliceResult result, Path dir) throws IOException, InputFileException {
        Map<Path, HostPlan> files = new LinkedHashMap<>();
        for (Map.Entry<String, HostPlan> entry : result.hostPlans().entrySet()) {
            files.put(hostPlanFile(dir, entry.getKey()), entry.getValue());
        }

        Files.createDirectories(dir);
        for (Map.Entry<Path, HostPlan> entry : files.entrySet()) {
            writeJson(entry.getKey(), entry.getValue());
            System.out.println(
                    "Host plan for "
                            + entry.getValue().host().logicalId()
                            + " written to "
                            + entry.getKey());
        }
        if (!result.globalSteps().isEmpty()) {
            Path file = dir.resolve(GLOBAL_STEPS_FILE);
            writeJson(file, result.globalSteps());
            System.out.println("Global steps written to " + file);
        }
    }

    /// Resolves the host plan file for a host, which must land directly inside `dir`.
    static Path hostPlanFile(Path dir, String hostId) throws InputFileException {
        Path base = dir.toAbsolutePath().normalize();
        Path file;
        try {
            file = base.resolve(hostPlanFileName(hostId)).normalize();
        } catch (InvalidPathException e) {
            throw new InputFileException(
                    "host id \"" + hostId + "\" is not usable as a file name", e);
        }
        if (!base.equals(file.getParent())) {
            throw new InputFileException(
                    "host id \"" + hostId + "\" resolves outside the output directory");
        }
        return file;
    }

    static String hostPlanFileName(String hostId) {
        return "hostplan-" + hostId + ".json";
    }
}
