package io.stagecraft.cli.commands;

import io.stagecraft.cli.exception.InputFileException;
import io.stagecraft.serialization.StrictPlanCodec;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.IExitCodeGenerator;

/// Base class for all Stagecraft CLI commands.
///
/// Owns the {@link #run()} / {@link #execute()} contract, file reading, JSON output and
/// failure reporting. Subclasses implement {@link #execute()} and call {@link #fail}
/// on error, which prints ` [FAIL] <message>` to stderr and makes the command exit 1.
///
/// ### Output Formatting
/// JSON is indented unless `stagecraft.output.pretty` is `false`.
///
/// ### Output Directory Resolution
/// 1. CLI option of the subcommand (e.g. `--output-dir`)
/// 2. Config property `stagecraft.output.dir`
/// 3. None: output goes to stdout
///
/// @implNote Subclasses must be annotated with `@Command`.
public abstract class StagecraftCommand implements Runnable, IExitCodeGenerator {

    @Inject private StrictPlanCodec codec;

    @Inject
    @ConfigProperty(name = "stagecraft.output.pretty", defaultValue = "true")
    private boolean prettyOutput;

    @Inject
    @ConfigProperty(name = "stagecraft.output.dir")
    private Optional<String> defaultOutputDir;

    private int exitCode;

    @Override
    public final void run() {
        exitCode = 0;
        execute();
    }

    protected abstract void execute();

    @Override
    public int getExitCode() {
        return exitCode;
    }

    protected StrictPlanCodec codec() {
        return codec;
    }

    /// Reports a failure and sets the exit code to 1.
    ///
    /// @param message failure description, not null
    protected void fail(String message) {
        exitCode = 1;
        System.err.println(" [FAIL] " + message);
    }

    /// Reads a whole input file.
    ///
    /// @param path  file to read, may be null
    /// @param label what the file holds, used in messages (e.g. `plan`)
    /// @return file contents, never null
    /// @throws InputFileException if the path is missing or the file cannot be read
    protected byte[] readInput(Path path, String label) throws InputFileException {
        if (path == null) {
            throw new InputFileException("no " + label + " file specified");
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new InputFileException(
                    "reading " + label + " file \"" + path + "\": " + e.getMessage(), e);
        }
    }

    /// Encodes a value with the configured formatting.
    protected byte[] toJson(Object value) {
        return prettyOutput ? codec.encodePretty(value) : codec.encode(value);
    }

    /// Prints a value as JSON on stdout.
    protected void printJson(Object value) {
        System.out.println(new String(toJson(value), StandardCharsets.UTF_8));
    }

    /// Writes a value as JSON to a file, followed by a newline.
    ///
    /// @throws IOException if the file cannot be written
    protected void writeJson(Path file, Object value) throws IOException {
        byte[] json = toJson(value);
        byte[] content = new byte[json.length + 1];
        System.arraycopy(json, 0, content, 0, json.length);
        content[json.length] = '\n';
        Files.write(file, content);
    }

    /// Resolves the output directory from the CLI option, then config.
    ///
    /// @param cliOption directory given on the command line, may be null
    /// @return the directory, or empty when output goes to stdout
    protected Optional<Path> resolveOutputDir(Path cliOption) {
        if (cliOption != null) {
            return Optional.of(cliOption);
        }
        if (defaultOutputDir != null
                && defaultOutputDir.isPresent()
                && !defaultOutputDir.get().isBlank()) {
            return Optional.of(Path.of(defaultOutputDir.get()));
        }
        return Optional.empty();
    }
}
