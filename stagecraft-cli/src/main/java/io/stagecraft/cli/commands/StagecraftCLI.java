package io.stagecraft.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Stagecraft CLI application.
///
/// Registers the plan-handling subcommands:
/// - `slice` - Slice a plan into per-host host plans and global steps
/// - `validate` - Check that a plan decodes strictly and slices cleanly
/// - `agent run` - Execute one host plan locally and report the outcome
///
/// @see SliceCommand
/// @see ValidateCommand
/// @see AgentCommand
@TopCommand
@Command(
        name = "stagecraft",
        description = "Stagecraft deployment plan tooling",
        mixinStandardHelpOptions = true,
        subcommands = {SliceCommand.class, ValidateCommand.class, AgentCommand.class})
public class StagecraftCLI {}
