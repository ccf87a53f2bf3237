package io.stagecraft.cli.commands;

import picocli.CommandLine.Command;

/// Groups the commands that execute host plans on the local machine.
///
/// @see AgentRunCommand
@Command(
        name = "agent",
        description = "Execute host plans locally",
        subcommands = {AgentRunCommand.class})
public class AgentCommand {}
