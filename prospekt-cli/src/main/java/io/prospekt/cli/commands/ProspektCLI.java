package io.prospekt.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Prospekt CLI application.
///
/// Registers all available subcommands:
/// - `research` - Run the intelligence pipeline for one company
/// - `cache` - Inspect and maintain the report cache
///
/// @see ResearchCommand
/// @see CacheCommand
@TopCommand
@Command(
        name = "prospekt",
        description = "Sales intelligence for one company at a time",
        mixinStandardHelpOptions = true,
        subcommands = {ResearchCommand.class, CacheCommand.class})
public class ProspektCLI {}
