package io.prospekt.cli.commands;

import picocli.CommandLine.Command;

/// Groups the report cache maintenance commands.
///
/// ### Usage
/// ```bash
/// prospekt cache list
/// prospekt cache invalidate <company>
/// prospekt cache clear
/// ```
///
/// Invoked without a subcommand, picocli reports a usage error.
///
/// @see CacheListCommand
/// @see CacheInvalidateCommand
/// @see CacheClearCommand
@Command(
        name = "cache",
        description = "Inspect and maintain the report cache",
        subcommands = {
            CacheListCommand.class,
            CacheInvalidateCommand.class,
            CacheClearCommand.class
        })
class CacheCommand {}
