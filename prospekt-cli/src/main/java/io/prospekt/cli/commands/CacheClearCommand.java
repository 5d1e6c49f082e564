package io.prospekt.cli.commands;

import io.prospekt.cli.ui.AnsiStyles;
import io.prospekt.core.cache.CacheIOException;
import io.prospekt.core.cache.ReportCache;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Removes every cached report.
@Command(name = "clear", description = "Remove all cached reports")
class CacheClearCommand extends ProspektCommand {

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Inject private ReportCache reportCache;

    @Override
    protected boolean showBanner() {
        return false;
    }

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);
        int count = reportCache.entries().size();
        try {
            reportCache.clear();
        } catch (CacheIOException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Cache update failed:"), e.getMessage());
            return EXIT_FAILED;
        }
        System.out.printf("%s Cleared %d cached report(s)%n", styles.checkmark(), count);
        return EXIT_OK;
    }
}
