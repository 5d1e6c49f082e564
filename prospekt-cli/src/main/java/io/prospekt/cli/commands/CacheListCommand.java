package io.prospekt.cli.commands;

import io.prospekt.cli.ui.AnsiStyles;
import io.prospekt.core.cache.CacheEntry;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.report.Report;
import jakarta.inject.Inject;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Lists cached reports ordered by company key.
@Command(name = "list", description = "List cached reports")
class CacheListCommand extends ProspektCommand {

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
        List<CacheEntry> entries = reportCache.entries();

        if (entries.isEmpty()) {
            System.out.println(styles.gray("No cached reports."));
            return EXIT_OK;
        }

        System.out.println(styles.bold("Cached reports (" + entries.size() + "):"));
        for (CacheEntry entry : entries) {
            Report report = entry.report();
            System.out.printf(
                    "  %s %s %s %s%n",
                    styles.bullet(),
                    styles.bold(report.subject().displayName()),
                    styles.gray("[" + report.status() + "]"),
                    styles.gray("cached " + entry.createdAt()));
        }
        return EXIT_OK;
    }
}
