package io.prospekt.cli.commands;

import io.prospekt.cli.ui.AnsiStyles;
import io.prospekt.core.cache.CacheIOException;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.subject.Subject;
import jakarta.inject.Inject;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Removes the cached report of one company so the next run starts fresh.
@Command(name = "invalidate", description = "Remove the cached report of a company")
class CacheInvalidateCommand extends ProspektCommand {

    @Parameters(
            index = "0",
            arity = "1..*",
            paramLabel = "<company>",
            description = "Company name; several words are joined with spaces")
    private List<String> companyName;

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

        Subject subject;
        try {
            subject = Subject.of(String.join(" ", companyName));
        } catch (IllegalArgumentException e) {
            System.err.printf(
                    "%s %s%n", styles.crossmark(), styles.bold("Company name must not be blank"));
            return EXIT_USAGE;
        }

        try {
            if (reportCache.invalidate(subject)) {
                System.out.printf(
                        "%s Removed cached report for %s%n",
                        styles.checkmark(), styles.bold(subject.displayName()));
            } else {
                System.out.println(
                        styles.gray("No cached report for " + subject.displayName() + "."));
            }
            return EXIT_OK;
        } catch (CacheIOException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Cache update failed:"), e.getMessage());
            return EXIT_FAILED;
        }
    }
}
