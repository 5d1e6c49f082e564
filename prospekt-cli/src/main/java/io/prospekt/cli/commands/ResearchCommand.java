package io.prospekt.cli.commands;

import io.prospekt.cli.execution.ConsoleRunListener;
import io.prospekt.cli.producers.ProspektEnvironmentProducer;
import io.prospekt.cli.ui.AnsiStyles;
import io.prospekt.cli.ui.ReportPrinter;
import io.prospekt.core.ProspektEnvironment;
import io.prospekt.core.execution.CancellationToken;
import io.prospekt.core.execution.RunListener;
import io.prospekt.core.execution.RunOptions;
import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command that runs the intelligence pipeline for one company.
///
/// ### Usage
/// ```bash
/// prospekt research [--no-cache] [--mock] [--no-save] [-v] [--no-color] <company>
/// ```
///
/// ### Options
/// - `--no-cache` - Ignore any cached report and run every stage
/// - `--mock` - Use simulated search results and model output
/// - `--no-save` - Do not archive the report as JSON
/// - `-v, --verbose` - Show stage progress, retries and failures
/// - `--no-color` - Disable ANSI color output
///
/// Exits with {@value #EXIT_OK} for completed and partially failed runs,
/// {@value #EXIT_FAILED} for failed or cancelled runs and {@value #EXIT_USAGE} for
/// configuration errors.
///
/// @see io.prospekt.core.execution.Orchestrator
@Command(name = "research", description = "Research a company and draft outreach emails")
class ResearchCommand extends ProspektCommand {

    private static final Logger logger = Logger.getLogger(ResearchCommand.class.getName());

    @Parameters(
            index = "0",
            arity = "1..*",
            paramLabel = "<company>",
            description = "Company name; several words are joined with spaces")
    private List<String> companyName;

    @Option(
            names = {"--no-cache"},
            description = "Ignore cached reports")
    private boolean noCache = false;

    @Option(
            names = {"--mock"},
            description = "Use simulated search and model output")
    private boolean mock = false;

    @Option(
            names = {"--no-save"},
            description = "Do not write the report to the reports directory")
    private boolean noSave = false;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show stage progress")
    private boolean verbose = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Inject private ProspektEnvironmentProducer environments;

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

        ProspektEnvironment environment;
        try {
            environment = environments.create(mock, !noSave);
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Configuration error:"),
                    e.getMessage());
            return EXIT_USAGE;
        }

        if (environment.getConfig().isMockMode()) {
            System.out.println(styles.gray("  (mock mode: simulated search and model output)"));
        }
        System.out.printf(
                "%s %s%n%n",
                styles.accent("*"),
                styles.bold("Researching " + subject.displayName()));

        CancellationToken cancellation = CancellationToken.create();
        Thread cancelOnShutdown = new Thread(cancellation::cancel, "prospekt-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        try {
            RunListener listener =
                    verbose ? new ConsoleRunListener(System.out, color) : RunListener.NOOP;
            RunOptions options =
                    RunOptions.defaults()
                            .withUseCache(!noCache)
                            .withCancellation(cancellation)
                            .withListener(listener);

            Report report = environment.getOrchestrator().run(subject, options);
            new ReportPrinter(System.out, styles).print(report);

            if (report.status().isUsable()) {
                System.out.printf(
                        "%s %s%n",
                        styles.checkmark(),
                        styles.bold(
                                "Intelligence gathering complete for "
                                        + subject.displayName()));
                return EXIT_OK;
            }
            System.out.printf(
                    "%s %s%n",
                    styles.crossmark(),
                    styles.bold(
                            "Research "
                                    + report.status().name().toLowerCase(Locale.ROOT)
                                    + " for "
                                    + subject.displayName()));
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            logger.severe("Research run aborted: " + e);
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Research failed:"),
                    e.getMessage());
            return EXIT_FAILED;
        } finally {
            removeHook(cancelOnShutdown);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.fine("Shutdown in progress, cancel hook stays registered");
        }
    }
}
