package io.prospekt.cli.execution;

import io.prospekt.cli.ui.AnsiStyles;
import io.prospekt.core.execution.RunListener;
import io.prospekt.core.report.Report;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.io.PrintStream;
import java.time.Duration;

/// Run listener that prints stage progress to the terminal.
///
/// ### Output Format
/// ```
///   * research (attempt 1)
///   ✓ research
///   ↻ analysis retry 2 in 500 ms: rate limited
///   ✗ contact-discovery: No contacts found
///   – outreach skipped (needs contact-discovery)
/// ```
///
/// @implNote **Not thread-safe**. Intended for the single run of one CLI invocation.
/// @see io.prospekt.core.execution.RunListener
public class ConsoleRunListener implements RunListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public ConsoleRunListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onCacheHit(Report report) {
        out.println(
                "  "
                        + styles.accent("*")
                        + " Cached report found for "
                        + styles.bold(report.subject().displayName()));
    }

    @Override
    public void onRunStart(Subject subject, String runId) {
        out.println("  " + styles.gray("Run " + runId + " for " + subject.displayName()));
    }

    @Override
    public void onStageStart(StageName stage, int attempt) {
        out.println(
                "  "
                        + styles.accent("*")
                        + " "
                        + stage.id()
                        + styles.gray(" (attempt " + attempt + ")"));
    }

    @Override
    public void onStageRetry(
            StageName stage, int nextAttempt, StageResult.Failure failure, Duration delay) {
        out.println(
                "  "
                        + styles.retry()
                        + " "
                        + stage.id()
                        + " retry "
                        + nextAttempt
                        + " in "
                        + delay.toMillis()
                        + " ms: "
                        + failure.message());
    }

    @Override
    public void onStageComplete(StageName stage, StageOutput output, int attempts) {
        out.println("  " + styles.checkmark() + " " + styles.bold(stage.id()));
    }

    @Override
    public void onStageFailed(StageError error) {
        out.println(
                "  "
                        + styles.crossmark()
                        + " "
                        + styles.bold(error.stage().id())
                        + ": "
                        + styles.error(error.message()));
    }

    @Override
    public void onStageSkipped(StageName stage, StageName missingDependency) {
        out.println(
                "  "
                        + styles.skipped()
                        + " "
                        + stage.id()
                        + styles.gray(" skipped (needs " + missingDependency.id() + ")"));
    }
}
