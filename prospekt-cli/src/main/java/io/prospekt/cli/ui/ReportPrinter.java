package io.prospekt.cli.ui;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.EmailDraft;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/// Renders a {@link Report} summary to the terminal.
///
/// ### Output Format
/// ```
/// ────────────────────────────────────────────────────────────
///   SALES INTELLIGENCE REPORT: TestCo
/// ────────────────────────────────────────────────────────────
///   Status: COMPLETED • Stages: 4/4 • 3.2s
///
///   Company Overview
///   ...
/// ```
///
/// Sections are driven by the outputs present in the report, so partial and failed
/// reports print what they have followed by the stage errors and skipped stages.
///
/// @implNote **Not thread-safe**. Writes directly to the supplied stream.
public class ReportPrinter {

    static final int TOP_CHALLENGES = 3;
    static final int TOP_CONTACTS = 3;
    private static final int WIDTH = 100;

    private final PrintStream out;
    private final AnsiStyles styles;

    public ReportPrinter(PrintStream out, AnsiStyles styles) {
        this.out = out;
        this.styles = styles;
    }

    /// Prints the full summary of a report.
    public void print(Report report) {
        out.println();
        out.println(styles.rule());
        out.println(
                "  " + styles.bold("SALES INTELLIGENCE REPORT: " + report.subject().displayName()));
        out.println(styles.rule());
        printStatusLine(report);

        for (StageOutput output : report.outputs().values()) {
            if (output instanceof CompanyProfile profile) {
                printProfile(profile);
            } else if (output instanceof MarketAnalysis analysis) {
                printAnalysis(analysis);
            } else if (output instanceof ContactRoster roster) {
                printContacts(roster);
            } else if (output instanceof OutreachDrafts drafts) {
                printDrafts(drafts);
            }
        }

        printProblems(report);
        out.println(styles.rule());
        out.println();
    }

    private void printStatusLine(Report report) {
        String status = colorStatus(report.status());
        String line =
                "  Status: "
                        + status
                        + " "
                        + styles.bullet()
                        + " Stages: "
                        + report.outputs().size()
                        + "/"
                        + StageName.values().length
                        + " "
                        + styles.bullet()
                        + " "
                        + formatSeconds(report.elapsed().toMillis());
        if (report.servedFromCache()) {
            line += " " + styles.bullet() + " " + styles.accent("from cache");
        }
        out.println(line);
    }

    private void printProfile(CompanyProfile profile) {
        section("Company Overview");
        field("Company", profile.companyName());
        field("Industry", profile.industry());
        field("Website", profile.website());
        field("Overview", styles.abbreviate(profile.overview(), WIDTH));
        if (!profile.recentNews().isEmpty()) {
            field("Recent news", profile.recentNews().size() + " item(s)");
        }
    }

    private void printAnalysis(MarketAnalysis analysis) {
        List<String> challenges = analysis.keyChallenges();
        section("Key Challenges (" + challenges.size() + ")");
        for (int i = 0; i < Math.min(TOP_CHALLENGES, challenges.size()); i++) {
            out.println("    " + (i + 1) + ". " + styles.abbreviate(challenges.get(i), WIDTH));
        }
        if (!analysis.recommendedApproach().isBlank()) {
            field("Approach", styles.abbreviate(analysis.recommendedApproach(), WIDTH));
        }
    }

    private void printContacts(ContactRoster roster) {
        section("Priority Contacts (" + roster.totalFound() + " found)");
        for (Contact contact : roster.top(TOP_CONTACTS)) {
            out.println(
                    "    "
                            + styles.bullet()
                            + " "
                            + styles.bold(contact.name())
                            + " - "
                            + contact.title()
                            + " "
                            + styles.gray("(" + contact.priorityScore() + "/10)"));
        }
    }

    private void printDrafts(OutreachDrafts drafts) {
        section("Outreach Emails Generated: " + drafts.emails().size());
        if (drafts.emails().isEmpty()) {
            return;
        }
        EmailDraft sample = drafts.emails().get(0);
        out.println(
                "    "
                        + styles.gray(
                                "Sample, to " + sample.recipient() + " <" + sample.emailAddress() + ">"));
        out.println("    Subject: " + sample.subject());
        for (String line : sample.body().split("\n")) {
            out.println("    " + styles.gray(line));
        }
    }

    private void printProblems(Report report) {
        if (report.errors().isEmpty() && report.skipped().isEmpty()) {
            return;
        }
        section("Problems");
        for (StageError error : report.errors()) {
            out.println(
                    "    "
                            + styles.crossmark()
                            + " "
                            + styles.bold(error.stage().id())
                            + " "
                            + styles.gray(
                                    "("
                                            + error.kind()
                                            + ", "
                                            + error.attempts()
                                            + " attempt(s))")
                            + ": "
                            + error.message());
        }
        for (StageName stage : report.skipped()) {
            out.println("    " + styles.skipped() + " " + stage.id() + " skipped");
        }
    }

    private void section(String title) {
        out.println();
        out.println("  " + styles.bold(title));
    }

    private void field(String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        out.println("    " + styles.gray(label + ":") + " " + value);
    }

    private String colorStatus(RunStatus status) {
        return switch (status) {
            case COMPLETED -> styles.success(status.name());
            case PARTIAL_FAILURE -> styles.warn(status.name());
            case FAILED, CANCELLED -> styles.error(status.name());
        };
    }

    static String formatSeconds(long millis) {
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }
}
