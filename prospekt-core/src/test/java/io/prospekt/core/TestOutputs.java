package io.prospekt.core;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.EmailDraft;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import io.prospekt.core.subject.Subject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/// Canned stage outputs and reports shared by tests.
public final class TestOutputs {

    private TestOutputs() {}

    public static CompanyProfile profile(String company) {
        return new CompanyProfile(
                company,
                company + " makes things.",
                "Manufacturing",
                "https://example.com",
                List.of("Founded 2001"),
                List.of(),
                List.of());
    }

    public static MarketAnalysis analysis() {
        return new MarketAnalysis(
                "KEY BUSINESS CHALLENGES\n1. Growth",
                List.of("Growth"),
                List.of("Automation"),
                "Lead with value.");
    }

    public static ContactRoster roster() {
        var contact =
                new Contact(
                        "Jane Smith", "CTO", "", "", "jane.smith@example.com", 10, "Tech leader");
        return new ContactRoster(1, List.of(contact));
    }

    public static OutreachDrafts drafts() {
        return new OutreachDrafts(
                List.of(
                        new EmailDraft(
                                "Jane Smith",
                                "CTO",
                                "jane.smith@example.com",
                                "Helping Example with Growth",
                                "Hi Jane",
                                10)));
    }

    /// Returns the canned output for a stage.
    public static StageOutput outputFor(StageName stage, String company) {
        return switch (stage) {
            case RESEARCH -> profile(company);
            case ANALYSIS -> analysis();
            case CONTACT_DISCOVERY -> roster();
            case OUTREACH -> drafts();
        };
    }

    /// Returns a completed report with every stage output present.
    public static Report completedReport(String company) {
        Subject subject = Subject.of(company);
        return new Report(
                subject,
                UUID.randomUUID().toString(),
                RunStatus.COMPLETED,
                Map.of(
                        StageName.RESEARCH, profile(subject.displayName()),
                        StageName.ANALYSIS, analysis(),
                        StageName.CONTACT_DISCOVERY, roster(),
                        StageName.OUTREACH, drafts()),
                List.of(),
                List.of(),
                Instant.parse("2026-01-01T10:00:00Z"),
                Instant.parse("2026-01-01T10:00:05Z"),
                Map.of(),
                false);
    }
}
