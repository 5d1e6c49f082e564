package io.prospekt.serialization;

import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.report.Report;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.EmailDraft;
import io.prospekt.core.stage.FailureKind;
import io.prospekt.core.stage.NewsItem;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import io.prospekt.core.subject.Subject;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reports with every kind of output, shared by the serialization tests.
final class ReportFixtures {

    static final Instant STARTED = Instant.parse("2025-03-10T09:00:00Z");
    static final Instant FINISHED = Instant.parse("2025-03-10T09:00:42Z");

    private ReportFixtures() {}

    static Report completed(String company) {
        Subject subject = Subject.of(company);
        Map<StageName, StageOutput> outputs = new LinkedHashMap<>();
        outputs.put(
                StageName.RESEARCH,
                new CompanyProfile(
                        subject.displayName(),
                        "A leading technology company.",
                        "Industry: Enterprise Software",
                        "https://www.testco.com",
                        List.of("Founded in 2010"),
                        List.of(
                                new NewsItem(
                                        "TestCo raises Series C",
                                        "Funding for expansion.",
                                        "https://news.example.com/1")),
                        List.of(
                                new SearchHit(
                                        "TestCo | Home",
                                        "Enterprise software",
                                        "https://www.testco.com"))));
        outputs.put(
                StageName.ANALYSIS,
                new MarketAnalysis(
                        "KEY BUSINESS CHALLENGES\n1. Scaling",
                        List.of("Scaling", "Hiring"),
                        List.of("Automation"),
                        "Lead with ROI."));
        outputs.put(
                StageName.CONTACT_DISCOVERY,
                new ContactRoster(
                        2,
                        List.of(
                                new Contact(
                                        "Sarah Johnson",
                                        "CEO",
                                        "https://linkedin.com/in/sarah",
                                        "Serial founder",
                                        "sarah.johnson@testco.com",
                                        10,
                                        "C-Level Executive"),
                                new Contact(
                                        "Michael Chen",
                                        "VP of Sales",
                                        "",
                                        "",
                                        "michael.chen@testco.com",
                                        8,
                                        "VP Level"))));
        outputs.put(
                StageName.OUTREACH,
                new OutreachDrafts(
                        List.of(
                                new EmailDraft(
                                        "Sarah Johnson",
                                        "CEO",
                                        "sarah.johnson@testco.com",
                                        "Helping TestCo with Scaling",
                                        "Hi Sarah,\n\nQuick note.",
                                        10))));

        Map<StageName, Duration> durations = new LinkedHashMap<>();
        durations.put(StageName.RESEARCH, Duration.ofMillis(1500));
        durations.put(StageName.ANALYSIS, Duration.ofSeconds(12));
        durations.put(StageName.CONTACT_DISCOVERY, Duration.ofMillis(800));
        durations.put(StageName.OUTREACH, Duration.ofSeconds(9));

        return new Report(
                subject,
                "run-1",
                RunStatus.COMPLETED,
                outputs,
                List.of(),
                List.of(),
                STARTED,
                FINISHED,
                durations,
                false);
    }

    static Report partial(String company) {
        Subject subject = Subject.of(company);
        return new Report(
                subject,
                "run-2",
                RunStatus.PARTIAL_FAILURE,
                Map.of(
                        StageName.RESEARCH,
                        new CompanyProfile(
                                subject.displayName(), "", "", "", null, null, null)),
                List.of(
                        new StageError(
                                StageName.CONTACT_DISCOVERY,
                                FailureKind.TERMINAL,
                                "No contacts found",
                                1,
                                FINISHED)),
                List.of(StageName.OUTREACH),
                STARTED,
                FINISHED,
                Map.of(StageName.RESEARCH, Duration.ofMillis(300)),
                false);
    }
}
