package io.prospekt.core.stage.outreach;

import io.prospekt.core.provider.CompletionOptions;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.EmailDraft;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Fourth stage: drafts a personalized email for each of the top three contacts.
///
/// A transient model failure fails the whole attempt so the orchestrator can retry it.
/// A terminal failure for one contact drops that email; the stage only fails terminally
/// when no email could be drafted at all.
public final class OutreachStage implements Stage {

    private static final Logger logger = Logger.getLogger(OutreachStage.class.getName());

    static final CompletionOptions OPTIONS = CompletionOptions.of(0.8, 800);
    static final int MAX_EMAILS = 3;
    static final String FALLBACK_TOPIC = "Your Technology Needs";

    private final LanguageModel model;

    public OutreachStage(LanguageModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public StageName name() {
        return StageName.OUTREACH;
    }

    @Override
    public Set<StageName> dependencies() {
        return Set.of(StageName.ANALYSIS, StageName.CONTACT_DISCOVERY);
    }

    @Override
    public StageResult invoke(Subject subject, ContextView context) {
        MarketAnalysis analysis = context.require(StageName.ANALYSIS, MarketAnalysis.class);
        ContactRoster roster = context.require(StageName.CONTACT_DISCOVERY, ContactRoster.class);
        String company = subject.displayName();
        String emailSubject = subjectLine(company, analysis.keyChallenges());

        List<EmailDraft> drafts = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (Contact contact : roster.top(MAX_EMAILS)) {
            logger.fine("Generating email for " + contact.name());
            try {
                String body = model.complete(buildPrompt(contact, analysis, company), OPTIONS);
                drafts.add(
                        new EmailDraft(
                                contact.name(),
                                contact.title(),
                                contact.email(),
                                emailSubject,
                                body.strip(),
                                contact.priorityScore()));
            } catch (ProviderException e) {
                if (e.getKind().isRetryable()) {
                    return StageResult.failure(
                            e.getKind(),
                            "Email generation for " + contact.name() + " failed: " + e.getMessage(),
                            e);
                }
                logger.warning(
                        "Dropping email for " + contact.name() + ": " + e.getMessage());
                dropped.add(contact.name());
            }
        }

        if (drafts.isEmpty()) {
            return StageResult.terminalFailure(
                    dropped.isEmpty()
                            ? "No contacts to write to"
                            : "No email could be generated for " + String.join(", ", dropped));
        }

        logger.info("Generated " + drafts.size() + " personalized emails for " + company);
        return StageResult.success(new OutreachDrafts(drafts));
    }

    /// Builds `"Helping {company} with {topic}"` where the topic is the first four words
    /// of the leading challenge, with an ellipsis when it was shortened.
    static String subjectLine(String company, List<String> challenges) {
        return "Helping " + company + " with " + mainTopic(challenges);
    }

    private static String mainTopic(List<String> challenges) {
        if (challenges.isEmpty()) {
            return FALLBACK_TOPIC;
        }
        String[] words = challenges.get(0).strip().split("\\s+");
        if (words.length <= 4) {
            return String.join(" ", words);
        }
        return String.join(" ", List.of(words).subList(0, 4)) + "...";
    }

    static String buildPrompt(Contact contact, MarketAnalysis analysis, String company) {
        StringBuilder challenges = new StringBuilder();
        for (String challenge : firstN(analysis.keyChallenges(), 3)) {
            challenges.append("- ").append(challenge).append('\n');
        }
        StringBuilder opportunities = new StringBuilder();
        for (String opportunity : firstN(analysis.opportunities(), 2)) {
            opportunities.append("- ").append(opportunity).append('\n');
        }

        return """
                You are writing a personalized sales outreach email.

                TARGET CONTACT:
                - Name: %s
                - Title: %s
                - Company: %s

                COMPANY CHALLENGES IDENTIFIED:
                %s
                OPPORTUNITIES FOR OUR SOLUTION:
                %s
                RECOMMENDED APPROACH:
                %s

                Write a professional, personalized sales email that:
                1. Opens with a relevant insight or observation about their company
                2. Mentions 1-2 specific challenges they likely face
                3. Briefly explains how our solution addresses these challenges
                4. Includes a clear, low-pressure call-to-action
                5. Is concise (150-200 words)
                6. Sounds natural and human, not robotic

                Do not include [placeholders]. Write the complete email body only \
                (no subject line, no signature).
                Make it specific to %s and %s.
                """
                .formatted(
                        contact.name(),
                        contact.title(),
                        company,
                        challenges,
                        opportunities,
                        analysis.recommendedApproach(),
                        company,
                        contact.title());
    }

    private static List<String> firstN(List<String> items, int n) {
        return items.subList(0, Math.min(n, items.size()));
    }
}
