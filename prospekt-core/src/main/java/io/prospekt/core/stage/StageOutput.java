package io.prospekt.core.stage;

import io.prospekt.core.provider.SearchHit;
import java.util.List;
import java.util.Objects;

/// Structured output of one pipeline stage.
///
/// A closed set with exactly one variant per {@link StageName}. Values are immutable;
/// list components are defensively copied and never null.
///
/// ### Permitted Subtypes
/// - {@link CompanyProfile} - research
/// - {@link MarketAnalysis} - analysis
/// - {@link ContactRoster} - contact discovery
/// - {@link OutreachDrafts} - outreach generation
///
/// @see io.prospekt.core.execution.ExecutionContext#record(StageName, StageOutput)
public sealed interface StageOutput {

    /// Returns the stage that produces this variant.
    StageName stage();

    /// Company facts gathered from search.
    ///
    /// @param companyName display name of the researched company, not null
    /// @param overview short description, may be empty
    /// @param industry industry line when one was found, may be empty
    /// @param website first official-looking URL, may be empty
    /// @param keyFacts remaining overview snippets
    /// @param recentNews news headlines with summaries
    /// @param sources raw hits the profile was built from
    record CompanyProfile(
            String companyName,
            String overview,
            String industry,
            String website,
            List<String> keyFacts,
            List<NewsItem> recentNews,
            List<SearchHit> sources)
            implements StageOutput {

        public CompanyProfile {
            Objects.requireNonNull(companyName, "companyName must not be null");
            overview = overview != null ? overview : "";
            industry = industry != null ? industry : "";
            website = website != null ? website : "";
            keyFacts = keyFacts != null ? List.copyOf(keyFacts) : List.of();
            recentNews = recentNews != null ? List.copyOf(recentNews) : List.of();
            sources = sources != null ? List.copyOf(sources) : List.of();
        }

        @Override
        public StageName stage() {
            return StageName.RESEARCH;
        }
    }

    /// Sales-oriented reading of the company profile.
    ///
    /// @param analysis full model answer, not null
    /// @param keyChallenges up to five extracted challenges
    /// @param opportunities up to five extracted opportunities
    /// @param recommendedApproach condensed approach paragraph, not null
    record MarketAnalysis(
            String analysis,
            List<String> keyChallenges,
            List<String> opportunities,
            String recommendedApproach)
            implements StageOutput {

        public MarketAnalysis {
            Objects.requireNonNull(analysis, "analysis must not be null");
            Objects.requireNonNull(recommendedApproach, "recommendedApproach must not be null");
            keyChallenges = keyChallenges != null ? List.copyOf(keyChallenges) : List.of();
            opportunities = opportunities != null ? List.copyOf(opportunities) : List.of();
        }

        @Override
        public StageName stage() {
            return StageName.ANALYSIS;
        }
    }

    /// Decision makers found for the company, highest priority first.
    ///
    /// @param totalFound number of contacts discovered before ranking
    /// @param contacts ranked contacts, descending by {@link Contact#priorityScore()}
    record ContactRoster(int totalFound, List<Contact> contacts) implements StageOutput {

        public ContactRoster {
            contacts = contacts != null ? List.copyOf(contacts) : List.of();
        }

        /// Returns the first `limit` contacts.
        public List<Contact> top(int limit) {
            return contacts.subList(0, Math.min(limit, contacts.size()));
        }

        @Override
        public StageName stage() {
            return StageName.CONTACT_DISCOVERY;
        }
    }

    /// Personalized email drafts, one per targeted contact.
    ///
    /// @param emails drafts in contact priority order
    record OutreachDrafts(List<EmailDraft> emails) implements StageOutput {

        public OutreachDrafts {
            emails = emails != null ? List.copyOf(emails) : List.of();
        }

        @Override
        public StageName stage() {
            return StageName.OUTREACH;
        }
    }
}
