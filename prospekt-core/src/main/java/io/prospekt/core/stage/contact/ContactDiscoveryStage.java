package io.prospekt.core.stage.contact;

import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Third stage: finds decision makers through a leadership search and ranks them.
///
/// Search hit titles of the form `"Name - Title - Company | Site"` are parsed into
/// {@link Contact}s; hits whose first segment does not look like a person's name are
/// ignored. Email addresses are guessed as `first.last@{company}.com`.
///
/// Finding nobody is a terminal failure, which leaves outreach generation without
/// its dependency.
///
/// @see ContactPrioritizer
public final class ContactDiscoveryStage implements Stage {

    private static final Logger logger = Logger.getLogger(ContactDiscoveryStage.class.getName());

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s+[-–|]\\s+");
    private static final Pattern PERSON_NAME =
            Pattern.compile("\\p{Lu}[\\p{L}'.]*(?:\\s+\\p{Lu}[\\p{L}'.]*){1,3}");
    private static final Pattern NON_DOMAIN_CHARS = Pattern.compile("[^a-z0-9]");

    private final SearchClient searchClient;
    private final ContactPrioritizer prioritizer;

    public ContactDiscoveryStage(SearchClient searchClient) {
        this(searchClient, new ContactPrioritizer());
    }

    public ContactDiscoveryStage(SearchClient searchClient, ContactPrioritizer prioritizer) {
        this.searchClient = Objects.requireNonNull(searchClient, "searchClient must not be null");
        this.prioritizer = Objects.requireNonNull(prioritizer, "prioritizer must not be null");
    }

    @Override
    public StageName name() {
        return StageName.CONTACT_DISCOVERY;
    }

    @Override
    public Set<StageName> dependencies() {
        return Set.of(StageName.ANALYSIS);
    }

    @Override
    public StageResult invoke(Subject subject, ContextView context) {
        String company = subject.displayName();
        List<SearchHit> hits;
        try {
            logger.fine("Searching for decision makers at " + company);
            hits = searchClient.search(company + " CEO executives leadership team");
        } catch (ProviderException e) {
            return StageResult.failure(e.getKind(), "Contact search failed: " + e.getMessage(), e);
        }

        Map<String, Contact> byName = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            parseContact(hit, company).ifPresent(c -> byName.putIfAbsent(c.name(), c));
        }
        if (byName.isEmpty()) {
            return StageResult.terminalFailure("No decision makers found for " + company);
        }

        List<Contact> ranked = prioritizer.prioritize(new ArrayList<>(byName.values()));
        logger.info("Found " + ranked.size() + " contacts for " + company);
        return StageResult.success(new ContactRoster(ranked.size(), ranked));
    }

    static Optional<Contact> parseContact(SearchHit hit, String company) {
        String[] segments = SEGMENT_SEPARATOR.split(hit.title().strip());
        if (segments.length < 2) {
            return Optional.empty();
        }
        String name = segments[0].strip();
        String title = segments[1].strip();
        if (!PERSON_NAME.matcher(name).matches() || title.isEmpty()) {
            return Optional.empty();
        }
        String companyLower = company.toLowerCase(Locale.ROOT);
        if (title.equalsIgnoreCase(company)
                || name.toLowerCase(Locale.ROOT).contains(companyLower)) {
            return Optional.empty();
        }
        String email = guessEmail(name, company);
        return Optional.of(new Contact(name, title, hit.url(), hit.snippet(), email, 0, ""));
    }

    static String guessEmail(String name, String company) {
        String[] parts = name.toLowerCase(Locale.ROOT).split("\\s+");
        String local = parts[0] + "." + parts[parts.length - 1];
        String domain = NON_DOMAIN_CHARS.matcher(company.toLowerCase(Locale.ROOT)).replaceAll("");
        return NON_DOMAIN_CHARS.matcher(local).replaceAll(".").replaceAll("\\.+", ".")
                + "@"
                + domain
                + ".com";
    }
}
