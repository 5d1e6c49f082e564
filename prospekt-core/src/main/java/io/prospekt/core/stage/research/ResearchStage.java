package io.prospekt.core.stage.research;

import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.NewsItem;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// First stage: gathers a company overview and recent news through web search.
///
/// Issues two queries, `"{company} company overview"` and `"{company} news recent"`.
/// The first overview hit becomes the overview text and website, the remaining overview
/// snippets become key facts, and news hits become {@link NewsItem}s.
///
/// A company with no overview hits fails terminally; the same query would return
/// nothing again.
public final class ResearchStage implements Stage {

    private static final Logger logger = Logger.getLogger(ResearchStage.class.getName());

    private static final Pattern INDUSTRY = Pattern.compile("Industry:\\s*([^.]+)");

    private final SearchClient searchClient;

    public ResearchStage(SearchClient searchClient) {
        this.searchClient = Objects.requireNonNull(searchClient, "searchClient must not be null");
    }

    @Override
    public StageName name() {
        return StageName.RESEARCH;
    }

    @Override
    public StageResult invoke(Subject subject, ContextView context) {
        String company = subject.displayName();
        List<SearchHit> overviewHits;
        List<SearchHit> newsHits;
        try {
            logger.fine("Gathering company overview for " + company);
            overviewHits = searchClient.search(company + " company overview");
            logger.fine("Gathering recent news for " + company);
            newsHits = searchClient.search(company + " news recent");
        } catch (ProviderException e) {
            return StageResult.failure(e.getKind(), "Search failed: " + e.getMessage(), e);
        }

        if (overviewHits.isEmpty()) {
            return StageResult.terminalFailure("No information found for " + company);
        }

        SearchHit primary = overviewHits.get(0);
        List<String> keyFacts = new ArrayList<>();
        for (SearchHit hit : overviewHits.subList(1, overviewHits.size())) {
            if (!hit.snippet().isBlank()) {
                keyFacts.add(hit.snippet());
            }
        }
        List<NewsItem> news =
                newsHits.stream()
                        .map(hit -> new NewsItem(hit.title(), hit.snippet(), hit.url()))
                        .toList();

        CompanyProfile profile =
                new CompanyProfile(
                        company,
                        primary.snippet(),
                        findIndustry(overviewHits),
                        primary.url(),
                        keyFacts,
                        news,
                        overviewHits);

        logger.info(
                "Research complete for "
                        + company
                        + ": "
                        + keyFacts.size()
                        + " facts, "
                        + news.size()
                        + " news items");
        return StageResult.success(profile);
    }

    private static String findIndustry(List<SearchHit> hits) {
        for (SearchHit hit : hits) {
            Matcher matcher = INDUSTRY.matcher(hit.snippet());
            if (matcher.find()) {
                return matcher.group(1).strip();
            }
        }
        return "";
    }
}
