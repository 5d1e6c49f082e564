package io.prospekt.core.provider.simulated;

import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.SearchHit;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/// Search client returning fixed demo results, used in mock mode and when no search
/// credentials are configured.
///
/// Recognizes the three query shapes issued by the built-in stages (company overview,
/// recent news, leadership team) and fills the company name into canned hits.
/// Any other query yields no hits.
///
/// @implNote Thread-safe. Stateless.
public final class SimulatedSearchClient implements SearchClient {

    private static final Logger logger = Logger.getLogger(SimulatedSearchClient.class.getName());

    static final String OVERVIEW_SUFFIX = " company overview";
    static final String NEWS_SUFFIX = " news recent";
    static final String CONTACTS_SUFFIX = " CEO executives leadership team";

    @Override
    public List<SearchHit> search(String query) {
        logger.fine("[SIMULATED] search: " + query);
        if (query.endsWith(OVERVIEW_SUFFIX)) {
            return companyHits(strip(query, OVERVIEW_SUFFIX));
        }
        if (query.endsWith(NEWS_SUFFIX)) {
            return newsHits(strip(query, NEWS_SUFFIX));
        }
        if (query.endsWith(CONTACTS_SUFFIX)) {
            return contactHits(strip(query, CONTACTS_SUFFIX));
        }
        return List.of();
    }

    private static String strip(String query, String suffix) {
        return query.substring(0, query.length() - suffix.length()).strip();
    }

    private static List<SearchHit> companyHits(String company) {
        String domain = company.toLowerCase(Locale.ROOT).replace(" ", "");
        return List.of(
                new SearchHit(
                        company + " - Official Website",
                        company
                                + " is a leading technology company specializing in enterprise"
                                + " software solutions. Founded in 2010, the company serves"
                                + " Fortune 500 clients across multiple industries including"
                                + " finance, healthcare, and retail.",
                        "https://www." + domain + ".com"),
                new SearchHit(
                        company + " Company Profile | LinkedIn",
                        company
                                + " | 10,000+ employees on LinkedIn. We provide innovative"
                                + " solutions that help businesses transform digitally."
                                + " Industry: Technology, Software, Enterprise Solutions.",
                        "https://www.linkedin.com/company/" + domain),
                new SearchHit(
                        "About " + company + " - Company Overview",
                        company
                                + " has raised $150M in Series C funding and serves over 2,000"
                                + " enterprise clients worldwide. The company is headquartered in"
                                + " San Francisco with offices in New York, London, and"
                                + " Singapore.",
                        "https://www.crunchbase.com/organization/" + domain));
    }

    private static List<SearchHit> newsHits(String company) {
        return List.of(
                new SearchHit(
                        company + " Announces Q3 Growth",
                        company
                                + " reported 45% year-over-year revenue growth in Q3, driven by"
                                + " strong enterprise adoption of their AI-powered platform.",
                        "https://techcrunch.com/example"),
                new SearchHit(
                        company + " Expands to APAC Region",
                        company
                                + " opens new offices in Singapore and Tokyo to support growing"
                                + " demand in Asia-Pacific markets.",
                        "https://venturebeat.com/example"));
    }

    private static List<SearchHit> contactHits(String company) {
        return List.of(
                new SearchHit(
                        "Jane Smith - CEO & Co-Founder - " + company + " | LinkedIn",
                        "Former VP at Salesforce, 15+ years in enterprise software",
                        "https://linkedin.com/in/janesmith"),
                new SearchHit(
                        "Michael Chen - CTO - " + company + " | LinkedIn",
                        "Ex-Google engineer, AI/ML expert",
                        "https://linkedin.com/in/michaelchen"),
                new SearchHit(
                        "Sarah Johnson - VP of Sales - " + company + " | LinkedIn",
                        "20+ years in enterprise sales, former Oracle executive",
                        "https://linkedin.com/in/sarahjohnson"),
                new SearchHit(
                        "David Thompson - VP of Engineering - " + company + " | LinkedIn",
                        "Scaled engineering teams from 20 to 300 engineers",
                        "https://linkedin.com/in/davidthompson"),
                new SearchHit(
                        "Emily Chen - Director of Product Management - " + company + " | LinkedIn",
                        "Product leader focused on enterprise platforms",
                        "https://linkedin.com/in/emilychen"));
    }
}
