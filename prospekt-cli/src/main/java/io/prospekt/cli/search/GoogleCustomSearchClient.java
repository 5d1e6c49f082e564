package io.prospekt.cli.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.stage.FailureKind;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link SearchClient} backed by the Google Custom Search JSON API.
///
/// Issues `GET https://www.googleapis.com/customsearch/v1?key=…&cx=…&q=…&num=5` and maps
/// each entry of the `items` array to a {@link SearchHit}.
///
/// ### Status classification
/// | Response                | Result                          |
/// |-------------------------|---------------------------------|
/// | 2xx without `items`     | empty list                      |
/// | 429, 5xx                | `ProviderException(TRANSIENT)`  |
/// | other 4xx               | `ProviderException(TERMINAL)`   |
/// | I/O error, timeout      | `ProviderException(TRANSIENT)`  |
/// | unparseable body        | `ProviderException(TERMINAL)`   |
///
/// @implNote Thread-safe. `HttpClient` and `ObjectMapper` are shared across calls.
public class GoogleCustomSearchClient implements SearchClient {

    private static final Logger logger = Logger.getLogger(GoogleCustomSearchClient.class.getName());

    static final String ENDPOINT = "https://www.googleapis.com/customsearch/v1";
    static final int RESULT_COUNT = 5;
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String apiKey;
    private final String searchEngineId;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public GoogleCustomSearchClient(String apiKey, String searchEngineId) {
        this(apiKey, searchEngineId, DEFAULT_TIMEOUT);
    }

    public GoogleCustomSearchClient(String apiKey, String searchEngineId, Duration timeout) {
        this(
                apiKey,
                searchEngineId,
                timeout,
                HttpClient.newBuilder().connectTimeout(timeout).build(),
                new ObjectMapper());
    }

    /// @param apiKey Google API key, not null
    /// @param searchEngineId programmable search engine id (`cx`), not null
    /// @param timeout request timeout, not null
    /// @param httpClient client used for all requests, not null
    /// @param mapper mapper used to read response bodies, not null
    public GoogleCustomSearchClient(
            String apiKey,
            String searchEngineId,
            Duration timeout,
            HttpClient httpClient,
            ObjectMapper mapper) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.searchEngineId =
                Objects.requireNonNull(searchEngineId, "searchEngineId must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<SearchHit> search(String query) {
        Objects.requireNonNull(query, "query must not be null");
        HttpRequest request =
                HttpRequest.newBuilder(buildUri(query))
                        .timeout(timeout)
                        .header("Accept", "application/json")
                        .GET()
                        .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            logger.warning("Search request failed for '" + query + "': " + e.getMessage());
            throw ProviderException.transientFailure("Search request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.transientFailure("Search request interrupted", e);
        }

        List<SearchHit> hits = handleResponse(response.statusCode(), response.body());
        logger.fine("Search '" + query + "' returned " + hits.size() + " result(s)");
        return hits;
    }

    URI buildUri(String query) {
        return URI.create(
                ENDPOINT
                        + "?key="
                        + encode(apiKey)
                        + "&cx="
                        + encode(searchEngineId)
                        + "&q="
                        + encode(query)
                        + "&num="
                        + RESULT_COUNT);
    }

    /// Classifies the status and parses the body of a search response.
    ///
    /// @param status HTTP status code
    /// @param body response body, may be null
    /// @return hits in response order, never null
    /// @throws ProviderException if the status is not 2xx or the body is not JSON
    List<SearchHit> handleResponse(int status, String body) {
        if (status == 429 || status >= 500) {
            throw new ProviderException(
                    FailureKind.TRANSIENT, "Search backend unavailable: HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new ProviderException(
                    FailureKind.TERMINAL, "Search request rejected: HTTP " + status);
        }
        if (body == null || body.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw ProviderException.terminalFailure("Unreadable search response", e);
        }

        JsonNode items = root.path("items");
        if (!items.isArray()) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : items) {
            hits.add(
                    new SearchHit(
                            item.path("title").asText(""),
                            item.path("snippet").asText(""),
                            item.path("link").asText("")));
        }
        return hits;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
