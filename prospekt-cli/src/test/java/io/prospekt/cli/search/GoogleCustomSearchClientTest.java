package io.prospekt.cli.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.stage.FailureKind;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GoogleCustomSearchClientTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private GoogleCustomSearchClient client;

    @BeforeEach
    void setUp() {
        client =
                new GoogleCustomSearchClient(
                        "key-123",
                        "engine-9",
                        Duration.ofSeconds(5),
                        httpClient,
                        new ObjectMapper());
    }

    @Test
    void shouldEncodeQueryParameters() {
        URI uri = client.buildUri("AT&T CEO executives");

        assertThat(uri.toString())
                .startsWith(GoogleCustomSearchClient.ENDPOINT)
                .contains("key=key-123")
                .contains("cx=engine-9")
                .contains("q=AT%26T+CEO+executives")
                .endsWith("num=5");
    }

    @Nested
    @DisplayName("Response handling")
    class ResponseHandling {

        @Test
        void shouldMapItemsToHits() {
            String body =
                    """
                    {"items": [
                      {"title": "Acme - About", "snippet": "Acme makes anvils.",
                       "link": "https://acme.example/about"},
                      {"title": "Acme news", "link": "https://news.example/acme"}
                    ]}
                    """;

            List<SearchHit> hits = client.handleResponse(200, body);

            assertThat(hits).hasSize(2);
            assertThat(hits.get(0))
                    .isEqualTo(
                            new SearchHit(
                                    "Acme - About",
                                    "Acme makes anvils.",
                                    "https://acme.example/about"));
            assertThat(hits.get(1).snippet()).isEmpty();
        }

        @Test
        void shouldReturnEmptyListWithoutItems() {
            assertThat(client.handleResponse(200, "{\"kind\": \"customsearch#search\"}"))
                    .isEmpty();
            assertThat(client.handleResponse(200, "")).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(ints = {429, 500, 503})
        void shouldClassifyThrottlingAndServerErrorsAsTransient(int status) {
            assertThatThrownBy(() -> client.handleResponse(status, "{}"))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("HTTP " + status)
                    .satisfies(
                            e ->
                                    assertThat(((ProviderException) e).getKind())
                                            .isEqualTo(FailureKind.TRANSIENT));
        }

        @ParameterizedTest
        @ValueSource(ints = {400, 403, 404})
        void shouldClassifyClientErrorsAsTerminal(int status) {
            assertThatThrownBy(() -> client.handleResponse(status, "{}"))
                    .isInstanceOf(ProviderException.class)
                    .hasMessage("Search request rejected: HTTP " + status)
                    .satisfies(
                            e ->
                                    assertThat(((ProviderException) e).getKind())
                                            .isEqualTo(FailureKind.TERMINAL));
        }

        @Test
        void shouldRejectUnreadableBody() {
            assertThatThrownBy(() -> client.handleResponse(200, "<html>oops</html>"))
                    .isInstanceOf(ProviderException.class)
                    .hasMessage("Unreadable search response")
                    .satisfies(
                            e ->
                                    assertThat(((ProviderException) e).getKind())
                                            .isEqualTo(FailureKind.TERMINAL));
        }
    }

    @Nested
    @DisplayName("Transport")
    class Transport {

        @Test
        @SuppressWarnings("unchecked")
        void shouldReturnHitsFromResponse() throws Exception {
            when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                    .thenReturn(response);
            when(response.statusCode()).thenReturn(200);
            when(response.body())
                    .thenReturn(
                            "{\"items\": [{\"title\": \"t\", \"snippet\": \"s\","
                                    + " \"link\": \"l\"}]}");

            List<SearchHit> hits = client.search("Acme");

            assertThat(hits).containsExactly(new SearchHit("t", "s", "l"));
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldTreatTimeoutAsTransient() throws Exception {
            when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                    .thenThrow(new HttpTimeoutException("request timed out"));

            assertThatThrownBy(() -> client.search("Acme"))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("request timed out")
                    .hasCauseInstanceOf(IOException.class)
                    .satisfies(
                            e ->
                                    assertThat(((ProviderException) e).getKind())
                                            .isEqualTo(FailureKind.TRANSIENT));
        }
    }
}
