package io.prospekt.cli.producers;

import io.prospekt.adapter.langchain4j.LangChain4jModelProvider;
import io.prospekt.cli.search.GoogleCustomSearchClient;
import io.prospekt.core.ProspektConfig;
import io.prospekt.core.ProspektEnvironment;
import io.prospekt.core.ProspektFactory;
import io.prospekt.core.cache.ExpiryPolicy;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.report.ReportSink;
import io.prospekt.serialization.JsonFileReportCache;
import io.prospekt.serialization.JsonFileReportSink;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the report cache and the Prospekt runtime environment.
///
/// The cache is an application-scoped bean shared by every command. Environments are
/// created per command invocation because `--mock` and `--no-save` change how the
/// pipeline is wired; all created environments are closed on shutdown.
///
/// ### Credential Discovery
/// Credentials are loaded from (in priority order):
/// 1. **Application properties** under `prospekt.credentials.*`
/// 2. **Environment variables** matching patterns: `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `prospekt.credentials.GOOGLE_API_KEY` | String | - | Gemini and default search key |
/// | `prospekt.credentials.GOOGLE_SEARCH_API_KEY` | String | - | Search key, if different |
/// | `prospekt.search.engine-id` | String | - | Programmable search engine id (`cx`) |
/// | `prospekt.search.timeout-seconds` | Long | `10` | Search request timeout |
/// | `prospekt.cache.file` | Path | `memory_bank.json` | Durable report cache |
/// | `prospekt.reports.dir` | Path | `reports` | Archive directory for finished reports |
/// | `prospekt.model.name`, `prospekt.retry.*`, ... | | | see {@link ProspektConfig} |
///
/// Without search credentials the pipeline falls back to mock mode.
///
/// @implNote Application-scoped singleton. {@link #create} is synchronized.
@ApplicationScoped
public class ProspektEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(ProspektEnvironmentProducer.class.getName());

    private static final String PREFIX = "prospekt.";
    private static final String MOCK_KEY = "prospekt.mock.enabled";

    @Inject Config config;

    @ConfigProperty(name = "prospekt.cache.file", defaultValue = "memory_bank.json")
    String cacheFile;

    @ConfigProperty(name = "prospekt.reports.dir", defaultValue = "reports")
    String reportsDir;

    @ConfigProperty(name = "prospekt.search.engine-id")
    Optional<String> searchEngineId;

    @ConfigProperty(name = "prospekt.search.timeout-seconds", defaultValue = "10")
    long searchTimeoutSeconds;

    private ReportCache reportCache;
    private final List<ProspektEnvironment> environments = new ArrayList<>();

    /// Produces the durable report cache for CDI injection.
    ///
    /// @return cache backed by `prospekt.cache.file`, never null
    @Produces
    @ApplicationScoped
    public ReportCache reportCache() {
        return cache();
    }

    /// Creates a wired environment for one command invocation.
    ///
    /// @param mockMode force simulated search and model output
    /// @param saveReports archive finished reports under `prospekt.reports.dir`
    /// @return new environment, never null; closed by this producer on shutdown
    /// @throws IllegalStateException if the configured model cannot be created
    /// @throws IllegalArgumentException if a configuration value cannot be parsed
    public synchronized ProspektEnvironment create(boolean mockMode, boolean saveReports) {
        Properties properties = extractProspektProperties();
        Map<String, String> credentials = new HashMap<>();
        credentials.putAll(ProspektFactory.loadCredentialsFromEnvironment());
        credentials.putAll(ProspektFactory.loadCredentialsFromProperties(properties));

        boolean mock = mockMode;
        SearchClient searchClient = null;
        Optional<String> searchKey = searchApiKey(credentials);
        if (searchKey.isPresent() && searchEngineId.filter(id -> !id.isBlank()).isPresent()) {
            searchClient =
                    new GoogleCustomSearchClient(
                            searchKey.get(),
                            searchEngineId.get().strip(),
                            Duration.ofSeconds(searchTimeoutSeconds));
        } else if (!mock && !Boolean.parseBoolean(properties.getProperty(MOCK_KEY))) {
            logger.warning("No search credentials configured, falling back to mock mode");
            mock = true;
        }
        if (mock) {
            properties.setProperty(MOCK_KEY, "true");
        }

        ReportSink sink =
                saveReports ? new JsonFileReportSink(Path.of(reportsDir)) : ReportSink.NOOP;

        ProspektEnvironment environment =
                ProspektFactory.builder()
                        .config(ProspektConfig.fromProperties(properties))
                        .credentials(credentials)
                        .languageModelProviders(List.of(new LangChain4jModelProvider()))
                        .searchClient(searchClient)
                        .reportCache(cache())
                        .reportSink(sink)
                        .build();
        environments.add(environment);

        logger.info(
                "Configured ProspektEnvironment (mock="
                        + environment.getConfig().isMockMode()
                        + ", save="
                        + saveReports
                        + ")");
        return environment;
    }

    private synchronized ReportCache cache() {
        if (reportCache == null) {
            ProspektConfig base = ProspektConfig.fromProperties(extractProspektProperties());
            ExpiryPolicy expiry =
                    base.getCacheMaxAge().map(ExpiryPolicy::maxAge).orElse(ExpiryPolicy.NEVER);
            reportCache = new JsonFileReportCache(Path.of(cacheFile), expiry, Clock.systemUTC());
        }
        return reportCache;
    }

    private static Optional<String> searchApiKey(Map<String, String> credentials) {
        for (String key : List.of("GOOGLE_SEARCH_API_KEY", "GOOGLE_API_KEY")) {
            String value = credentials.get(key);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /// Extracts every `prospekt.*` property from Quarkus config.
    private Properties extractProspektProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    /// Closes every environment created by this producer.
    @PreDestroy
    public synchronized void cleanup() {
        for (ProspektEnvironment environment : environments) {
            environment.close();
        }
        environments.clear();
    }
}
