package io.prospekt.core;

import io.prospekt.core.cache.ExpiryPolicy;
import io.prospekt.core.cache.InMemoryReportCache;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.execution.LoggingRunListener;
import io.prospekt.core.execution.Orchestrator;
import io.prospekt.core.execution.RunListener;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.LanguageModelProvider;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.simulated.SimulatedLanguageModelProvider;
import io.prospekt.core.provider.simulated.SimulatedSearchClient;
import io.prospekt.core.report.ReportSink;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageCriticality;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.stage.analysis.AnalysisStage;
import io.prospekt.core.stage.contact.ContactDiscoveryStage;
import io.prospekt.core.stage.outreach.OutreachStage;
import io.prospekt.core.stage.research.ResearchStage;
import io.prospekt.core.subject.Subject;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating a fully wired {@link ProspektEnvironment}.
///
/// Assembles the four built-in stages over a {@link SearchClient} and a
/// {@link LanguageModel}, then wires the {@link Orchestrator} with the cache, report
/// sink, retry policy and worker pool.
///
/// ### Credential Discovery
/// Credentials are loaded from (later sources override earlier ones):
/// 1. **Environment variables** matching `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
/// 2. **Properties** under `prospekt.credentials.*` (prefix stripped) or with a direct
///    API key name
///
/// ### Provider Resolution
/// - Without an explicit {@link SearchClient}, the {@link SimulatedSearchClient} is used
/// - The language model comes from the highest-priority {@link LanguageModelProvider}
///   supporting {@link ProspektConfig#getModelName()}; in mock mode the simulated
///   provider intercepts every model
///
/// @see ProspektEnvironment
public final class ProspektFactory {

    private static final Logger logger = Logger.getLogger(ProspektFactory.class.getName());

    private static final String CREDENTIALS_PREFIX = "prospekt.credentials.";
    private static final long IDLE_WORKER_KEEP_ALIVE_SECONDS = 60;

    private ProspektFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Discovers credentials from environment variables matching API key patterns.
    ///
    /// @return discovered credentials, never null
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return credentialsFrom(System.getenv());
    }

    static Map<String, String> credentialsFrom(Map<String, String> variables) {
        Map<String, String> credentials = new HashMap<>();
        variables.forEach(
                (key, value) -> {
                    if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                        credentials.put(key, value);
                    }
                });
        return credentials;
    }

    /// Extracts credentials from properties.
    ///
    /// Supports prefixed keys (`prospekt.credentials.GOOGLE_API_KEY`, prefix stripped)
    /// and direct API key names (`GOOGLE_API_KEY`).
    ///
    /// @param properties source properties, not null
    /// @return credentials, never null
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (key.startsWith(CREDENTIALS_PREFIX)) {
                credentials.put(key.substring(CREDENTIALS_PREFIX.length()), value);
            } else if (isApiKeyPattern(key)) {
                credentials.put(key, value);
            }
        }
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Fluent builder for {@link ProspektEnvironment}.
    ///
    /// ### Example
    /// ```java
    /// var env = ProspektFactory.builder()
    ///     .config(ProspektConfig.fromProperties(properties))
    ///     .loadCredentials(properties)
    ///     .languageModelProviders(List.of(new LangChain4jModelProvider()))
    ///     .searchClient(searchClient)
    ///     .reportCache(cache)
    ///     .build();
    /// ```
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static final class Builder {
        private ProspektConfig config = ProspektConfig.defaults();
        private final Map<String, String> credentials = new HashMap<>();
        private final List<LanguageModelProvider> providers = new ArrayList<>();
        private SearchClient searchClient;
        private LanguageModel languageModel;
        private ReportCache reportCache;
        private ReportSink reportSink = ReportSink.NOOP;
        private RunListener listener = new LoggingRunListener();
        private ExecutorService executorService;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder config(ProspektConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Loads credentials from the environment, then from properties.
        public Builder loadCredentials(Properties properties) {
            credentials.putAll(loadCredentialsFromEnvironment());
            credentials.putAll(loadCredentialsFromProperties(properties));
            return this;
        }

        public Builder languageModelProviders(List<? extends LanguageModelProvider> providers) {
            this.providers.addAll(providers);
            return this;
        }

        public Builder searchClient(SearchClient searchClient) {
            this.searchClient = searchClient;
            return this;
        }

        /// Uses a ready model instead of resolving one through providers.
        public Builder languageModel(LanguageModel languageModel) {
            this.languageModel = languageModel;
            return this;
        }

        public Builder reportCache(ReportCache reportCache) {
            this.reportCache = reportCache;
            return this;
        }

        public Builder reportSink(ReportSink reportSink) {
            this.reportSink = reportSink;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return wired environment, never null
        /// @throws IllegalStateException if no provider supports the configured model
        public ProspektEnvironment build() {
            SearchClient search = resolveSearchClient();
            LanguageModel model = languageModel != null ? languageModel : resolveModel();
            ReportCache cache = reportCache != null ? reportCache : defaultCache();
            ExecutorService executor =
                    executorService != null ? executorService : defaultExecutor();

            List<Stage> stages = new ArrayList<>();
            for (Stage stage :
                    List.of(
                            new ResearchStage(search),
                            new AnalysisStage(model),
                            new ContactDiscoveryStage(search),
                            new OutreachStage(model))) {
                stages.add(applyCriticality(stage));
            }

            Orchestrator orchestrator =
                    Orchestrator.builder()
                            .stages(stages)
                            .cache(cache)
                            .sink(reportSink)
                            .retryPolicy(config.getRetryPolicy())
                            .executor(executor)
                            .listener(listener)
                            .clock(clock)
                            .build();

            logger.info(
                    "Configured pipeline with model "
                            + model.modelName()
                            + ", "
                            + config.getRetryPolicy());
            return new ProspektEnvironment(config, orchestrator, cache, reportSink, executor);
        }

        private SearchClient resolveSearchClient() {
            if (searchClient != null && !config.isMockMode()) {
                return searchClient;
            }
            logger.info("Using simulated search results");
            return new SimulatedSearchClient();
        }

        private LanguageModel resolveModel() {
            List<LanguageModelProvider> candidates =
                    providers.isEmpty() ? discoverProviders() : new ArrayList<>(providers);
            candidates.add(new SimulatedLanguageModelProvider(config.isMockMode()));
            String modelName = config.getModelName();
            LanguageModelProvider provider =
                    candidates.stream()
                            .filter(p -> p.supportsModel(modelName))
                            .max(Comparator.comparingInt(LanguageModelProvider::getPriority))
                            .orElseThrow(
                                    () ->
                                            new IllegalStateException(
                                                    "No provider supports model: " + modelName));
            logger.info("Model " + modelName + " served by provider " + provider.getName());
            return provider.createModel(modelName, Map.copyOf(credentials));
        }

        /// Loads providers from `META-INF/services/io.prospekt.core.provider.LanguageModelProvider`.
        private static List<LanguageModelProvider> discoverProviders() {
            List<LanguageModelProvider> discovered = new ArrayList<>();
            for (LanguageModelProvider provider : ServiceLoader.load(LanguageModelProvider.class)) {
                discovered.add(provider);
                logger.fine("Discovered provider: " + provider.getName());
            }
            return discovered;
        }

        /// Keeps `threadPoolSize` workers warm and grows past them instead of queueing, so a
        /// timed-out attempt that ignores interruption cannot starve later runs.
        private ExecutorService defaultExecutor() {
            return new ThreadPoolExecutor(
                    config.getThreadPoolSize(),
                    Integer.MAX_VALUE,
                    IDLE_WORKER_KEEP_ALIVE_SECONDS,
                    TimeUnit.SECONDS,
                    new SynchronousQueue<>(),
                    new StageThreadFactory());
        }

        private ReportCache defaultCache() {
            ExpiryPolicy expiry =
                    config.getCacheMaxAge().map(ExpiryPolicy::maxAge).orElse(ExpiryPolicy.NEVER);
            return new InMemoryReportCache(expiry, clock);
        }

        private Stage applyCriticality(Stage stage) {
            if (!config.getBestEffortStages().contains(stage.name())
                    || stage.criticality() == StageCriticality.BEST_EFFORT) {
                return stage;
            }
            return new BestEffortStage(stage);
        }
    }

    /// Delegating stage with its criticality lowered to best-effort by configuration.
    private record BestEffortStage(Stage delegate) implements Stage {

        @Override
        public StageName name() {
            return delegate.name();
        }

        @Override
        public Set<StageName> dependencies() {
            return delegate.dependencies();
        }

        @Override
        public StageCriticality criticality() {
            return StageCriticality.BEST_EFFORT;
        }

        @Override
        public StageResult invoke(Subject subject, ContextView context) {
            return delegate.invoke(subject, context);
        }
    }

    /// Daemon worker threads so an abandoned, timed-out attempt never blocks JVM exit.
    private static final class StageThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "prospekt-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
