package io.prospekt.cli.producers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import io.prospekt.core.ProspektEnvironment;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.execution.RunOptions;
import io.prospekt.core.report.Report;
import io.prospekt.core.report.ReportSink;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.subject.Subject;
import io.prospekt.serialization.JsonFileReportCache;
import io.prospekt.serialization.JsonFileReportSink;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProspektEnvironmentProducerTest {

    @TempDir Path tempDir;

    private final Map<String, String> properties = new HashMap<>();
    private ProspektEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        Config config = mock(Config.class);
        lenient().when(config.getPropertyNames()).thenAnswer(inv -> properties.keySet());
        lenient()
                .when(config.getOptionalValue(anyString(), eq(String.class)))
                .thenAnswer(inv -> Optional.ofNullable(properties.get(inv.<String>getArgument(0))));

        properties.put("prospekt.threads", "2");
        properties.put("prospekt.retry.max-attempts", "1");
        properties.put("unrelated.key", "ignored");

        producer = new ProspektEnvironmentProducer();
        producer.config = config;
        producer.cacheFile = tempDir.resolve("cache/memory_bank.json").toString();
        producer.reportsDir = tempDir.resolve("reports").toString();
        producer.searchEngineId = Optional.empty();
        producer.searchTimeoutSeconds = 10;
    }

    @AfterEach
    void tearDown() {
        producer.cleanup();
    }

    @Test
    void shouldProduceFileBackedCacheOnce() {
        ReportCache first = producer.reportCache();
        ReportCache second = producer.reportCache();

        assertThat(first).isSameAs(second).isInstanceOf(JsonFileReportCache.class);
        assertThat(((JsonFileReportCache) first).getFile())
                .isEqualTo(tempDir.resolve("cache/memory_bank.json"));
    }

    @Test
    void shouldFallBackToMockModeWithoutSearchCredentials() {
        ProspektEnvironment environment = producer.create(false, false);

        assertThat(environment.getConfig().isMockMode()).isTrue();
        assertThat(environment.getConfig().getThreadPoolSize()).isEqualTo(2);
    }

    @Test
    void shouldShareCacheWithEnvironments() {
        ProspektEnvironment environment = producer.create(true, false);

        assertThat(environment.getReportCache()).isSameAs(producer.reportCache());
        assertThat(environment.getReportSink()).isSameAs(ReportSink.NOOP);
    }

    @Test
    void shouldArchiveReportsWhenSavingIsEnabled() throws Exception {
        ProspektEnvironment environment = producer.create(true, true);

        assertThat(environment.getReportSink()).isInstanceOf(JsonFileReportSink.class);

        Report report = environment.getOrchestrator().run(Subject.of("Acme Corp"), RunOptions.defaults());

        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        try (Stream<Path> files = Files.list(tempDir.resolve("reports"))) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .singleElement()
                    .satisfies(name -> assertThat(name).startsWith("Acme_Corp_").endsWith(".json"));
        }
        assertThat(tempDir.resolve("cache/memory_bank.json")).exists();
    }
}
