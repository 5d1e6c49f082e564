package io.prospekt.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prospekt.core.cache.CacheEntry;
import io.prospekt.core.cache.CacheIOException;
import io.prospekt.core.cache.ExpiryPolicy;
import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileReportCacheTest {

    @TempDir Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("cache").resolve("reports.json");
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        void shouldStartEmptyWhenFileIsMissing() {
            JsonFileReportCache cache = new JsonFileReportCache(file);

            assertThat(cache.entries()).isEmpty();
            assertThat(Files.exists(file)).isFalse();
        }

        @Test
        void shouldSurviveReopen() {
            Report report = ReportFixtures.completed("TestCo");
            new JsonFileReportCache(file).insert(report.subject(), report);

            JsonFileReportCache reopened = new JsonFileReportCache(file);

            assertThat(reopened.lookup(Subject.of("  testco "))).contains(report);
        }

        @Test
        void shouldCreateParentDirectories() {
            Report report = ReportFixtures.completed("TestCo");

            new JsonFileReportCache(file).insert(report.subject(), report);

            assertThat(file).exists();
        }

        @Test
        void shouldLeaveNoTemporaryFiles() throws IOException {
            JsonFileReportCache cache = new JsonFileReportCache(file);
            cache.insert(Subject.of("TestCo"), ReportFixtures.completed("TestCo"));
            cache.insert(Subject.of("Ghost Inc"), ReportFixtures.partial("Ghost Inc"));
            cache.invalidate(Subject.of("TestCo"));

            try (Stream<Path> files = Files.list(file.getParent())) {
                assertThat(files).containsExactly(file);
            }
        }

        @Test
        void shouldOverwriteExistingEntry() {
            JsonFileReportCache cache = new JsonFileReportCache(file);
            Report first = ReportFixtures.partial("TestCo");
            Report second = ReportFixtures.completed("TestCo");

            cache.insert(first.subject(), first);
            cache.insert(second.subject(), second);

            JsonFileReportCache reopened = new JsonFileReportCache(file);
            assertThat(reopened.entries()).hasSize(1);
            assertThat(reopened.lookup(Subject.of("TestCo"))).contains(second);
        }

        @Test
        void shouldPersistInvalidationAndClear() {
            JsonFileReportCache cache = new JsonFileReportCache(file);
            cache.insert(Subject.of("TestCo"), ReportFixtures.completed("TestCo"));
            cache.insert(Subject.of("Acme"), ReportFixtures.completed("Acme"));

            assertThat(cache.invalidate(Subject.of("testco"))).isTrue();
            assertThat(new JsonFileReportCache(file).entries())
                    .extracting(CacheEntry::key)
                    .containsExactly("acme");

            cache.clear();
            assertThat(new JsonFileReportCache(file).entries()).isEmpty();
        }

        @Test
        void shouldTreatInvalidatingAbsentKeyAsNoOp() {
            JsonFileReportCache cache = new JsonFileReportCache(file);

            assertThat(cache.invalidate(Subject.of("nobody"))).isFalse();
            assertThat(Files.exists(file)).isFalse();
        }

        @Test
        void shouldNormalizeKeysEditedByHand() throws IOException {
            new JsonFileReportCache(file)
                    .insert(Subject.of("TestCo"), ReportFixtures.completed("TestCo"));
            String json =
                    Files.readString(file)
                            .replaceAll("\"key\"\\s*:\\s*\"testco\"", "\"key\" : \"  TestCo \"");
            Files.writeString(file, json);

            JsonFileReportCache reopened = new JsonFileReportCache(file);

            assertThat(reopened.entries()).extracting(CacheEntry::key).containsExactly("testco");
            assertThat(reopened.lookup(Subject.of("testco"))).isPresent();
        }

        @Test
        void shouldWriteExactContentOverLongerFile() throws IOException {
            Path target = tempDir.resolve("durable.json");
            Files.writeString(target, "a much longer previous snapshot");

            JsonFileReportCache.writeDurably(target, "{}".getBytes(StandardCharsets.UTF_8));

            assertThat(Files.readString(target)).isEqualTo("{}");
        }

        @Test
        void shouldListEntriesOrderedByKey() {
            JsonFileReportCache cache = new JsonFileReportCache(file);
            cache.insert(Subject.of("Zeta"), ReportFixtures.completed("Zeta"));
            cache.insert(Subject.of("Alpha"), ReportFixtures.completed("Alpha"));

            assertThat(cache.entries()).extracting(CacheEntry::key).containsExactly("alpha", "zeta");
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        void shouldStartEmptyWhenFileIsCorrupt() throws IOException {
            Files.createDirectories(file.getParent());
            Files.writeString(file, "{\"version\": 1, \"entries\": [ {truncated");

            JsonFileReportCache cache = new JsonFileReportCache(file);

            assertThat(cache.entries()).isEmpty();
        }

        @Test
        void shouldReplaceCorruptFileOnNextWrite() throws IOException {
            Files.createDirectories(file.getParent());
            Files.writeString(file, "garbage");
            JsonFileReportCache cache = new JsonFileReportCache(file);

            cache.insert(Subject.of("TestCo"), ReportFixtures.completed("TestCo"));

            assertThat(new JsonFileReportCache(file).lookup(Subject.of("TestCo"))).isPresent();
        }

        @Test
        void shouldRollBackMemoryWhenWriteFails() throws IOException {
            // A regular file where the cache directory should be makes every write fail.
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "not a directory");
            JsonFileReportCache cache = new JsonFileReportCache(blocker.resolve("reports.json"));
            Subject subject = Subject.of("TestCo");

            assertThatThrownBy(() -> cache.insert(subject, ReportFixtures.completed("TestCo")))
                    .isInstanceOf(CacheIOException.class)
                    .hasMessageContaining("reports.json");

            assertThat(cache.lookup(subject)).isEmpty();
            assertThat(cache.entries()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        void shouldHideAndDropExpiredEntries() {
            Instant start = Instant.parse("2025-03-10T09:00:00Z");
            Clock early = Clock.fixed(start, ZoneOffset.UTC);
            Clock late = Clock.fixed(start.plus(Duration.ofDays(2)), ZoneId.of("UTC"));
            ExpiryPolicy oneDay = ExpiryPolicy.maxAge(Duration.ofDays(1));

            new JsonFileReportCache(file, oneDay, early)
                    .insert(Subject.of("TestCo"), ReportFixtures.completed("TestCo"));

            JsonFileReportCache later = new JsonFileReportCache(file, oneDay, late);
            assertThat(later.lookup(Subject.of("TestCo"))).isEmpty();

            later.insert(Subject.of("Acme"), ReportFixtures.completed("Acme"));
            assertThat(new JsonFileReportCache(file).entries())
                    .extracting(CacheEntry::key)
                    .containsExactly("acme");
        }
    }
}
