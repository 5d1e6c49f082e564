package io.prospekt.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.prospekt.core.TestOutputs;
import io.prospekt.core.subject.Subject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryReportCache")
class InMemoryReportCacheTest {

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void shouldMissOnEmptyCache() {
            assertThat(new InMemoryReportCache().lookup(Subject.of("Acme"))).isEmpty();
        }

        @Test
        void shouldHitForNormalizedEquivalentSubject() {
            var cache = new InMemoryReportCache();
            var report = TestOutputs.completedReport("Acme Corp");

            cache.insert(Subject.of("Acme Corp"), report);

            assertThat(cache.lookup(Subject.of("  ACME   corp "))).contains(report);
        }
    }

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        void shouldReplaceExistingEntry() {
            var cache = new InMemoryReportCache();
            var first = TestOutputs.completedReport("Acme");
            var second = TestOutputs.completedReport("Acme");

            cache.insert(Subject.of("Acme"), first);
            cache.insert(Subject.of("acme"), second);

            assertThat(cache.entries()).hasSize(1);
            assertThat(cache.lookup(Subject.of("Acme"))).contains(second);
        }
    }

    @Nested
    @DisplayName("invalidate")
    class Invalidate {

        @Test
        void shouldRemoveEntryAndReportIt() {
            var cache = new InMemoryReportCache();
            cache.insert(Subject.of("Acme"), TestOutputs.completedReport("Acme"));

            assertThat(cache.invalidate(Subject.of("ACME"))).isTrue();
            assertThat(cache.lookup(Subject.of("Acme"))).isEmpty();
        }

        @Test
        void shouldTreatAbsentEntryAsNoOp() {
            assertThat(new InMemoryReportCache().invalidate(Subject.of("Nobody"))).isFalse();
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        void shouldHideEntriesOlderThanMaxAge() {
            var clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
            var cache = new InMemoryReportCache(ExpiryPolicy.maxAge(Duration.ofHours(1)), clock);
            cache.insert(Subject.of("Acme"), TestOutputs.completedReport("Acme"));

            clock.advance(Duration.ofMinutes(59));
            assertThat(cache.lookup(Subject.of("Acme"))).isPresent();

            clock.advance(Duration.ofMinutes(2));
            assertThat(cache.lookup(Subject.of("Acme"))).isEmpty();
            assertThat(cache.entries()).isEmpty();
        }
    }

    @Test
    void shouldListEntriesSortedByKey() {
        var cache = new InMemoryReportCache();
        cache.insert(Subject.of("Zeta"), TestOutputs.completedReport("Zeta"));
        cache.insert(Subject.of("alpha"), TestOutputs.completedReport("alpha"));

        assertThat(cache.entries()).extracting(CacheEntry::key).containsExactly("alpha", "zeta");

        cache.clear();
        assertThat(cache.entries()).isEmpty();
    }

    @Test
    void shouldNeverExposeHalfWrittenEntriesToConcurrentReaders() throws Exception {
        var cache = new InMemoryReportCache();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String company = "Company " + (i % 10);
                tasks.add(
                        () -> {
                            cache.insert(Subject.of(company), TestOutputs.completedReport(company));
                            return cache.lookup(Subject.of(company))
                                    .map(r -> r.subject().key().equals(Subject.normalize(company)))
                                    .orElse(false);
                        });
            }
            for (Future<Boolean> result : pool.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }
            assertThat(cache.entries()).hasSize(10);
        } finally {
            pool.shutdownNow();
        }
    }

    /// Clock that only moves when told to.
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
