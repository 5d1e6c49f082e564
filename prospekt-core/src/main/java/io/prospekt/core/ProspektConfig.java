package io.prospekt.core;

import io.prospekt.core.execution.RetryPolicy;
import io.prospekt.core.stage.StageName;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/// Runtime configuration for a {@link ProspektEnvironment}.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `prospekt.model.name` | String | `gemini-2.0-flash` | Language model for analysis and outreach |
/// | `prospekt.mock.enabled` | Boolean | `false` | Serve simulated search and model output |
/// | `prospekt.threads` | Integer | `4` | Idle worker threads kept for stage attempts |
/// | `prospekt.retry.max-attempts` | Integer | `3` | Attempts per stage |
/// | `prospekt.retry.initial-delay-ms` | Long | `500` | Delay before the first retry |
/// | `prospekt.retry.multiplier` | Double | `2.0` | Backoff growth factor |
/// | `prospekt.retry.max-delay-ms` | Long | `5000` | Backoff ceiling |
/// | `prospekt.stage.timeout-seconds` | Long | `60` | Ceiling per stage attempt |
/// | `prospekt.cache.max-age` | ISO-8601 duration | none | Entries older than this are ignored |
/// | `prospekt.stages.best-effort` | Stage list | none | Extra stages whose failure only degrades the run |
///
/// @implNote Immutable once built.
public final class ProspektConfig {

    public static final String DEFAULT_MODEL = "gemini-2.0-flash";

    private final String modelName;
    private final boolean mockMode;
    private final int threadPoolSize;
    private final RetryPolicy retryPolicy;
    private final Duration cacheMaxAge;
    private final Set<StageName> bestEffortStages;

    private ProspektConfig(Builder builder) {
        this.modelName = builder.modelName;
        this.mockMode = builder.mockMode;
        this.threadPoolSize = builder.threadPoolSize;
        this.retryPolicy = builder.retryPolicy;
        this.cacheMaxAge = builder.cacheMaxAge;
        this.bestEffortStages =
                Collections.unmodifiableSet(EnumSet.copyOf(builder.bestEffortStages));
    }

    public static ProspektConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Reads `prospekt.*` keys; absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static ProspektConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String model = properties.getProperty("prospekt.model.name");
        if (model != null && !model.isBlank()) {
            builder.modelName(model.strip());
        }
        builder.mockMode(Boolean.parseBoolean(properties.getProperty("prospekt.mock.enabled")));
        String threads = properties.getProperty("prospekt.threads");
        if (threads != null && !threads.isBlank()) {
            builder.threadPoolSize(Integer.parseInt(threads.strip()));
        }

        RetryPolicy.Builder retry = RetryPolicy.builder();
        String value = properties.getProperty("prospekt.retry.max-attempts");
        if (value != null && !value.isBlank()) {
            retry.maxAttempts(Integer.parseInt(value.strip()));
        }
        value = properties.getProperty("prospekt.retry.initial-delay-ms");
        if (value != null && !value.isBlank()) {
            retry.initialDelay(Duration.ofMillis(Long.parseLong(value.strip())));
        }
        value = properties.getProperty("prospekt.retry.multiplier");
        if (value != null && !value.isBlank()) {
            retry.multiplier(Double.parseDouble(value.strip()));
        }
        value = properties.getProperty("prospekt.retry.max-delay-ms");
        if (value != null && !value.isBlank()) {
            retry.maxDelay(Duration.ofMillis(Long.parseLong(value.strip())));
        }
        value = properties.getProperty("prospekt.stage.timeout-seconds");
        if (value != null && !value.isBlank()) {
            retry.attemptTimeout(Duration.ofSeconds(Long.parseLong(value.strip())));
        }
        builder.retryPolicy(retry.build());

        value = properties.getProperty("prospekt.cache.max-age");
        if (value != null && !value.isBlank()) {
            builder.cacheMaxAge(Duration.parse(value.strip()));
        }
        value = properties.getProperty("prospekt.stages.best-effort");
        if (value != null && !value.isBlank()) {
            for (String id : value.split(",")) {
                if (!id.isBlank()) {
                    builder.bestEffort(StageName.fromId(id));
                }
            }
        }
        return builder.build();
    }

    public String getModelName() {
        return modelName;
    }

    public boolean isMockMode() {
        return mockMode;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /// Returns the maximum cache entry age, or empty when entries never expire.
    public Optional<Duration> getCacheMaxAge() {
        return Optional.ofNullable(cacheMaxAge);
    }

    /// Returns stages downgraded to best-effort in addition to the defaults.
    public Set<StageName> getBestEffortStages() {
        return bestEffortStages;
    }

    public static final class Builder {
        private String modelName = DEFAULT_MODEL;
        private boolean mockMode = false;
        private int threadPoolSize = 4;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration cacheMaxAge;
        private final Set<StageName> bestEffortStages = EnumSet.noneOf(StageName.class);

        private Builder() {}

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder mockMode(boolean mockMode) {
            this.mockMode = mockMode;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder cacheMaxAge(Duration cacheMaxAge) {
            this.cacheMaxAge = cacheMaxAge;
            return this;
        }

        /// Marks a stage best-effort. Research feeds every other stage and cannot be.
        ///
        /// @throws IllegalArgumentException for {@link StageName#RESEARCH}
        public Builder bestEffort(StageName stage) {
            if (stage == StageName.RESEARCH) {
                throw new IllegalArgumentException("research stage is always required");
            }
            bestEffortStages.add(stage);
            return this;
        }

        /// @throws IllegalStateException if a value is missing or out of range
        public ProspektConfig build() {
            if (modelName == null || modelName.isBlank()) {
                throw new IllegalStateException("modelName is required");
            }
            if (threadPoolSize < 1) {
                throw new IllegalStateException("threadPoolSize must be at least 1");
            }
            Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
            if (cacheMaxAge != null && (cacheMaxAge.isZero() || cacheMaxAge.isNegative())) {
                throw new IllegalStateException("cacheMaxAge must be positive");
            }
            return new ProspektConfig(this);
        }
    }
}
