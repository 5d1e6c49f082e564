package io.prospekt.core.stage;

/// The fixed stage sequence of the sales-intelligence pipeline, in execution order.
///
/// Each name carries its default {@link StageCriticality}: research and analysis
/// feed every later stage and are required, the remaining two only enrich the report.
public enum StageName {
    RESEARCH("research", StageCriticality.REQUIRED),
    ANALYSIS("analysis", StageCriticality.REQUIRED),
    CONTACT_DISCOVERY("contact-discovery", StageCriticality.BEST_EFFORT),
    OUTREACH("outreach", StageCriticality.BEST_EFFORT);

    private final String id;
    private final StageCriticality defaultCriticality;

    StageName(String id, StageCriticality defaultCriticality) {
        this.id = id;
        this.defaultCriticality = defaultCriticality;
    }

    /// Returns the lowercase identifier used in logs and configuration keys.
    public String id() {
        return id;
    }

    public StageCriticality defaultCriticality() {
        return defaultCriticality;
    }

    /// Resolves a stage from its identifier or enum constant name, case-insensitive.
    ///
    /// @param value identifier such as `contact-discovery` or `CONTACT_DISCOVERY`, not null
    /// @return matching stage, never null
    /// @throws IllegalArgumentException if no stage matches
    public static StageName fromId(String value) {
        String candidate = value.strip();
        for (StageName name : values()) {
            if (name.id.equalsIgnoreCase(candidate) || name.name().equalsIgnoreCase(candidate)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }
}
