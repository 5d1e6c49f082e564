package io.prospekt.core.provider.simulated;

import io.prospekt.core.provider.CompletionOptions;
import io.prospekt.core.provider.LanguageModel;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Language model returning canned text, used in mock mode.
///
/// Analysis prompts (those asking for `KEY BUSINESS CHALLENGES`) receive a fixed
/// three-section analysis; every other prompt is answered with an email body addressed
/// to the `- Name:` line of the prompt when present.
///
/// @implNote Thread-safe. Stateless.
public final class SimulatedLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(SimulatedLanguageModel.class.getName());

    private static final Pattern NAME_LINE = Pattern.compile("(?m)^- Name: (.+)$");
    private static final Pattern COMPANY_LINE = Pattern.compile("(?m)^(?:- )?Company: (.+)$");

    static final String ANALYSIS =
            """
            KEY BUSINESS CHALLENGES
            1. Scaling infrastructure to support rapid enterprise growth
            2. Integrating acquired products into a unified platform
            3. Retaining engineering talent in competitive markets
            4. Meeting data residency requirements in new regions

            OPPORTUNITIES
            1. Automated infrastructure scaling reduces operational overhead
            2. Unified data layer simplifies product integration
            3. Developer productivity tooling improves retention

            RECOMMENDED SALES APPROACH
            Lead with the scaling story tied to their recent growth.
            Emphasize measurable cost savings and time to value.
            Offer a short technical workshop with their engineering leadership.
            """;

    private final String modelName;

    public SimulatedLanguageModel() {
        this("simulated");
    }

    public SimulatedLanguageModel(String modelName) {
        this.modelName = modelName;
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        logger.fine("[SIMULATED] completion requested from " + modelName);
        if (prompt.contains("KEY BUSINESS CHALLENGES")) {
            return ANALYSIS;
        }
        String name = firstGroup(NAME_LINE, prompt, "there");
        String company = firstGroup(COMPANY_LINE, prompt, "your team");
        return "Hi "
                + name
                + ",\n\n"
                + "Congratulations on the recent growth at "
                + company
                + ". Teams scaling this quickly often find their infrastructure and"
                + " integration work competing for the same engineers.\n\n"
                + "We help companies like yours automate scaling and unify their data layer,"
                + " which typically frees up a significant share of engineering time.\n\n"
                + "Would a 20-minute conversation next week be useful?";
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private static String firstGroup(Pattern pattern, String text, String fallback) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).strip() : fallback;
    }
}
