package io.prospekt.core.stage.analysis;

import io.prospekt.core.provider.CompletionOptions;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.NewsItem;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Second stage: asks the language model for challenges, opportunities and a sales
/// approach based on the research profile.
///
/// @see AnalysisParser for section extraction
public final class AnalysisStage implements Stage {

    private static final Logger logger = Logger.getLogger(AnalysisStage.class.getName());

    static final CompletionOptions OPTIONS = CompletionOptions.of(0.7, 2000);

    private final LanguageModel model;

    public AnalysisStage(LanguageModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public StageName name() {
        return StageName.ANALYSIS;
    }

    @Override
    public Set<StageName> dependencies() {
        return Set.of(StageName.RESEARCH);
    }

    @Override
    public StageResult invoke(Subject subject, ContextView context) {
        CompanyProfile profile = context.require(StageName.RESEARCH, CompanyProfile.class);

        String text;
        try {
            logger.fine(
                    "Requesting analysis of "
                            + profile.companyName()
                            + " from "
                            + model.modelName());
            text = model.complete(buildPrompt(profile), OPTIONS);
        } catch (ProviderException e) {
            return StageResult.failure(e.getKind(), "Analysis failed: " + e.getMessage(), e);
        }

        if (text == null || text.isBlank()) {
            return StageResult.transientFailure("Model returned an empty analysis");
        }

        MarketAnalysis analysis = AnalysisParser.parse(text);
        logger.info(
                "Analysis complete for "
                        + profile.companyName()
                        + ": "
                        + analysis.keyChallenges().size()
                        + " challenges");
        return StageResult.success(analysis);
    }

    static String buildPrompt(CompanyProfile profile) {
        StringBuilder context = new StringBuilder();
        context.append("Company: ").append(profile.companyName()).append("\n\n");
        context.append("Company Information:\n");
        context.append("- Industry: ").append(orNa(profile.industry())).append('\n');
        context.append("- Website: ").append(orNa(profile.website())).append('\n');
        context.append("- Overview: ").append(orNa(profile.overview())).append("\n\n");
        context.append("Recent News:\n");
        for (NewsItem item : profile.recentNews()) {
            context.append("- ").append(item.headline());
            if (!item.summary().isBlank()) {
                context.append(": ").append(item.summary());
            }
            context.append('\n');
        }
        context.append("\nKey Facts:\n");
        for (String fact : profile.keyFacts()) {
            context.append("- ").append(fact).append('\n');
        }

        return """
                You are a business intelligence analyst helping a sales team understand a \
                potential client.

                Based on the following company information, provide a detailed analysis:

                %s
                Please provide:

                1. KEY BUSINESS CHALLENGES (3-5 main challenges this company likely faces)
                2. OPPORTUNITIES (How our solutions could help address these challenges)
                3. RECOMMENDED SALES APPROACH (What angles to emphasize in outreach)

                Format your response clearly with these three sections.
                Be specific and actionable. Focus on insights that would help a sales team \
                engage effectively.
                """
                .formatted(context);
    }

    private static String orNa(String value) {
        return value.isBlank() ? "N/A" : value;
    }
}
