package io.prospekt.core.stage.research;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.provider.SearchClient;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.provider.simulated.SimulatedSearchClient;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.FailureKind;
import io.prospekt.core.stage.NewsItem;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ResearchStage")
@ExtendWith(MockitoExtension.class)
class ResearchStageTest {

    @Mock private SearchClient searchClient;
    @Mock private ContextView context;

    @Test
    void shouldHaveNoDependencies() {
        var stage = new ResearchStage(searchClient);

        assertThat(stage.name()).isEqualTo(StageName.RESEARCH);
        assertThat(stage.dependencies()).isEmpty();
    }

    @Test
    void shouldBuildProfileFromOverviewAndNewsHits() {
        when(searchClient.search("Acme company overview"))
                .thenReturn(
                        List.of(
                                new SearchHit("Acme", "Acme builds rockets.", "https://acme.test"),
                                new SearchHit("Acme | LinkedIn", "Industry: Aerospace. 500 staff", ""),
                                new SearchHit("About", "", "")));
        when(searchClient.search("Acme news recent"))
                .thenReturn(List.of(new SearchHit("Acme launches", "It flew.", "https://n.test")));

        var result = new ResearchStage(searchClient).invoke(Subject.of("Acme"), context);

        assertThat(result).isInstanceOf(StageResult.Success.class);
        var profile = (CompanyProfile) ((StageResult.Success) result).output();
        assertThat(profile.companyName()).isEqualTo("Acme");
        assertThat(profile.overview()).isEqualTo("Acme builds rockets.");
        assertThat(profile.website()).isEqualTo("https://acme.test");
        assertThat(profile.industry()).isEqualTo("Aerospace");
        assertThat(profile.keyFacts()).containsExactly("Industry: Aerospace. 500 staff");
        assertThat(profile.recentNews())
                .containsExactly(new NewsItem("Acme launches", "It flew.", "https://n.test"));
        assertThat(profile.sources()).hasSize(3);
    }

    @Test
    void shouldFailTerminallyWhenNothingFound() {
        when(searchClient.search("ghost inc company overview")).thenReturn(List.of());
        when(searchClient.search("ghost inc news recent")).thenReturn(List.of());

        var result = new ResearchStage(searchClient).invoke(Subject.of("ghost inc"), context);

        assertThat(result).isInstanceOf(StageResult.Failure.class);
        var failure = (StageResult.Failure) result;
        assertThat(failure.kind()).isEqualTo(FailureKind.TERMINAL);
        assertThat(failure.message()).isEqualTo("No information found for ghost inc");
    }

    @Test
    void shouldMapProviderExceptionToFailureOfSameKind() {
        when(searchClient.search("Acme company overview"))
                .thenThrow(ProviderException.transientFailure("HTTP 503", null));

        var result = new ResearchStage(searchClient).invoke(Subject.of("Acme"), context);

        assertThat(result).isInstanceOf(StageResult.Failure.class);
        assertThat(((StageResult.Failure) result).kind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(((StageResult.Failure) result).message()).contains("HTTP 503");
    }

    @Test
    void shouldUseDisplayNameInQueries() {
        var result =
                new ResearchStage(new SimulatedSearchClient())
                        .invoke(Subject.of("  Titan   Industries "), context);

        var profile = (CompanyProfile) ((StageResult.Success) result).output();
        assertThat(profile.companyName()).isEqualTo("Titan Industries");
        assertThat(profile.website()).isEqualTo("https://www.titanindustries.com");
        assertThat(profile.industry()).isEqualTo("Technology, Software, Enterprise Solutions");
        assertThat(profile.recentNews()).hasSize(2);
    }
}
