package io.prospekt.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.prospekt.cli.producers.ProspektEnvironmentProducer;
import io.prospekt.core.ProspektConfig;
import io.prospekt.core.ProspektFactory;
import io.prospekt.core.cache.InMemoryReportCache;
import io.prospekt.core.execution.RetryPolicy;
import io.prospekt.core.execution.RunListener;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.subject.Subject;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResearchCommandTest extends BaseCommandTest {

    @Mock private ProspektEnvironmentProducer environments;

    private InMemoryReportCache cache;
    private ResearchCommand command;

    @BeforeEach
    void setUp() throws Exception {
        cache = new InMemoryReportCache();
        command = new ResearchCommand();
        injectField(command, "environments", environments);
        injectField(command, "color", false);
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRuns {

        @Test
        void shouldPrintReportAndExitZero() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(mockEnvironment(cache));

            int exitCode = command.call();

            assertThat(exitCode).isEqualTo(ProspektCommand.EXIT_OK);
            String output = outContent.toString();
            assertThat(output).contains("Researching TestCo");
            assertThat(output).contains("SALES INTELLIGENCE REPORT: TestCo");
            assertThat(output).contains("Status: COMPLETED");
            assertThat(output).contains("Key Challenges");
            assertThat(output).contains("Priority Contacts");
            assertThat(output).contains("Outreach Emails Generated: 3");
            assertThat(output).contains("Intelligence gathering complete for TestCo");
            assertThat(cache.lookup(Subject.of("testco"))).isPresent();
        }

        @Test
        void shouldJoinMultiWordCompanyNames() throws Exception {
            injectField(command, "companyName", List.of("Acme", "Corp"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(mockEnvironment(cache));

            command.call();

            assertThat(outContent.toString()).contains("Researching Acme Corp");
            assertThat(cache.lookup(Subject.of("acme corp"))).isPresent();
        }

        @Test
        void shouldServeSecondRunFromCache() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(mockEnvironment(cache));
            command.call();
            outContent.reset();

            int exitCode = command.call();

            assertThat(exitCode).isEqualTo(ProspektCommand.EXIT_OK);
            assertThat(outContent.toString()).contains("from cache");
        }

        @Test
        void shouldBypassCacheWithNoCache() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(mockEnvironment(cache));
            command.call();
            outContent.reset();
            injectField(command, "noCache", true);

            command.call();

            assertThat(outContent.toString()).doesNotContain("from cache");
        }

        @Test
        void shouldPassMockAndSaveFlagsToProducer() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            injectField(command, "mock", true);
            injectField(command, "noSave", true);
            when(environments.create(true, false)).thenReturn(mockEnvironment(cache));

            command.call();

            verify(environments).create(true, false);
            assertThat(outContent.toString()).contains("mock mode");
        }

        @Test
        void shouldPrintStageProgressWhenVerbose() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            injectField(command, "verbose", true);
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(mockEnvironment(cache));

            command.call();

            String output = outContent.toString();
            assertThat(output).contains("research (attempt 1)");
            assertThat(output).contains("✓ outreach");
        }
    }

    @Nested
    @DisplayName("Exit codes")
    class ExitCodes {

        @Test
        void shouldExitOneWhenRequiredStageFails() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenReturn(
                            track(
                                    ProspektFactory.builder()
                                            .config(
                                                    ProspektConfig.builder()
                                                            .retryPolicy(RetryPolicy.noRetry())
                                                            .build())
                                            .searchClient(
                                                    query -> {
                                                        throw ProviderException.terminalFailure(
                                                                "Search request rejected: HTTP 403",
                                                                null);
                                                    })
                                            .languageModel(mock(LanguageModel.class))
                                            .reportCache(cache)
                                            .listener(RunListener.NOOP)
                                            .build()));

            int exitCode = command.call();

            assertThat(exitCode).isEqualTo(ProspektCommand.EXIT_FAILED);
            String output = outContent.toString();
            assertThat(output).contains("Status: FAILED");
            assertThat(output).contains("HTTP 403");
            assertThat(output).contains("Research failed for TestCo");
            assertThat(cache.entries()).isEmpty();
        }

        @Test
        void shouldExitTwoOnConfigurationError() throws Exception {
            injectField(command, "companyName", List.of("TestCo"));
            when(environments.create(anyBoolean(), anyBoolean()))
                    .thenThrow(
                            new IllegalStateException(
                                    "API key not found. Provide one of: GOOGLE_API_KEY"));

            int exitCode = command.call();

            assertThat(exitCode).isEqualTo(ProspektCommand.EXIT_USAGE);
            assertThat(errContent.toString()).contains("Configuration error");
            assertThat(errContent.toString()).contains("GOOGLE_API_KEY");
        }

        @Test
        void shouldExitTwoOnBlankCompany() throws Exception {
            injectField(command, "companyName", List.of("   "));

            int exitCode = command.call();

            assertThat(exitCode).isEqualTo(ProspektCommand.EXIT_USAGE);
            assertThat(errContent.toString()).contains("must not be blank");
        }
    }
}
