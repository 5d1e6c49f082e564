package io.prospekt.core.stage.contact;

import static org.assertj.core.api.Assertions.assertThat;

import io.prospekt.core.stage.Contact;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ContactPrioritizer")
class ContactPrioritizerTest {

    private ContactPrioritizer prioritizer;

    @BeforeEach
    void setUp() {
        prioritizer = new ContactPrioritizer();
    }

    @Nested
    @DisplayName("score")
    class Score {

        @ParameterizedTest
        @CsvSource({
            "CTO, 10",
            "VP of Engineering, 15",
            "Chief Technology Officer, 15",
            "Head of Platform, 10",
            "Director of Product Management, 10",
            "Senior Engineering Manager, 5",
            "Account Executive, 0"
        })
        void shouldScoreBySeniorityAndTechRelevance(String title, int expected) {
            assertThat(prioritizer.score(title)).isEqualTo(expected);
        }

        @Test
        void shouldCountSeniorityOnce() {
            assertThat(prioritizer.score("VP and Head of Sales, Chief of Staff")).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("reason")
    class Reason {

        @Test
        void shouldDescribeTechnologyLeaders() {
            assertThat(prioritizer.reason("CTO"))
                    .isEqualTo(ContactPrioritizer.TECH_LEADER_REASON);
            assertThat(prioritizer.reason("Chief Technology Officer"))
                    .isEqualTo(ContactPrioritizer.TECH_LEADER_REASON);
        }

        @Test
        void shouldDescribeExecutivesAndDirectors() {
            assertThat(prioritizer.reason("VP of Sales"))
                    .isEqualTo(ContactPrioritizer.EXECUTIVE_REASON);
            assertThat(prioritizer.reason("Director of Marketing"))
                    .isEqualTo(ContactPrioritizer.DEPARTMENT_LEADER_REASON);
        }

        @Test
        void shouldFallBackToStakeholder() {
            assertThat(prioritizer.reason("Office Manager"))
                    .isEqualTo(ContactPrioritizer.STAKEHOLDER_REASON);
        }
    }

    @Test
    void shouldSortDescendingAndKeepDiscoveryOrderOnTies() {
        var ranked =
                prioritizer.prioritize(
                        List.of(
                                contact("Ann Lee", "Account Executive"),
                                contact("Bob Ray", "VP of Sales"),
                                contact("Cid Moe", "VP of Engineering"),
                                contact("Dee Fox", "Director of Finance")));

        assertThat(ranked)
                .extracting(Contact::name)
                .containsExactly("Cid Moe", "Bob Ray", "Dee Fox", "Ann Lee");
        assertThat(ranked).extracting(Contact::priorityScore).containsExactly(15, 10, 10, 0);
    }

    @Test
    void shouldNotMutateInput() {
        var input = List.of(contact("Ann Lee", "CTO"));

        prioritizer.prioritize(input);

        assertThat(input.get(0).priorityScore()).isZero();
        assertThat(input.get(0).priorityReason()).isEmpty();
    }

    private static Contact contact(String name, String title) {
        return new Contact(name, title, "", "", "", 0, "");
    }
}
