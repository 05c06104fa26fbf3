package dev.hrats.model;

import dev.hrats.exception.InvalidTransitionException;
import dev.hrats.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicantStatusTest {

    @Nested
    @DisplayName("Stage set")
    class StageSetTests {

        @Test
        @DisplayName("Should list the six stages in pipeline order")
        void shouldListStagesInOrder() {
            assertThat(ApplicantStatus.values())
                    .extracting(ApplicantStatus::getLabel)
                    .containsExactly("Applied", "Screening", "Interview", "Offer", "Hired", "Rejected");
        }

        @Test
        @DisplayName("Only Hired and Rejected are terminal")
        void onlyHiredAndRejectedAreTerminal() {
            assertThat(ApplicantStatus.values())
                    .filteredOn(ApplicantStatus::isTerminal)
                    .containsExactlyInAnyOrder(ApplicantStatus.HIRED, ApplicantStatus.REJECTED);
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @ParameterizedTest(name = "{0} may move to any stage")
        @EnumSource(value = ApplicantStatus.class, names = {"APPLIED", "SCREENING", "INTERVIEW", "OFFER"})
        void nonTerminalMayMoveAnywhere(ApplicantStatus from) {
            for (ApplicantStatus to : ApplicantStatus.values()) {
                assertThat(from.canTransitionTo(to)).isTrue();
            }
        }

        @ParameterizedTest(name = "{0} may be rejected directly")
        @EnumSource(value = ApplicantStatus.class, names = {"APPLIED", "SCREENING", "INTERVIEW", "OFFER"})
        void rejectionAllowedFromAnyTransientStage(ApplicantStatus from) {
            assertThatCode(() -> from.validateTransition(ApplicantStatus.REJECTED, 1L))
                    .doesNotThrowAnyException();
        }

        @ParameterizedTest(name = "{0} -> {1} is rejected")
        @CsvSource({
                "HIRED, REJECTED",
                "HIRED, APPLIED",
                "REJECTED, HIRED",
                "REJECTED, OFFER"
        })
        void terminalCannotChange(ApplicantStatus from, ApplicantStatus to) {
            assertThat(from.canTransitionTo(to)).isFalse();
            assertThatThrownBy(() -> from.validateTransition(to, 7L))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("Applicant 7")
                    .hasMessageContaining(from.getLabel());
        }

        @ParameterizedTest(name = "{0} -> {0} is allowed")
        @EnumSource(ApplicantStatus.class)
        void sameStatusAlwaysAllowed(ApplicantStatus status) {
            assertThat(status.canTransitionTo(status)).isTrue();
        }
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @ParameterizedTest(name = "Should parse ''{0}''")
        @CsvSource({
                "Applied, APPLIED",
                "interview, INTERVIEW",
                "  OFFER , OFFER",
                "Rejected, REJECTED"
        })
        void shouldParseLabelsIgnoringCase(String value, ApplicantStatus expected) {
            assertThat(ApplicantStatus.fromLabel(value)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should reject unknown labels")
        void shouldRejectUnknownLabel() {
            assertThatThrownBy(() -> ApplicantStatus.fromLabel("Background Check"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Applied, Screening, Interview, Offer, Hired, Rejected");
        }

        @Test
        @DisplayName("Should reject blank status")
        void shouldRejectBlank() {
            assertThatThrownBy(() -> ApplicantStatus.fromLabel(" "))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
