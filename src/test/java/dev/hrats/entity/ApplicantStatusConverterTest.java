package dev.hrats.entity;

import dev.hrats.model.ApplicantStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicantStatusConverterTest {

    private final ApplicantStatusConverter converter = new ApplicantStatusConverter();

    @Test
    @DisplayName("Should store and read statuses by label")
    void shouldUseLabels() {
        assertThat(converter.convertToDatabaseColumn(ApplicantStatus.OFFER)).isEqualTo("Offer");
        assertThat(converter.convertToEntityAttribute("Offer")).isEqualTo(ApplicantStatus.OFFER);
    }

    @Test
    @DisplayName("Background Check from an older file reads as Interview")
    void backgroundCheckReadsAsInterview() {
        assertThat(converter.convertToEntityAttribute("Background Check")).isEqualTo(ApplicantStatus.INTERVIEW);
    }

    @Test
    @DisplayName("Unknown or missing labels read as Applied instead of failing")
    void unknownLabelsReadAsApplied() {
        assertThat(converter.convertToEntityAttribute("On Hold")).isEqualTo(ApplicantStatus.APPLIED);
        assertThat(converter.convertToEntityAttribute("")).isEqualTo(ApplicantStatus.APPLIED);
        assertThat(converter.convertToEntityAttribute(null)).isEqualTo(ApplicantStatus.APPLIED);
    }
}
