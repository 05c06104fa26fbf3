package dev.hrats.entity;

import dev.hrats.exception.ValidationException;
import dev.hrats.model.ApplicantStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores statuses by label ("Applied", "Hired", ...) so the database file stays readable.
 * <p>
 * Older files may hold "Background Check", which sat between Interview and Offer; it reads back as
 * Interview. A missing or unknown label reads back as Applied.
 */
@Slf4j
@Converter
public class ApplicantStatusConverter implements AttributeConverter<ApplicantStatus, String> {

    static final String BACKGROUND_CHECK = "Background Check";

    @Override
    public String convertToDatabaseColumn(ApplicantStatus status) {
        return status == null ? null : status.getLabel();
    }

    @Override
    public ApplicantStatus convertToEntityAttribute(String label) {
        if (label == null || label.isBlank()) {
            log.warn("Stored applicant has no status, reading it as {}", ApplicantStatus.APPLIED);
            return ApplicantStatus.APPLIED;
        }
        if (BACKGROUND_CHECK.equalsIgnoreCase(label.trim())) {
            log.warn("Stored status '{}' is no longer a stage, reading it as {}", label, ApplicantStatus.INTERVIEW);
            return ApplicantStatus.INTERVIEW;
        }
        try {
            return ApplicantStatus.fromLabel(label);
        } catch (ValidationException e) {
            log.warn("Unknown stored status '{}', reading it as {}", label, ApplicantStatus.APPLIED);
            return ApplicantStatus.APPLIED;
        }
    }
}
