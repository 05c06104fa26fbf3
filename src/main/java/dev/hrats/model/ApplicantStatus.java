package dev.hrats.model;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.hrats.exception.InvalidTransitionException;
import dev.hrats.exception.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Hiring pipeline stages, in pipeline order.
 * Hired and Rejected are terminal: once reached, the status can no longer change.
 */
public enum ApplicantStatus {
    APPLIED("Applied", false),
    SCREENING("Screening", false),
    INTERVIEW("Interview", false),
    OFFER("Offer", false),
    HIRED("Hired", true),
    REJECTED("Rejected", true);

    private final String label;
    private final boolean terminal;

    ApplicantStatus(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Check whether moving from this status to {@code target} is allowed.
     * Staying on the same status is always allowed (no-op).
     */
    public boolean canTransitionTo(ApplicantStatus target) {
        return this == target || !terminal;
    }

    /**
     * Validate a transition, throwing if it is not allowed.
     *
     * @param applicantId used for the error message only
     */
    public void validateTransition(ApplicantStatus target, Long applicantId) {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(applicantId, this, target);
        }
    }

    /**
     * Resolve a status from its label or enum name, ignoring case.
     */
    public static ApplicantStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Status is required");
        }
        String normalized = value.trim();
        for (ApplicantStatus status : values()) {
            if (status.label.equalsIgnoreCase(normalized)
                    || status.name().equalsIgnoreCase(normalized.replace(' ', '_'))) {
                return status;
            }
        }
        throw new ValidationException("Unknown status '" + normalized + "'. Expected one of: " + labels());
    }

    public static String labels() {
        return Arrays.stream(values())
                .map(ApplicantStatus::getLabel)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return label;
    }
}
