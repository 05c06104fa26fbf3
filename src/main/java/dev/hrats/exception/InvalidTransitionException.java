package dev.hrats.exception;

import dev.hrats.model.ApplicantStatus;
import lombok.Getter;

/**
 * Raised when a status change is requested for an applicant already in a terminal stage.
 */
@Getter
public class InvalidTransitionException extends HrAtsException {

    private final ApplicantStatus from;
    private final ApplicantStatus to;

    public InvalidTransitionException(Long applicantId, ApplicantStatus from, ApplicantStatus to) {
        super(String.format("Applicant %d is %s (terminal); cannot change status to %s",
                applicantId, from.getLabel(), to.getLabel()));
        this.from = from;
        this.to = to;
    }
}
