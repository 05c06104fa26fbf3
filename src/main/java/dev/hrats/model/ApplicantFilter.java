package dev.hrats.model;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Criteria for listing applicants. Null fields do not restrict the result.
 */
public record ApplicantFilter(
        Set<ApplicantStatus> statuses,
        String jobContains,
        LocalDate appliedFrom,
        LocalDate appliedTo,
        LocalDate interviewFrom,
        LocalDate interviewTo
) {

    public static ApplicantFilter all() {
        return new ApplicantFilter(null, null, null, null, null, null);
    }

    public static ApplicantFilter byStatus(ApplicantStatus first, ApplicantStatus... rest) {
        return all().withStatuses(EnumSet.of(first, rest));
    }

    public ApplicantFilter withStatuses(Set<ApplicantStatus> value) {
        return new ApplicantFilter(value, jobContains, appliedFrom, appliedTo, interviewFrom, interviewTo);
    }

    public ApplicantFilter withJob(String value) {
        return new ApplicantFilter(statuses, value, appliedFrom, appliedTo, interviewFrom, interviewTo);
    }

    public ApplicantFilter appliedBetween(LocalDate from, LocalDate to) {
        return new ApplicantFilter(statuses, jobContains, from, to, interviewFrom, interviewTo);
    }

    public ApplicantFilter interviewBetween(LocalDate from, LocalDate to) {
        return new ApplicantFilter(statuses, jobContains, appliedFrom, appliedTo, from, to);
    }
}
