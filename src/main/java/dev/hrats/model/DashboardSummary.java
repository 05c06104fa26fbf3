package dev.hrats.model;

import dev.hrats.entity.Applicant;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Snapshot for the dashboard view.
 *
 * @param statusCounts one entry per stage, in pipeline order, zero-filled
 */
public record DashboardSummary(
        LocalDate today,
        long totalApplicants,
        Map<ApplicantStatus, Long> statusCounts,
        List<Applicant> upcomingInterviews,
        List<Applicant> recentlyAdded
) {
}
