package dev.hrats.service;

import dev.hrats.config.HrAtsProperties;
import dev.hrats.entity.Applicant;
import dev.hrats.model.ApplicantFilter;
import dev.hrats.model.DashboardSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregates the store for the dashboard: totals, per-stage counts,
 * upcoming interviews and recently added applicants.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private static final Sort BY_INTERVIEW_DATE = Sort.by(Sort.Order.asc("interviewDate"), Sort.Order.asc("id"));

    private final ApplicantService applicantService;
    private final HrAtsProperties properties;

    public DashboardSummary summary(LocalDate today) {
        HrAtsProperties.Dashboard config = properties.getDashboard();

        List<Applicant> upcoming = applicantService.list(
                        ApplicantFilter.all().interviewBetween(today, today.plusDays(config.getUpcomingDays())),
                        BY_INTERVIEW_DATE)
                .toList();

        List<Applicant> recent = applicantService.list(
                        ApplicantFilter.all().appliedBetween(today.minusDays(config.getRecentDays()), null))
                .stream()
                .limit(config.getRecentLimit())
                .toList();

        DashboardSummary summary = new DashboardSummary(
                today,
                applicantService.count(),
                applicantService.countByStatus(),
                upcoming,
                recent);
        log.debug("Dashboard: {} applicants, {} upcoming interviews, {} recent",
                summary.totalApplicants(), upcoming.size(), recent.size());
        return summary;
    }
}
