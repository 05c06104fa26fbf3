package dev.hrats.cli;

import dev.hrats.entity.Applicant;
import dev.hrats.entity.ApplicantHistoryEntry;
import dev.hrats.entity.EmailTemplate;
import dev.hrats.model.ApplicantStatus;
import dev.hrats.model.DashboardSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of records for the terminal.
 */
public final class ApplicantFormatter {

    private static final String ROW_FORMAT = "%-5s %-24s %-28s %-22s %-10s %-12s %-10s";

    private ApplicantFormatter() {
    }

    public static String header() {
        return String.format(ROW_FORMAT, "ID", "Name", "Email", "Job", "Status", "Source", "Interview");
    }

    public static String row(Applicant a) {
        return String.format(ROW_FORMAT,
                a.getId(),
                truncate(a.getName(), 24),
                truncate(a.getEmail(), 28),
                truncate(a.getJob(), 22),
                a.getStatus().getLabel(),
                truncate(a.getSource(), 12),
                orDash(a.getInterviewDate()));
    }

    public static List<String> details(Applicant a, List<ApplicantHistoryEntry> history) {
        List<String> lines = new ArrayList<>();
        lines.add("Applicant #" + a.getId());
        lines.add("  Name:       " + a.getName());
        lines.add("  Email:      " + orDash(a.getEmail()));
        lines.add("  Phone:      " + orDash(a.getPhone()));
        lines.add("  Job:        " + orDash(a.getJob()));
        lines.add("  Status:     " + a.getStatus().getLabel());
        lines.add("  Source:     " + orDash(a.getSource()));
        lines.add("  Applied:    " + orDash(a.getAppliedDate()));
        lines.add("  Interview:  " + orDash(a.getInterviewDate()));
        if (a.getHiredDate() != null) {
            lines.add("  Hired:      " + a.getHiredDate());
        }
        if (a.getNotes() != null) {
            lines.add("  Notes:      " + a.getNotes());
        }
        if (!history.isEmpty()) {
            lines.add("  History:");
            history.forEach(h -> lines.add("    " + h.getDate() + "  " + h.getChange()));
        }
        return lines;
    }

    public static List<String> dashboard(DashboardSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add("Dashboard (" + summary.today() + ")");
        lines.add("Total Applicants: " + summary.totalApplicants());
        lines.add("Statuses: " + statusCounts(summary.statusCounts()));
        lines.add("");
        lines.add("Upcoming Interviews:");
        if (summary.upcomingInterviews().isEmpty()) {
            lines.add("  No upcoming interviews.");
        } else {
            summary.upcomingInterviews().forEach(a ->
                    lines.add("  " + a.getInterviewDate() + "   " + a.getName() + "  (" + orDash(a.getJob()) + ")"));
        }
        lines.add("");
        lines.add("Recently Added:");
        if (summary.recentlyAdded().isEmpty()) {
            lines.add("  None.");
        } else {
            summary.recentlyAdded().forEach(a ->
                    lines.add(String.format("  %-24s %-22s %-12s %s",
                            truncate(a.getName(), 24), truncate(a.getJob(), 22),
                            truncate(a.getSource(), 12), orDash(a.getAppliedDate()))));
        }
        return lines;
    }

    public static String template(EmailTemplate t) {
        return String.format("%-24s %s", t.getName(), t.getSubject());
    }

    static String statusCounts(Map<ApplicantStatus, Long> counts) {
        String joined = counts.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey().getLabel() + ": " + e.getValue())
                .collect(Collectors.joining("  •  "));
        return joined.isEmpty() ? "—" : joined;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "-";
        }
        return value.length() <= max ? value : value.substring(0, max - 1) + "…";
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
