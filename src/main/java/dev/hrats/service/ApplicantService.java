package dev.hrats.service;

import dev.hrats.entity.Applicant;
import dev.hrats.entity.ApplicantHistoryEntry;
import dev.hrats.exception.NotFoundException;
import dev.hrats.exception.ValidationException;
import dev.hrats.metrics.TrackerMetrics;
import dev.hrats.model.ApplicantDraft;
import dev.hrats.model.ApplicantFilter;
import dev.hrats.model.ApplicantStatus;
import dev.hrats.model.TrackerSettings;
import dev.hrats.repository.ApplicantHistoryRepository;
import dev.hrats.repository.ApplicantRepository;
import dev.hrats.repository.ApplicantSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.util.Streamable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applicant record store: creation, status lifecycle, interview scheduling, deletion and listing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicantService {

    public static final String MANUAL_SOURCE = "Manual";
    public static final Sort DEFAULT_ORDER = Sort.by(Sort.Order.desc("appliedDate"), Sort.Order.desc("id"));

    private final ApplicantRepository applicantRepository;
    private final ApplicantHistoryRepository historyRepository;
    private final TrackerMetrics metrics;
    private final Clock clock;

    /**
     * Create an applicant with the configured default status.
     *
     * @param draft    Caller-supplied fields; name is required
     * @param settings Settings in effect for this creation; {@code null} means the defaults
     * @return The saved applicant with its generated id
     */
    @Transactional
    public Applicant create(ApplicantDraft draft, TrackerSettings settings) {
        String name = trimToNull(draft.getName());
        if (name == null) {
            throw new ValidationException("Name is required");
        }

        LocalDate today = LocalDate.now(clock);
        ApplicantStatus status = (settings != null ? settings : TrackerSettings.defaults()).defaultStatus();
        String source = trimToNull(draft.getSource());

        Applicant applicant = Applicant.builder()
                .name(name)
                .email(trimToNull(draft.getEmail()))
                .phone(trimToNull(draft.getPhone()))
                .job(trimToNull(draft.getJob()))
                .notes(trimToNull(draft.getNotes()))
                .source(source != null ? source : MANUAL_SOURCE)
                .status(status)
                .appliedDate(draft.getAppliedDate() != null ? draft.getAppliedDate() : today)
                .hiredDate(status == ApplicantStatus.HIRED ? today : null)
                .createdAt(LocalDateTime.now(clock))
                .build();

        Applicant saved = applicantRepository.save(applicant);
        recordHistory(saved.getId(), MANUAL_SOURCE.equals(saved.getSource())
                ? "Added manually"
                : "Added from " + saved.getSource());
        metrics.recordApplicantCreated();

        log.info("Created applicant {} '{}' with status {}", saved.getId(), saved.getName(), status.getLabel());
        return saved;
    }

    /**
     * Move an applicant to a new status. Same-status requests are no-ops.
     *
     * @throws dev.hrats.exception.InvalidTransitionException if the applicant is already Hired or Rejected
     */
    @Transactional
    public Applicant updateStatus(Long id, ApplicantStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        Applicant applicant = get(id);
        ApplicantStatus current = applicant.getStatus();

        if (current == newStatus) {
            log.debug("Applicant {} already {} - nothing to do", id, current.getLabel());
            return applicant;
        }
        current.validateTransition(newStatus, id);

        applicant.setStatus(newStatus);
        if (newStatus == ApplicantStatus.HIRED && applicant.getHiredDate() == null) {
            applicant.setHiredDate(LocalDate.now(clock));
        }
        Applicant saved = applicantRepository.save(applicant);
        recordHistory(id, "Status → " + newStatus.getLabel());
        metrics.recordStatusChange(newStatus);

        log.info("Applicant {} status {} -> {}", id, current.getLabel(), newStatus.getLabel());
        return saved;
    }

    /**
     * Set the interview date. Status is left unchanged.
     */
    @Transactional
    public Applicant scheduleInterview(Long id, LocalDate date) {
        if (date == null) {
            throw new ValidationException("Interview date is required");
        }
        Applicant applicant = get(id);
        applicant.setInterviewDate(date);
        Applicant saved = applicantRepository.save(applicant);
        recordHistory(id, "Interview: " + date);
        metrics.recordInterviewScheduled();

        log.info("Applicant {} interview scheduled for {}", id, date);
        return saved;
    }

    /**
     * Permanently delete an applicant and its history. Confirmation is the caller's job.
     */
    @Transactional
    public void delete(Long id) {
        if (id == null || !applicantRepository.existsById(id)) {
            throw NotFoundException.applicant(id);
        }
        int historyRemoved = historyRepository.deleteByApplicantId(id);
        applicantRepository.deleteById(id);
        metrics.recordApplicantDeleted();

        log.info("Deleted applicant {} ({} history entries)", id, historyRemoved);
    }

    public Applicant get(Long id) {
        if (id == null) {
            throw NotFoundException.applicant(null);
        }
        return applicantRepository.findById(id)
                .orElseThrow(() -> NotFoundException.applicant(id));
    }

    public List<ApplicantHistoryEntry> history(Long id) {
        get(id);
        return historyRepository.findByApplicantIdOrderByIdAsc(id);
    }

    /**
     * Applicants matching a filter, newest application first.
     */
    public Streamable<Applicant> list(ApplicantFilter filter) {
        return list(filter, DEFAULT_ORDER);
    }

    /**
     * Lazy view over matching applicants. The query runs each time the result is iterated,
     * so the same instance can be consumed more than once and always reflects the store.
     */
    public Streamable<Applicant> list(ApplicantFilter filter, Sort sort) {
        ApplicantFilter criteria = filter != null ? filter : ApplicantFilter.all();
        return Streamable.of(() -> applicantRepository
                .findAll(ApplicantSpecifications.matching(criteria), sort)
                .stream());
    }

    public long count() {
        return applicantRepository.count();
    }

    /**
     * Applicant count per status in pipeline order, including stages with no applicants.
     */
    public Map<ApplicantStatus, Long> countByStatus() {
        Map<ApplicantStatus, Long> counts = new EnumMap<>(ApplicantStatus.class);
        for (ApplicantStatus status : ApplicantStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : applicantRepository.countGroupedByStatus()) {
            ApplicantStatus status = (ApplicantStatus) row[0];
            // older files can store two labels that read back as the same stage
            if (status != null) {
                counts.merge(status, ((Number) row[1]).longValue(), Long::sum);
            }
        }
        return counts;
    }

    private void recordHistory(Long applicantId, String change) {
        historyRepository.save(ApplicantHistoryEntry.builder()
                .applicantId(applicantId)
                .date(LocalDate.now(clock))
                .change(change)
                .build());
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
