package dev.hrats.metrics;

import dev.hrats.model.ApplicantStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for record store operations.
 */
@Component
public class TrackerMetrics {

    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    private final Counter applicantsCreatedCounter;
    private final Counter applicantsDeletedCounter;
    private final Counter importRowsAcceptedCounter;
    private final Counter importRowsRejectedCounter;
    private final Counter interviewsScheduledCounter;
    private final Counter emailsComposedCounter;
    private final Counter offerLettersCounter;

    public TrackerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.applicantsCreatedCounter = Counter.builder("hrats_applicants_created_total")
                .description("Applicants created manually or by import")
                .register(registry);

        this.applicantsDeletedCounter = Counter.builder("hrats_applicants_deleted_total")
                .description("Applicants permanently deleted")
                .register(registry);

        this.importRowsAcceptedCounter = Counter.builder("hrats_import_rows_accepted_total")
                .description("Import rows turned into applicants")
                .register(registry);

        this.importRowsRejectedCounter = Counter.builder("hrats_import_rows_rejected_total")
                .description("Import rows skipped as malformed")
                .register(registry);

        this.interviewsScheduledCounter = Counter.builder("hrats_interviews_scheduled_total")
                .description("Interview dates set")
                .register(registry);

        this.emailsComposedCounter = Counter.builder("hrats_emails_composed_total")
                .description("Template emails composed")
                .register(registry);

        this.offerLettersCounter = Counter.builder("hrats_offer_letters_total")
                .description("Offer letter PDFs written")
                .register(registry);
    }

    public void recordApplicantCreated() {
        applicantsCreatedCounter.increment();
    }

    public void recordApplicantDeleted() {
        applicantsDeletedCounter.increment();
    }

    public void recordImport(int accepted, int rejected) {
        importRowsAcceptedCounter.increment(accepted);
        importRowsRejectedCounter.increment(rejected);
    }

    /**
     * Record an effective status change, tagged by the new status.
     */
    public void recordStatusChange(ApplicantStatus status) {
        Counter.builder("hrats_status_changes_total")
                .tag(TAG_STATUS, status.getLabel())
                .register(registry)
                .increment();
    }

    public void recordInterviewScheduled() {
        interviewsScheduledCounter.increment();
    }

    public void recordEmailComposed() {
        emailsComposedCounter.increment();
    }

    public void recordOfferLetter() {
        offerLettersCounter.increment();
    }
}
