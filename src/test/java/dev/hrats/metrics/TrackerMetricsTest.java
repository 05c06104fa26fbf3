package dev.hrats.metrics;

import dev.hrats.model.ApplicantStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackerMetricsTest {

    private MeterRegistry meterRegistry;
    private TrackerMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new TrackerMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Record store counters")
    class StoreCountersTests {

        @Test
        @DisplayName("Should record applicants created and deleted")
        void shouldRecordCreatedAndDeleted() {
            metrics.recordApplicantCreated();
            metrics.recordApplicantCreated();
            metrics.recordApplicantDeleted();

            assertThat(meterRegistry.counter("hrats_applicants_created_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("hrats_applicants_deleted_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record import outcome")
        void shouldRecordImport() {
            metrics.recordImport(7, 2);

            assertThat(meterRegistry.counter("hrats_import_rows_accepted_total").count()).isEqualTo(7.0);
            assertThat(meterRegistry.counter("hrats_import_rows_rejected_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should tag status changes by target status")
        void shouldTagStatusChanges() {
            metrics.recordStatusChange(ApplicantStatus.INTERVIEW);
            metrics.recordStatusChange(ApplicantStatus.INTERVIEW);
            metrics.recordStatusChange(ApplicantStatus.HIRED);

            assertThat(meterRegistry.counter("hrats_status_changes_total", "status", "Interview").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("hrats_status_changes_total", "status", "Hired").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record scheduled interviews")
        void shouldRecordInterviews() {
            metrics.recordInterviewScheduled();

            assertThat(meterRegistry.counter("hrats_interviews_scheduled_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Output counters")
    class OutputCountersTests {

        @Test
        @DisplayName("Should record composed emails")
        void shouldRecordEmails() {
            metrics.recordEmailComposed();

            assertThat(meterRegistry.counter("hrats_emails_composed_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record offer letters")
        void shouldRecordOfferLetters() {
            metrics.recordOfferLetter();
            metrics.recordOfferLetter();

            assertThat(meterRegistry.counter("hrats_offer_letters_total").count()).isEqualTo(2.0);
        }
    }
}
