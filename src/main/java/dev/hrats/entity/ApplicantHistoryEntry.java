package dev.hrats.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Audit line for an applicant: creation, status changes, interview scheduling.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "history", indexes = {
        @Index(name = "idx_history_applicant", columnList = "applicant_id")
})
public class ApplicantHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "applicant_id", nullable = false)
    private Long applicantId;

    @Convert(converter = IsoDateConverter.class)
    @Column(nullable = false, length = 10)
    private LocalDate date;

    @Column(nullable = false, length = 500)
    private String change;
}
