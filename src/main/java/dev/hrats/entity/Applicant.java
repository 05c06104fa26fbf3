package dev.hrats.entity;

import dev.hrats.model.ApplicantStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A candidate tracked through the hiring pipeline.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "applicants", indexes = {
        @Index(name = "idx_applicants_status", columnList = "status"),
        @Index(name = "idx_applicants_applied_date", columnList = "applied_date"),
        @Index(name = "idx_applicants_interview_date", columnList = "interview_date")
})
public class Applicant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Convert(converter = EmptyAsNullConverter.class)
    private String email;

    private String phone;

    private String job;

    @Convert(converter = ApplicantStatusConverter.class)
    @Column(nullable = false, length = 32)
    private ApplicantStatus status;

    @Column(length = 4000)
    private String notes;

    @Builder.Default
    private String source = "Manual";

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "applied_date", length = 10)
    private LocalDate appliedDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "interview_date", length = 10)
    private LocalDate interviewDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "hired_date", length = 10)
    private LocalDate hiredDate;

    @Convert(converter = IsoDateTimeConverter.class)
    @Column(name = "created_at", length = 32)
    private LocalDateTime createdAt;
}
