package dev.hrats.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Caller-supplied fields for a new applicant, from manual entry or an import row.
 */
@Data
@Builder
public class ApplicantDraft {
    private String name;
    private String email;
    private String phone;
    private String job;
    private String notes;
    private String source;      // Manual, CSV Import, ...

    // Defaults to today when absent
    private LocalDate appliedDate;
}
