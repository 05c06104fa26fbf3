package dev.hrats.service;

import dev.hrats.config.HrAtsProperties;
import dev.hrats.entity.Applicant;
import dev.hrats.exception.ValidationException;
import dev.hrats.metrics.TrackerMetrics;
import dev.hrats.model.ApplicantDraft;
import dev.hrats.model.ImportResult;
import dev.hrats.model.ImportRow;
import dev.hrats.model.ImportRowError;
import dev.hrats.model.TrackerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk creation of applicants. Each row is created on its own; a bad row is reported and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicantImportService {

    private final ApplicantService applicantService;
    private final CsvApplicantReader csvReader;
    private final HrAtsProperties properties;
    private final TrackerMetrics metrics;

    /**
     * Import a CSV file.
     *
     * @throws dev.hrats.exception.CsvImportException if the file itself is unreadable
     */
    public ImportResult importCsv(Path file, TrackerSettings settings) {
        log.info("Importing applicants from {}", file);
        return importRows(csvReader.read(file), settings);
    }

    /**
     * Create one applicant per row. Never aborts on a single bad row.
     *
     * @return created applicants and per-row errors
     */
    public ImportResult importRows(List<ImportRow> rows, TrackerSettings settings) {
        List<Applicant> created = new ArrayList<>();
        List<ImportRowError> errors = new ArrayList<>();

        for (ImportRow row : rows) {
            try {
                created.add(applicantService.create(toDraft(row), settings));
            } catch (ValidationException e) {
                log.warn("Skipping import row {}: {}", row.rowNumber(), e.getMessage());
                errors.add(new ImportRowError(row.rowNumber(), e.getMessage()));
            }
        }

        metrics.recordImport(created.size(), errors.size());
        log.info("Import finished: {} created, {} skipped", created.size(), errors.size());
        return new ImportResult(created, errors);
    }

    private ApplicantDraft toDraft(ImportRow row) {
        String name = row.get(ImportRow.NAME);
        if (name == null) {
            throw new ValidationException("missing required field 'name'");
        }
        String source = row.get(ImportRow.SOURCE);

        return ApplicantDraft.builder()
                .name(name)
                .email(row.get(ImportRow.EMAIL))
                .phone(row.get(ImportRow.PHONE))
                .job(row.get(ImportRow.JOB))
                .notes(row.get(ImportRow.NOTES))
                .source(source != null ? source : properties.getCsv().getSourceLabel())
                .appliedDate(parseDate(row.rowNumber(), row.get(ImportRow.APPLIED)))
                .build();
    }

    /**
     * The applied date is optional: an unreadable value is dropped and the applicant gets today's date.
     */
    private LocalDate parseDate(long rowNumber, String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Import row {}: ignoring applied date '{}' (expected yyyy-MM-dd)", rowNumber, value);
            return null;
        }
    }
}
