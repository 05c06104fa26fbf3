package dev.hrats.model;

import dev.hrats.entity.Applicant;

import java.util.List;

public record ImportResult(List<Applicant> created, List<ImportRowError> errors) {

    public ImportResult {
        created = List.copyOf(created);
        errors = List.copyOf(errors);
    }

    public int createdCount() {
        return created.size();
    }

    public int rejectedCount() {
        return errors.size();
    }
}
