package dev.hrats.model;

import java.util.Map;

/**
 * One data row of an import file, keyed by logical column (name, email, job, ...).
 * Row numbers start at 1 for the first row after the header.
 */
public record ImportRow(long rowNumber, Map<String, String> fields) {

    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String JOB = "job";
    public static final String APPLIED = "applied";
    public static final String NOTES = "notes";
    public static final String SOURCE = "source";

    public ImportRow {
        fields = Map.copyOf(fields);
    }

    public String get(String column) {
        String value = fields.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
