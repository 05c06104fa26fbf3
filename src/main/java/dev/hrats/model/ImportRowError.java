package dev.hrats.model;

/**
 * A row that was skipped during import. Non-fatal: the rest of the batch still runs.
 */
public record ImportRowError(long rowNumber, String reason) {

    @Override
    public String toString() {
        return "row " + rowNumber + ": " + reason;
    }
}
