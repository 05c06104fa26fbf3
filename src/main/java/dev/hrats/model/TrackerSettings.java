package dev.hrats.model;

/**
 * Process-wide settings, read once and passed explicitly to creation operations.
 */
public record TrackerSettings(ApplicantStatus defaultStatus) {

    public TrackerSettings {
        if (defaultStatus == null) {
            defaultStatus = ApplicantStatus.APPLIED;
        }
    }

    public static TrackerSettings defaults() {
        return new TrackerSettings(ApplicantStatus.APPLIED);
    }
}
