package dev.hrats.service;

import dev.hrats.config.HrAtsProperties;
import dev.hrats.entity.Setting;
import dev.hrats.exception.ValidationException;
import dev.hrats.model.ApplicantStatus;
import dev.hrats.model.TrackerSettings;
import dev.hrats.repository.SettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and updates the stored settings record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final SettingRepository settingRepository;
    private final HrAtsProperties properties;

    /**
     * Current settings: the stored value, or the configured fallback when nothing is stored yet.
     */
    public TrackerSettings current() {
        ApplicantStatus defaultStatus = settingRepository.findById(Setting.DEFAULT_STATUS)
                .map(Setting::getValue)
                .filter(value -> value != null && !value.isBlank())
                .map(this::parseStoredStatus)
                .orElseGet(this::configuredDefaultStatus);
        return new TrackerSettings(defaultStatus);
    }

    /**
     * Persist a new default status for applicants created from now on.
     */
    @Transactional
    public TrackerSettings updateDefaultStatus(ApplicantStatus status) {
        if (status == null) {
            throw new ValidationException("Default status is required");
        }
        settingRepository.save(new Setting(Setting.DEFAULT_STATUS, status.getLabel()));
        log.info("Default status set to {}", status.getLabel());
        return new TrackerSettings(status);
    }

    private ApplicantStatus parseStoredStatus(String value) {
        try {
            return ApplicantStatus.fromLabel(value);
        } catch (ValidationException e) {
            log.warn("Ignoring stored default status '{}': {}", value, e.getMessage());
            return configuredDefaultStatus();
        }
    }

    private ApplicantStatus configuredDefaultStatus() {
        return ApplicantStatus.fromLabel(properties.getDefaultStatus());
    }
}
