package dev.hrats.service;

import dev.hrats.config.HrAtsProperties;
import dev.hrats.entity.Setting;
import dev.hrats.exception.ValidationException;
import dev.hrats.model.ApplicantStatus;
import dev.hrats.repository.SettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private SettingRepository settingRepository;

    @Captor
    private ArgumentCaptor<Setting> settingCaptor;

    private HrAtsProperties properties;
    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        properties = new HrAtsProperties();
        settingsService = new SettingsService(settingRepository, properties);
    }

    @Test
    @DisplayName("Should fall back to the configured status when nothing is stored")
    void shouldFallBackToConfiguredStatus() {
        properties.setDefaultStatus("Screening");
        when(settingRepository.findById(Setting.DEFAULT_STATUS)).thenReturn(Optional.empty());

        assertThat(settingsService.current().defaultStatus()).isEqualTo(ApplicantStatus.SCREENING);
    }

    @Test
    @DisplayName("Should prefer the stored status")
    void shouldUseStoredStatus() {
        when(settingRepository.findById(Setting.DEFAULT_STATUS))
                .thenReturn(Optional.of(new Setting(Setting.DEFAULT_STATUS, "Interview")));

        assertThat(settingsService.current().defaultStatus()).isEqualTo(ApplicantStatus.INTERVIEW);
    }

    @Test
    @DisplayName("Should ignore an unreadable stored status")
    void shouldIgnoreUnknownStoredStatus() {
        when(settingRepository.findById(Setting.DEFAULT_STATUS))
                .thenReturn(Optional.of(new Setting(Setting.DEFAULT_STATUS, "Background Check")));

        assertThat(settingsService.current().defaultStatus()).isEqualTo(ApplicantStatus.APPLIED);
    }

    @Test
    @DisplayName("Should store the status label")
    void shouldStoreLabel() {
        settingsService.updateDefaultStatus(ApplicantStatus.OFFER);

        verify(settingRepository).save(settingCaptor.capture());
        assertThat(settingCaptor.getValue().getKey()).isEqualTo("default_status");
        assertThat(settingCaptor.getValue().getValue()).isEqualTo("Offer");
    }

    @Test
    @DisplayName("Should require a status")
    void shouldRequireStatus() {
        assertThatThrownBy(() -> settingsService.updateDefaultStatus(null))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(settingRepository);
    }
}
