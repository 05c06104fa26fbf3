package dev.hrats.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class IsoDateConverterTest {

    private final IsoDateConverter dates = new IsoDateConverter();
    private final IsoDateTimeConverter timestamps = new IsoDateTimeConverter();

    @Test
    @DisplayName("Should read ISO dates and tolerate surrounding spaces")
    void shouldReadIsoDates() {
        assertThat(dates.convertToEntityAttribute(" 2026-03-04 ")).isEqualTo(LocalDate.of(2026, 3, 4));
        assertThat(dates.convertToDatabaseColumn(LocalDate.of(2026, 3, 4))).isEqualTo("2026-03-04");
    }

    @Test
    @DisplayName("Stored dates in another format read as no date")
    void foreignDatesReadAsNull() {
        assertThat(dates.convertToEntityAttribute("03/04/2026")).isNull();
        assertThat(dates.convertToEntityAttribute("  ")).isNull();
        assertThat(timestamps.convertToEntityAttribute("yesterday")).isNull();
    }

    @Test
    @DisplayName("Should read ISO timestamps")
    void shouldReadTimestamps() {
        assertThat(timestamps.convertToEntityAttribute("2026-03-10T09:00"))
                .isEqualTo(LocalDateTime.of(2026, 3, 10, 9, 0));
    }
}
