package dev.hrats.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * yyyy-MM-dd text. Sorts and compares correctly as a string in SQLite.
 * Stored text in any other shape reads back as no date.
 */
@Slf4j
@Converter
public class IsoDateConverter implements AttributeConverter<LocalDate, String> {

    @Override
    public String convertToDatabaseColumn(LocalDate date) {
        return date == null ? null : date.toString();
    }

    @Override
    public LocalDate convertToEntityAttribute(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring stored date '{}' (expected yyyy-MM-dd)", value);
            return null;
        }
    }
}
