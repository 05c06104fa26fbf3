package dev.hrats.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Writes a missing value as empty text, for columns that older files declare NOT NULL.
 */
@Converter
public class EmptyAsNullConverter implements AttributeConverter<String, String> {

    @Override
    public String convertToDatabaseColumn(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String convertToEntityAttribute(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
