package dev.hrats.service;

import dev.hrats.exception.CsvImportException;
import dev.hrats.model.ImportRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads applicant rows from a CSV file with a header row.
 * Headers are matched case-insensitively: exact aliases first, then substrings.
 */
@Slf4j
@Component
public class CsvApplicantReader {

    private static final Map<String, ColumnAliases> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put(ImportRow.NAME, new ColumnAliases(
                List.of("name", "full name", "applicant", "candidate"), List.of("name")));
        COLUMNS.put(ImportRow.EMAIL, new ColumnAliases(
                List.of("email", "e-mail", "email address"), List.of("email", "e-mail")));
        COLUMNS.put(ImportRow.PHONE, new ColumnAliases(
                List.of("phone", "phone number", "mobile"), List.of("phone", "mobile")));
        COLUMNS.put(ImportRow.JOB, new ColumnAliases(
                List.of("job", "title", "job title", "position", "role"), List.of("job", "title", "position")));
        COLUMNS.put(ImportRow.APPLIED, new ColumnAliases(
                List.of("applied", "applied date", "date"), List.of("applied", "date")));
        COLUMNS.put(ImportRow.NOTES, new ColumnAliases(
                List.of("notes", "note", "comments"), List.of("note", "comment")));
        COLUMNS.put(ImportRow.SOURCE, new ColumnAliases(
                List.of("source"), List.of("source")));
    }

    /**
     * Read all data rows from a UTF-8 CSV file.
     *
     * @throws CsvImportException if the file cannot be read or has no name column
     */
    public List<ImportRow> read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new CsvImportException("Failed to read CSV file " + file + ": " + e.getMessage(), e);
        }
    }

    public List<ImportRow> read(Reader reader) {
        try (CSVParser parser = csvParser(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new CsvImportException("CSV file has no header row");
            }

            Map<String, String> columnToHeader = resolveColumns(headers);
            if (!columnToHeader.containsKey(ImportRow.NAME)) {
                throw new CsvImportException("CSV header has no name column: " + headers);
            }
            log.debug("CSV columns resolved: {}", columnToHeader);

            List<ImportRow> rows = new ArrayList<>();
            long rowNumber = 0;
            for (CSVRecord record : parser) {
                rowNumber++;
                rows.add(new ImportRow(rowNumber, extract(record, columnToHeader)));
            }
            log.info("Read {} rows from CSV", rows.size());
            return rows;
        } catch (IOException | UncheckedIOException e) {
            throw new CsvImportException("Failed to parse CSV: " + e.getMessage(), e);
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .build();
        return format.parse(reader);
    }

    /**
     * Map logical columns to actual header names. A header is used for at most one column.
     */
    static Map<String, String> resolveColumns(List<String> headers) {
        Map<String, String> normalized = new LinkedHashMap<>();
        for (String header : headers) {
            if (header != null && !normalized.containsKey(header)) {
                normalized.put(header, normalize(header));
            }
        }

        Map<String, String> resolved = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (Map.Entry<String, ColumnAliases> column : COLUMNS.entrySet()) {
            String header = findHeader(normalized, used, column.getValue());
            if (header != null) {
                resolved.put(column.getKey(), header);
                used.add(header);
            }
        }
        return resolved;
    }

    private static String findHeader(Map<String, String> normalized, Set<String> used, ColumnAliases aliases) {
        for (String alias : aliases.exact()) {
            for (Map.Entry<String, String> entry : normalized.entrySet()) {
                if (!used.contains(entry.getKey()) && entry.getValue().equals(alias)) {
                    return entry.getKey();
                }
            }
        }
        for (String fragment : aliases.contains()) {
            for (Map.Entry<String, String> entry : normalized.entrySet()) {
                if (!used.contains(entry.getKey()) && entry.getValue().contains(fragment)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private static Map<String, String> extract(CSVRecord record, Map<String, String> columnToHeader) {
        Map<String, String> fields = new HashMap<>();
        columnToHeader.forEach((column, header) -> {
            // Short rows simply lack the trailing columns
            if (record.isMapped(header) && record.isSet(header)) {
                String value = record.get(header);
                if (value != null) {
                    fields.put(column, value);
                }
            }
        });
        return fields;
    }

    private static String normalize(String header) {
        return header.replace("\uFEFF", "")
                .trim()
                .replace('_', ' ')
                .toLowerCase(Locale.ROOT);
    }

    private record ColumnAliases(List<String> exact, List<String> contains) {
    }
}
