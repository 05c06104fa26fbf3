package dev.hrats.exception;

/**
 * The import file as a whole could not be read. Individual bad rows are reported as
 * {@link dev.hrats.model.ImportRowError} instead.
 */
public class CsvImportException extends HrAtsException {

    public CsvImportException(String message) {
        super(message);
    }

    public CsvImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
