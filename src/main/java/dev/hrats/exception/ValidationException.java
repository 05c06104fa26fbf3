package dev.hrats.exception;

/**
 * A required field is missing or a value is not acceptable.
 */
public class ValidationException extends HrAtsException {

    public ValidationException(String message) {
        super(message);
    }
}
