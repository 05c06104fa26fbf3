package dev.hrats.exception;

/**
 * Base type for errors surfaced to the interactive caller.
 */
public class HrAtsException extends RuntimeException {

    public HrAtsException(String message) {
        super(message);
    }

    public HrAtsException(String message, Throwable cause) {
        super(message, cause);
    }
}
