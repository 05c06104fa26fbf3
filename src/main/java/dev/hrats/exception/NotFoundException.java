package dev.hrats.exception;

public class NotFoundException extends HrAtsException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException applicant(Long id) {
        return new NotFoundException("Applicant " + id + " not found");
    }

    public static NotFoundException template(String name) {
        return new NotFoundException("Email template '" + name + "' not found");
    }
}
