package io.netorca.sdk.exception;

import java.util.List;

/**
 * Exception thrown when caller-supplied parameters are malformed.
 *
 * <p>Always raised before any request is sent.
 */
public class ValidationException extends NetOrcaException {

    private final List<ValidationError> errors;

    public ValidationException(String message, List<ValidationError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public static ValidationException invalidField(String field, String message) {
        return new ValidationException(message, List.of(new ValidationError(field, message)));
    }

    public record ValidationError(String field, String message) {}
}
