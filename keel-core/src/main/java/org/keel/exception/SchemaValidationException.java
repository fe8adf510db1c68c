package org.keel.exception;

import lombok.Getter;
import org.keel.parser.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a syntactically valid declaration is semantically wrong.
 */
@Getter
public class SchemaValidationException extends KeelException {

    private final List<ValidationError> errors;

    public SchemaValidationException(List<ValidationError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    public SchemaValidationException(String message) {
        this(List.of(new ValidationError(message, 0)));
    }

    private static String format(List<ValidationError> errors) {
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.size() + " validation errors:\n" + errors.stream()
                .map(e -> "  - " + e)
                .collect(Collectors.joining("\n"));
    }
}
