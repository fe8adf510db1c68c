package org.keel.exception;

import lombok.Getter;
import org.keel.parser.SyntaxError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a declaration could not be parsed. Carries every collected syntax error.
 */
@Getter
public class SchemaSyntaxException extends KeelException {

    private final List<SyntaxError> errors;

    public SchemaSyntaxException(List<SyntaxError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    private static String format(List<SyntaxError> errors) {
        return errors.size() + " syntax error(s) in declaration:\n" + errors.stream()
                .map(SyntaxError::toString)
                .collect(Collectors.joining("\n"));
    }
}
