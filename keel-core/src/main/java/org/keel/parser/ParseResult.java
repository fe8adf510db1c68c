package org.keel.parser;

import org.keel.exception.SchemaSyntaxException;
import org.keel.parser.ast.Schema;

import java.util.List;

/**
 * Outcome of a parse. A schema that came with errors must not be used for generation.
 */
public record ParseResult(Schema schema, List<SyntaxError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public Schema orThrow() {
        if (!isSuccessful()) {
            throw new SchemaSyntaxException(errors);
        }
        return schema;
    }
}
