package org.keel.parser;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.KeelException;
import org.keel.parser.ast.Schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point of the declaration parser.
 */
@Slf4j
public final class SchemaParser {

    private SchemaParser() {
    }

    public static ParseResult parse(String text) {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens, text);
        Schema schema = parser.parseSchema();

        List<SyntaxError> errors = new ArrayList<>(lexer.getErrors());
        errors.addAll(parser.getErrors());
        errors.sort(Comparator.comparingInt(SyntaxError::line).thenComparingInt(SyntaxError::column));

        log.debug("Parsed declaration: {} model(s), {} enum(s), {} error(s)",
                schema.models().size(), schema.enums().size(), errors.size());
        return new ParseResult(schema, errors);
    }

    public static Schema parseOrThrow(String text) {
        return parse(text).orThrow();
    }

    public static ParseResult parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new KeelException("Failed to read declaration " + file, e);
        }
    }
}
