package org.keel.parser;

import org.keel.parser.ast.Argument;
import org.keel.parser.ast.ArgumentValue;
import org.keel.parser.ast.Attribute;
import org.keel.parser.ast.ConfigBlock;
import org.keel.parser.ast.ConfigEntry;
import org.keel.parser.ast.EnumDecl;
import org.keel.parser.ast.EnumValue;
import org.keel.parser.ast.FieldDecl;
import org.keel.parser.ast.FieldType;
import org.keel.parser.ast.ModelDecl;
import org.keel.parser.ast.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser over the token stream produced by {@link Lexer}.
 *
 * <p>Errors never abort the parse: after reporting, the parser skips to the end of the
 * current line (inside a block) or past the current block (at the top level) and carries on,
 * so one pass reports as many problems as possible.
 */
public class Parser {

    private static final Set<String> BLOCK_KEYWORDS = Set.of("datasource", "generator", "model", "enum");

    private final List<Token> tokens;
    private final SourceLines lines;
    private final List<SyntaxError> errors = new ArrayList<>();
    private int index;

    public Parser(List<Token> tokens, String source) {
        this.tokens = tokens.stream().filter(t -> t.type() != TokenType.ILLEGAL).toList();
        this.lines = new SourceLines(source == null ? "" : source);
    }

    public List<SyntaxError> getErrors() {
        return List.copyOf(errors);
    }

    public Schema parseSchema() {
        List<ConfigBlock> datasources = new ArrayList<>();
        List<ConfigBlock> generators = new ArrayList<>();
        List<ModelDecl> models = new ArrayList<>();
        List<EnumDecl> enums = new ArrayList<>();

        skipNewlines();
        while (!check(TokenType.EOF)) {
            Token t = current();
            if (t.is(TokenType.IDENT) && BLOCK_KEYWORDS.contains(t.text())) {
                switch (t.text()) {
                    case "datasource" -> addIfPresent(datasources, parseConfigBlock(ConfigBlock.Kind.DATASOURCE));
                    case "generator" -> addIfPresent(generators, parseConfigBlock(ConfigBlock.Kind.GENERATOR));
                    case "model" -> addIfPresent(models, parseModel());
                    default -> addIfPresent(enums, parseEnum());
                }
            } else if (t.is(TokenType.IDENT)) {
                error(t, "unrecognized block type '" + t.text() + "'");
                recoverBlock();
            } else if (t.is(TokenType.RBRACE)) {
                error(t, "unbalanced braces: unexpected '}'");
                advance();
            } else {
                error(t, "expected block declaration (datasource, generator, model or enum), found " + t.describe());
                recoverBlock();
            }
            skipNewlines();
        }
        return new Schema(datasources, generators, models, enums);
    }

    // Blocks

    private ConfigBlock parseConfigBlock(ConfigBlock.Kind kind) {
        Token keyword = advance();
        Token name = expect(TokenType.IDENT, keyword.text() + " name");
        if (name == null || expect(TokenType.LBRACE, "'{'") == null) {
            recoverBlock();
            return null;
        }

        List<ConfigEntry> entries = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token t = current();
            if (t.is(TokenType.RBRACE)) {
                advance();
                break;
            }
            if (t.is(TokenType.EOF) || isBlockStart()) {
                unclosed(keyword, name);
                break;
            }
            if (!t.is(TokenType.IDENT)) {
                error(t, "expected 'key = value' in " + keyword.text() + " '" + name.text() + "', found " + t.describe());
                skipLine();
                continue;
            }
            Token key = advance();
            if (!check(TokenType.EQUALS)) {
                error(current(), "expected '=' after '" + key.text() + "', found " + current().describe());
                skipLine();
                continue;
            }
            advance();
            ArgumentValue value = parseValue("'" + key.text() + "'");
            if (value == null) {
                skipLine();
                continue;
            }
            entries.add(new ConfigEntry(key.text(), value, key.line()));
            expectLineEnd("entry '" + key.text() + "'");
        }
        return new ConfigBlock(kind, name.text(), entries, keyword.line());
    }

    private ModelDecl parseModel() {
        Token keyword = advance();
        Token name = expect(TokenType.IDENT, "model name");
        if (name == null || expect(TokenType.LBRACE, "'{'") == null) {
            recoverBlock();
            return null;
        }

        List<FieldDecl> fields = new ArrayList<>();
        List<Attribute> attributes = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token t = current();
            if (t.is(TokenType.RBRACE)) {
                advance();
                break;
            }
            if (t.is(TokenType.EOF) || isBlockStart()) {
                unclosed(keyword, name);
                break;
            }
            if (t.is(TokenType.AT_AT)) {
                Attribute attribute = parseAttribute(true);
                if (attribute == null) {
                    skipLine();
                } else {
                    attributes.add(attribute);
                    expectLineEnd("attribute " + attribute);
                }
                continue;
            }
            if (t.is(TokenType.IDENT)) {
                addIfPresent(fields, parseField());
                continue;
            }
            error(t, "expected field or block attribute in model '" + name.text() + "', found " + t.describe());
            skipLine();
        }
        return new ModelDecl(name.text(), fields, attributes, keyword.line());
    }

    private FieldDecl parseField() {
        Token name = advance();
        Token typeToken = current();
        if (!typeToken.is(TokenType.IDENT)) {
            error(typeToken, "expected type for field '" + name.text() + "', found " + typeToken.describe());
            skipLine();
            return null;
        }
        advance();

        String unsupported = null;
        if (typeToken.text().equals(FieldType.UNSUPPORTED) && check(TokenType.LPAREN)) {
            advance();
            Token raw = expect(TokenType.STRING, "database type string");
            if (raw == null || expect(TokenType.RPAREN, "')'") == null) {
                skipLine();
                return null;
            }
            unsupported = raw.text();
        }

        boolean list = false;
        if (check(TokenType.LBRACKET)) {
            advance();
            if (expect(TokenType.RBRACKET, "']'") == null) {
                skipLine();
                return null;
            }
            list = true;
        }
        boolean optional = false;
        if (check(TokenType.QUESTION)) {
            advance();
            optional = true;
        }

        List<Attribute> attributes = new ArrayList<>();
        while (check(TokenType.AT)) {
            Attribute attribute = parseAttribute(false);
            if (attribute == null) {
                skipLine();
                break;
            }
            attributes.add(attribute);
        }
        expectLineEnd("field '" + name.text() + "'");

        return new FieldDecl(name.text(), new FieldType(typeToken.text(), list, optional, unsupported),
                attributes, name.line());
    }

    private EnumDecl parseEnum() {
        Token keyword = advance();
        Token name = expect(TokenType.IDENT, "enum name");
        if (name == null || expect(TokenType.LBRACE, "'{'") == null) {
            recoverBlock();
            return null;
        }

        List<EnumValue> values = new ArrayList<>();
        List<Attribute> attributes = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token t = current();
            if (t.is(TokenType.RBRACE)) {
                advance();
                break;
            }
            if (t.is(TokenType.EOF) || isBlockStart()) {
                unclosed(keyword, name);
                break;
            }
            if (t.is(TokenType.AT_AT)) {
                Attribute attribute = parseAttribute(true);
                if (attribute == null) {
                    skipLine();
                } else {
                    attributes.add(attribute);
                    expectLineEnd("attribute " + attribute);
                }
                continue;
            }
            if (!t.is(TokenType.IDENT)) {
                error(t, "expected enum value in enum '" + name.text() + "', found " + t.describe());
                skipLine();
                continue;
            }
            Token value = advance();
            List<Attribute> valueAttributes = new ArrayList<>();
            while (check(TokenType.AT)) {
                Attribute attribute = parseAttribute(false);
                if (attribute == null) {
                    skipLine();
                    break;
                }
                valueAttributes.add(attribute);
            }
            expectLineEnd("enum value '" + value.text() + "'");
            values.add(new EnumValue(value.text(), valueAttributes, value.line()));
        }
        return new EnumDecl(name.text(), values, attributes, keyword.line());
    }

    // Attributes and values

    private Attribute parseAttribute(boolean blockLevel) {
        Token at = advance();
        Token first = expect(TokenType.IDENT, "attribute name");
        if (first == null) {
            return null;
        }
        StringBuilder name = new StringBuilder(first.text());
        while (check(TokenType.DOT)) {
            advance();
            Token part = expect(TokenType.IDENT, "attribute name after '.'");
            if (part == null) {
                return null;
            }
            name.append('.').append(part.text());
        }

        List<Argument> arguments = List.of();
        if (check(TokenType.LPAREN)) {
            arguments = parseArgumentList((blockLevel ? "@@" : "@") + name);
            if (arguments == null) {
                return null;
            }
        }
        return new Attribute(name.toString(), arguments, blockLevel, at.line());
    }

    private List<Argument> parseArgumentList(String context) {
        advance(); // '('
        List<Argument> arguments = new ArrayList<>();
        if (check(TokenType.RPAREN)) {
            advance();
            return arguments;
        }
        while (true) {
            Argument argument = parseArgument(context);
            if (argument == null) {
                recoverArguments();
                return null;
            }
            arguments.add(argument);

            if (check(TokenType.COMMA)) {
                advance();
                if (check(TokenType.RPAREN)) {
                    advance();
                    return arguments;
                }
                continue;
            }
            if (check(TokenType.RPAREN)) {
                advance();
                return arguments;
            }
            error(current(), "malformed argument list for " + context + ": expected ',' or ')', found "
                    + current().describe());
            recoverArguments();
            return null;
        }
    }

    private Argument parseArgument(String context) {
        if (check(TokenType.IDENT) && (peekIs(TokenType.COLON) || peekIs(TokenType.EQUALS))) {
            Token name = advance();
            advance();
            ArgumentValue value = parseValue(context);
            return value == null ? null : Argument.named(name.text(), value);
        }
        ArgumentValue value = parseValue(context);
        return value == null ? null : Argument.positional(value);
    }

    private ArgumentValue parseValue(String context) {
        Token t = current();
        switch (t.type()) {
            case STRING:
                advance();
                return ArgumentValue.Scalar.string(t.text());
            case NUMBER:
                advance();
                return ArgumentValue.Scalar.number(t.text());
            case IDENT: {
                advance();
                if (t.text().equals("true") || t.text().equals("false")) {
                    return ArgumentValue.Scalar.bool(Boolean.parseBoolean(t.text()));
                }
                if (check(TokenType.LPAREN)) {
                    List<Argument> arguments = parseArgumentList(t.text() + "()");
                    return arguments == null ? null : new ArgumentValue.FunctionCall(t.text(), arguments);
                }
                return ArgumentValue.Scalar.identifier(t.text());
            }
            case LBRACKET:
                return parseList(context);
            default:
                error(t, "expected value in " + context + ", found " + t.describe());
                return null;
        }
    }

    private ArgumentValue parseList(String context) {
        advance(); // '['
        List<ArgumentValue> elements = new ArrayList<>();
        if (check(TokenType.RBRACKET)) {
            advance();
            return new ArgumentValue.ListValue(elements);
        }
        while (true) {
            ArgumentValue element = parseValue(context);
            if (element == null) {
                return null;
            }
            elements.add(element);
            if (check(TokenType.COMMA)) {
                advance();
                if (check(TokenType.RBRACKET)) {
                    advance();
                    break;
                }
                continue;
            }
            if (check(TokenType.RBRACKET)) {
                advance();
                break;
            }
            error(current(), "malformed list in " + context + ": expected ',' or ']', found " + current().describe());
            return null;
        }
        return new ArgumentValue.ListValue(elements);
    }

    // Recovery

    private void recoverBlock() {
        int depth = 0;
        while (!check(TokenType.EOF)) {
            Token t = current();
            if (t.is(TokenType.LBRACE)) {
                depth++;
            } else if (t.is(TokenType.RBRACE)) {
                depth--;
                if (depth <= 0) {
                    advance();
                    return;
                }
            } else if (t.is(TokenType.NEWLINE) && depth == 0) {
                advance();
                return;
            }
            advance();
        }
    }

    private void recoverArguments() {
        int depth = 1;
        while (!check(TokenType.EOF) && !check(TokenType.NEWLINE)) {
            if (check(TokenType.LPAREN)) {
                depth++;
            } else if (check(TokenType.RPAREN)) {
                depth--;
                if (depth == 0) {
                    advance();
                    return;
                }
            }
            advance();
        }
    }

    private void skipLine() {
        while (!check(TokenType.EOF) && !check(TokenType.NEWLINE) && !check(TokenType.RBRACE)) {
            advance();
        }
    }

    private void expectLineEnd(String context) {
        if (!check(TokenType.NEWLINE) && !check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            error(current(), "expected newline after " + context + ", found " + current().describe());
            skipLine();
        }
    }

    private void unclosed(Token keyword, Token name) {
        error(keyword, "unbalanced braces: " + keyword.text() + " '" + name.text() + "' opened at line "
                + keyword.line() + " is never closed");
    }

    // Token helpers

    private boolean isBlockStart() {
        Token t = current();
        return t.is(TokenType.IDENT)
                && BLOCK_KEYWORDS.contains(t.text())
                && peekIs(TokenType.IDENT)
                && peekAt(2).is(TokenType.LBRACE);
    }

    private Token current() {
        return peekAt(0);
    }

    private boolean peekIs(TokenType type) {
        return peekAt(1).is(type);
    }

    private Token peekAt(int offset) {
        int i = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private boolean check(TokenType type) {
        return current().is(type);
    }

    private Token advance() {
        Token t = current();
        if (index < tokens.size() - 1) {
            index++;
        }
        return t;
    }

    private Token expect(TokenType type, String what) {
        if (check(type)) {
            return advance();
        }
        error(current(), "expected " + what + ", found " + current().describe());
        return null;
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private void error(Token at, String message) {
        errors.add(new SyntaxError(message, at.line(), at.column(), lines.get(at.line())));
    }

    private static <T> void addIfPresent(List<T> target, T value) {
        if (value != null) {
            target.add(value);
        }
    }
}
