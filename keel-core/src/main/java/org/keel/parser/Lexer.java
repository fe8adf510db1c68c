package org.keel.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns declaration text into tokens. Newlines are significant and emitted as tokens;
 * line and block comments are dropped.
 */
public class Lexer {

    private final String input;
    private final SourceLines lines;
    private final List<SyntaxError> errors = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
        this.lines = new SourceLines(this.input);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public List<SyntaxError> getErrors() {
        return List.copyOf(errors);
    }

    private Token nextToken() {
        skipWhitespaceAndComments();
        if (pos >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        int startLine = line;
        int startColumn = column;
        char c = input.charAt(pos);

        switch (c) {
            case '\n':
                advance();
                return new Token(TokenType.NEWLINE, "\n", startLine, startColumn);
            case '@':
                advance();
                if (peek() == '@') {
                    advance();
                    return new Token(TokenType.AT_AT, "@@", startLine, startColumn);
                }
                return new Token(TokenType.AT, "@", startLine, startColumn);
            case '(':
                return single(TokenType.LPAREN, startLine, startColumn);
            case ')':
                return single(TokenType.RPAREN, startLine, startColumn);
            case '{':
                return single(TokenType.LBRACE, startLine, startColumn);
            case '}':
                return single(TokenType.RBRACE, startLine, startColumn);
            case '[':
                return single(TokenType.LBRACKET, startLine, startColumn);
            case ']':
                return single(TokenType.RBRACKET, startLine, startColumn);
            case '=':
                return single(TokenType.EQUALS, startLine, startColumn);
            case ':':
                return single(TokenType.COLON, startLine, startColumn);
            case '?':
                return single(TokenType.QUESTION, startLine, startColumn);
            case ',':
                return single(TokenType.COMMA, startLine, startColumn);
            case '.':
                return single(TokenType.DOT, startLine, startColumn);
            case '"':
                return readString(startLine, startColumn);
            default:
                break;
        }

        if (Character.isDigit(c) || (c == '-' && Character.isDigit(peekAhead(1)))) {
            return readNumber(startLine, startColumn);
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier(startLine, startColumn);
        }

        advance();
        errors.add(new SyntaxError("unexpected character '" + c + "'", startLine, startColumn, lines.get(startLine)));
        return new Token(TokenType.ILLEGAL, String.valueOf(c), startLine, startColumn);
    }

    private Token single(TokenType type, int startLine, int startColumn) {
        String text = String.valueOf(input.charAt(pos));
        advance();
        return new Token(type, text, startLine, startColumn);
    }

    private Token readString(int startLine, int startColumn) {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                advance();
                return new Token(TokenType.STRING, sb.toString(), startLine, startColumn);
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                advance();
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
                advance();
                continue;
            }
            sb.append(c);
            advance();
        }
        errors.add(new SyntaxError("unterminated string literal", startLine, startColumn, lines.get(startLine)));
        return new Token(TokenType.STRING, sb.toString(), startLine, startColumn);
    }

    private Token readNumber(int startLine, int startColumn) {
        int start = pos;
        if (input.charAt(pos) == '-') {
            advance();
        }
        while (Character.isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && Character.isDigit(peekAhead(1))) {
            advance();
            while (Character.isDigit(peek())) {
                advance();
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), startLine, startColumn);
    }

    private Token readIdentifier(int startLine, int startColumn) {
        int start = pos;
        while (Character.isLetterOrDigit(peek()) || peek() == '_') {
            advance();
        }
        return new Token(TokenType.IDENT, input.substring(start, pos), startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                advance();
            } else if (c == '/' && peekAhead(1) == '/') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAhead(1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                boolean closed = false;
                while (pos < input.length()) {
                    if (input.charAt(pos) == '*' && peekAhead(1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    errors.add(new SyntaxError("unterminated block comment", startLine, startColumn, lines.get(startLine)));
                }
            } else {
                return;
            }
        }
    }

    private char peek() {
        return peekAhead(0);
    }

    private char peekAhead(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private void advance() {
        if (pos >= input.length()) {
            return;
        }
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
