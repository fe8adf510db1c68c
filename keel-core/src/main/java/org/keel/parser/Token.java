package org.keel.parser;

public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isIdent(String word) {
        return type == TokenType.IDENT && text.equals(word);
    }

    /**
     * How the token is shown in "expected X, found Y" messages.
     */
    public String describe() {
        return switch (type) {
            case IDENT -> "'" + text + "'";
            case STRING -> "string \"" + text + "\"";
            case NUMBER -> "number " + text;
            case NEWLINE, EOF -> type.display();
            default -> "'" + text + "'";
        };
    }
}
