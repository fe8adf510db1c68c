package org.keel.parser;

public enum TokenType {
    AT("@"),
    AT_AT("@@"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    EQUALS("="),
    COLON(":"),
    QUESTION("?"),
    COMMA(","),
    DOT("."),
    STRING("string"),
    NUMBER("number"),
    IDENT("identifier"),
    NEWLINE("newline"),
    ILLEGAL("illegal character"),
    EOF("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
