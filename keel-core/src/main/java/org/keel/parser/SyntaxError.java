package org.keel.parser;

/**
 * One syntax problem, with the offending source line for context.
 */
public record SyntaxError(String message, int line, int column, String sourceLine) {

    @Override
    public String toString() {
        String head = "line " + line + ", column " + column + ": " + message;
        if (sourceLine == null || sourceLine.isBlank()) {
            return head;
        }
        return head + "\n    | " + sourceLine.stripTrailing();
    }
}
