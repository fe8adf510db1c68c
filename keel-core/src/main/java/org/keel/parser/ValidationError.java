package org.keel.parser;

/**
 * One semantic problem found after parsing. {@code line} is 0 when unknown.
 */
public record ValidationError(String message, int line) {

    @Override
    public String toString() {
        return line > 0 ? "line " + line + ": " + message : message;
    }
}
