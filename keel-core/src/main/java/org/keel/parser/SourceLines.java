package org.keel.parser;

/**
 * Line lookup for error context.
 */
final class SourceLines {

    private final String[] lines;

    SourceLines(String source) {
        this.lines = source.split("\n", -1);
    }

    String get(int line) {
        if (line < 1 || line > lines.length) {
            return null;
        }
        return lines[line - 1].replace("\r", "");
    }
}
