package org.keel.parser.ast;

public record ConfigEntry(String name, ArgumentValue value, int line) {
}
