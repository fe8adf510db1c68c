package org.keel.parser.ast;

import java.util.Optional;

/**
 * Type of a field: base name plus list / optional modifiers. {@code unsupported} holds the raw
 * database type of an {@code Unsupported("...")} field.
 */
public record FieldType(String name, boolean list, boolean optional, String unsupported) {

    public static final String UNSUPPORTED = "Unsupported";

    public static FieldType of(String name, boolean list, boolean optional) {
        return new FieldType(name, list, optional, null);
    }

    public boolean isUnsupported() {
        return unsupported != null;
    }

    public Optional<ScalarType> scalar() {
        return ScalarType.fromName(name);
    }

    @Override
    public String toString() {
        String base = isUnsupported() ? UNSUPPORTED + "(\"" + unsupported + "\")" : name;
        return base + (list ? "[]" : "") + (optional ? "?" : "");
    }
}
