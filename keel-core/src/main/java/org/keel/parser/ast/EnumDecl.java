package org.keel.parser.ast;

import java.util.List;

public record EnumDecl(String name, List<EnumValue> values, List<Attribute> attributes, int line) {

    public EnumDecl {
        values = List.copyOf(values);
        attributes = List.copyOf(attributes);
    }

    public boolean hasValue(String valueName) {
        return values.stream().anyMatch(v -> v.name().equals(valueName));
    }
}
