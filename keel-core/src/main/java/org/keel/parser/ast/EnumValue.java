package org.keel.parser.ast;

import java.util.List;

public record EnumValue(String name, List<Attribute> attributes, int line) {

    public EnumValue {
        attributes = List.copyOf(attributes);
    }
}
