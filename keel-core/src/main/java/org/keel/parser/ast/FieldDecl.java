package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;

public record FieldDecl(String name, FieldType type, List<Attribute> attributes, int line) {

    public FieldDecl {
        attributes = List.copyOf(attributes);
    }

    public Optional<Attribute> attribute(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    public boolean hasAttribute(String attributeName) {
        return attribute(attributeName).isPresent();
    }

    /**
     * The {@code @db.*} native type attribute, if any.
     */
    public Optional<Attribute> nativeTypeAttribute() {
        return attributes.stream().filter(Attribute::isNativeType).findFirst();
    }
}
