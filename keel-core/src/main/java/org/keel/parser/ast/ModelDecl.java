package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;

public record ModelDecl(String name, List<FieldDecl> fields, List<Attribute> attributes, int line) {

    public ModelDecl {
        fields = List.copyOf(fields);
        attributes = List.copyOf(attributes);
    }

    public Optional<FieldDecl> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public List<Attribute> attributes(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).toList();
    }

    public Optional<Attribute> attribute(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    public boolean hasAttribute(String attributeName) {
        return attribute(attributeName).isPresent();
    }
}
