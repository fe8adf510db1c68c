package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A {@code datasource} or {@code generator} block made of {@code name = value} entries.
 */
public record ConfigBlock(Kind kind, String name, List<ConfigEntry> entries, int line) {

    public enum Kind { DATASOURCE, GENERATOR }

    public ConfigBlock {
        entries = List.copyOf(entries);
    }

    public Optional<ArgumentValue> entry(String key) {
        return entries.stream()
                .filter(e -> e.name().equals(key))
                .map(ConfigEntry::value)
                .findFirst();
    }
}
