package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed declaration. Immutable.
 */
public record Schema(List<ConfigBlock> datasources,
                     List<ConfigBlock> generators,
                     List<ModelDecl> models,
                     List<EnumDecl> enums) {

    public Schema {
        datasources = List.copyOf(datasources);
        generators = List.copyOf(generators);
        models = List.copyOf(models);
        enums = List.copyOf(enums);
    }

    public static Schema empty() {
        return new Schema(List.of(), List.of(), List.of(), List.of());
    }

    public Optional<ModelDecl> findModel(String name) {
        return models.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    public Optional<EnumDecl> findEnum(String name) {
        return enums.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    /**
     * Provider of the first datasource block, if declared as a string.
     */
    public Optional<String> datasourceProvider() {
        return datasources.stream()
                .findFirst()
                .flatMap(ds -> ds.entry("provider"))
                .flatMap(ArgumentValue::asString);
    }
}
