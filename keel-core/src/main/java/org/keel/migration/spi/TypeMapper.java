package org.keel.migration.spi;

import org.keel.parser.ast.ScalarType;

import java.util.List;
import java.util.Optional;

/**
 * Provider type table: declaration scalars to canonical SQL types and back from catalog
 * spellings.
 */
public interface TypeMapper {

    String map(ScalarType scalar, boolean list);

    /**
     * Resolves a {@code @db.Name(args)} native type, empty when the provider has no such type.
     */
    Optional<String> mapNative(String nativeName, List<String> arguments);

    /**
     * Canonical spelling of a type as the provider's catalog reports it.
     */
    String normalize(String catalogType);

    boolean supportsScalarLists();
}
