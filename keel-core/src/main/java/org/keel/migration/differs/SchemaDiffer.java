package org.keel.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.keel.migration.spi.dialect.Dialect;
import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;
import org.keel.model.naming.CaseNormalizer;
import org.keel.options.EngineOptions;

import java.util.List;
import java.util.Objects;

/**
 * Computes the {@link ChangeSet} turning {@code oldSchema} (usually the live database) into
 * {@code newSchema} (usually the declaration). Differs run in a fixed order; a failing differ
 * is reported as a warning and marks the result incomplete.
 */
@Slf4j
public class SchemaDiffer {
    private final List<Differ> differs;

    public SchemaDiffer(Dialect dialect) {
        this(dialect, EngineOptions.defaults());
    }

    public SchemaDiffer(Dialect dialect, EngineOptions options) {
        this(createDefaultDiffers(dialect.identifierNormalizer(),
                options.getIndexColumnOrder().resolve(dialect.isIndexColumnOrderSignificant())));
    }

    public SchemaDiffer(List<Differ> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * 1. TableDiffer (created / dropped tables)
     * 2. TableModificationDiffer (columns, primary key, indexes, foreign keys)
     */
    private static List<Differ> createDefaultDiffers(CaseNormalizer normalizer, boolean indexColumnOrderSignificant) {
        return List.of(
                new TableDiffer(normalizer),
                new TableModificationDiffer(normalizer, indexColumnOrderSignificant)
        );
    }

    public ChangeSet diff(SchemaModel oldSchema, SchemaModel newSchema) {
        Objects.requireNonNull(oldSchema, "oldSchema must not be null");
        Objects.requireNonNull(newSchema, "newSchema must not be null");

        ChangeSet result = ChangeSet.builder().build();
        for (Differ differ : differs) {
            executeDifferSafely(differ, oldSchema, newSchema, result);
        }
        log.debug("Diff: {} created, {} altered, {} dropped, {} index-only",
                result.getCreatedTables().size(), result.getAlteredTables().size(),
                result.getDroppedTables().size(), result.getIndexChanges().size());
        return result;
    }

    private void executeDifferSafely(Differ differ, SchemaModel oldSchema, SchemaModel newSchema, ChangeSet result) {
        try {
            differ.diff(oldSchema, newSchema, result);
        } catch (Exception e) {
            log.warn("Differ {} failed", differ.getClass().getSimpleName(), e);
            result.getFailedDiffers().add(differ.getClass().getSimpleName());
            result.getWarnings().add(String.format(
                    "Differ failed: %s (%s: %s)",
                    differ.getClass().getSimpleName(),
                    e.getClass().getSimpleName(),
                    e.getMessage()
            ));
        }
    }
}
