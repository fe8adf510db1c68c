package org.keel.migration;

import lombok.Getter;
import org.keel.migration.contributor.alter.ColumnModifyContributor;
import org.keel.migration.contributor.alter.TableRedefineContributor;
import org.keel.migration.contributor.create.ColumnAddContributor;
import org.keel.migration.contributor.create.ForeignKeyAddContributor;
import org.keel.migration.contributor.create.ForeignKeyContributor;
import org.keel.migration.contributor.create.IndexAddContributor;
import org.keel.migration.contributor.create.PrimaryKeyAddContributor;
import org.keel.migration.contributor.drop.ColumnDropContributor;
import org.keel.migration.contributor.drop.DropTableStatementContributor;
import org.keel.migration.contributor.drop.ForeignKeyDropContributor;
import org.keel.migration.contributor.drop.IndexDropContributor;
import org.keel.migration.contributor.drop.PrimaryKeyDropContributor;
import org.keel.migration.contributor.create.ColumnContributor;
import org.keel.migration.contributor.create.IndexContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.migration.spi.visitor.TableContentVisitor;
import org.keel.migration.spi.visitor.TableVisitor;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;

import java.util.List;
import java.util.StringJoiner;

/**
 * Collects the statements of one table (content visits) or of whole tables (table visits).
 * Content visits go through a {@link TableStatementBuilder}, so statements come out in
 * contributor priority order regardless of visit order.
 */
public class MigrationVisitor implements TableVisitor, TableContentVisitor {
    private final DdlDialect dialect;
    private final StringJoiner sql = new StringJoiner("\n");
    private final ChangeSet.AlteredTable altered;

    @Getter
    private final TableStatementBuilder alterBuilder;

    /**
     * Visitor for created and dropped tables.
     */
    public MigrationVisitor(DdlDialect dialect) {
        this.dialect = dialect;
        this.altered = null;
        this.alterBuilder = null;
    }

    /**
     * Visitor for the content of one altered table.
     */
    public MigrationVisitor(DdlDialect dialect, ChangeSet.AlteredTable altered) {
        this.dialect = dialect;
        this.altered = altered;
        this.alterBuilder = new TableStatementBuilder(altered.getTableName(), dialect);
    }

    @Override
    public void visitAddedTable(TableModel table) {
        visitAddedTable(table, table.getForeignKeys());
    }

    /**
     * Creates {@code table} with only {@code inlineForeignKeys} in its body; the caller adds
     * the remaining ones once their targets exist.
     */
    public void visitAddedTable(TableModel table, List<ForeignKeyModel> inlineForeignKeys) {
        CreateTableBuilder builder = new CreateTableBuilder(table.getTableName(), dialect)
                .add(new ColumnContributor(table.getPrimaryKey(), table.getColumnList()));
        if (!inlineForeignKeys.isEmpty()) {
            builder.add(new ForeignKeyContributor(inlineForeignKeys));
        }
        builder.add(new IndexContributor(table.getTableName(), CreateTableBuilder.standaloneIndexes(table)));
        sql.add(builder.build());
    }

    @Override
    public void visitDroppedTable(TableModel table) {
        sql.add(new TableStatementBuilder(table.getTableName(), dialect)
                .add(new DropTableStatementContributor(table))
                .build());
    }

    /**
     * Rebuild of the whole table, used instead of the content visits when the provider cannot
     * alter the table in place.
     */
    public void visitRedefinedTable() {
        alterBuilder.add(new TableRedefineContributor(altered));
    }

    public void visitDeferredForeignKey(String table, ForeignKeyModel foreignKey) {
        sql.add(dialect.getAddForeignKeySql(table, foreignKey));
    }

    @Override
    public void visitDroppedForeignKey(ForeignKeyModel foreignKey) {
        alterBuilder.add(new ForeignKeyDropContributor(alterBuilder.getTableName(), foreignKey));
    }

    @Override
    public void visitDroppedIndex(IndexModel index) {
        alterBuilder.add(new IndexDropContributor(alterBuilder.getTableName(), index));
    }

    @Override
    public void visitDroppedPrimaryKey(ChangeSet.PrimaryKeyChange change) {
        alterBuilder.add(new PrimaryKeyDropContributor(altered));
    }

    @Override
    public void visitDroppedColumn(ColumnModel column) {
        alterBuilder.add(new ColumnDropContributor(alterBuilder.getTableName(), column));
    }

    @Override
    public void visitAddedColumn(ColumnModel column) {
        alterBuilder.add(new ColumnAddContributor(alterBuilder.getTableName(), column));
    }

    @Override
    public void visitModifiedColumn(ChangeSet.ColumnChange change) {
        alterBuilder.add(new ColumnModifyContributor(alterBuilder.getTableName(), change));
    }

    @Override
    public void visitAddedPrimaryKey(ChangeSet.PrimaryKeyChange change) {
        alterBuilder.add(new PrimaryKeyAddContributor(alterBuilder.getTableName(), change));
    }

    @Override
    public void visitAddedIndex(IndexModel index) {
        alterBuilder.add(new IndexAddContributor(alterBuilder.getTableName(), index));
    }

    @Override
    public void visitAddedForeignKey(ForeignKeyModel foreignKey) {
        alterBuilder.add(new ForeignKeyAddContributor(alterBuilder.getTableName(), foreignKey));
    }

    @Override
    public String getGeneratedSql() {
        if (alterBuilder != null && !alterBuilder.isEmpty()) {
            String alterSql = alterBuilder.build();
            if (!alterSql.isEmpty()) {
                sql.add(alterSql);
            }
        }
        return sql.toString();
    }
}
