package org.keel.migration;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.PostCreateContributor;
import org.keel.migration.contributor.TableBodyContributor;
import org.keel.migration.contributor.create.ColumnContributor;
import org.keel.migration.contributor.create.ForeignKeyContributor;
import org.keel.migration.contributor.create.IndexContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();
    private final List<DdlContributor> post = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect d) {
        this.table = table;
        this.dialect = d;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (c instanceof TableBodyContributor) {
            body.add(c);
        } else if (c instanceof PostCreateContributor) {
            post.add(c);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable()).append('\n');

        post.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }

    /**
     * Columns, primary key, optionally inline foreign keys, then the table's indexes. Single
     * column unique indexes already expressed by an inline {@code UNIQUE} are skipped.
     */
    public CreateTableBuilder defaultsFrom(TableModel model, boolean inlineForeignKeys) {
        var columns = model.getColumnList();

        this.add(new ColumnContributor(model.getPrimaryKey(), columns));
        if (inlineForeignKeys && !model.getForeignKeys().isEmpty()) {
            this.add(new ForeignKeyContributor(model.getForeignKeys()));
        }
        this.add(new IndexContributor(model.getTableName(), standaloneIndexes(model)));

        return this;
    }

    public static List<IndexModel> standaloneIndexes(TableModel model) {
        Set<String> covered = new HashSet<>();
        List<IndexModel> result = new ArrayList<>();
        for (IndexModel idx : model.getIndexes()) {
            String col = idx.getColumns().size() == 1 ? idx.getColumns().get(0).getColumnName() : null;
            boolean inline = col != null
                    && idx.isSingleColumnUniqueOn(col)
                    && model.findColumn(col).map(ColumnModel::isUnique).orElse(false)
                    && covered.add(col);
            if (!inline) {
                result.add(idx);
            }
        }
        return result;
    }
}
