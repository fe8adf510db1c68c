package org.keel.mapping;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.SchemaValidationException;
import org.keel.migration.DatabaseType;
import org.keel.migration.spi.TypeMapper;
import org.keel.migration.spi.dialect.Dialect;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexColumn;
import org.keel.model.IndexModel;
import org.keel.model.ReferentialAction;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;
import org.keel.naming.DefaultNaming;
import org.keel.naming.Naming;
import org.keel.parser.ValidationError;
import org.keel.parser.ast.Argument;
import org.keel.parser.ast.ArgumentValue;
import org.keel.parser.ast.Attribute;
import org.keel.parser.ast.FieldDecl;
import org.keel.parser.ast.ModelDecl;
import org.keel.parser.ast.ScalarType;
import org.keel.parser.ast.Schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the desired {@link SchemaModel} from a validated declaration, using the provider's
 * type table. Relation fields become foreign keys, not columns.
 */
@Slf4j
public class SchemaModelMapper {

    private final Dialect dialect;
    private final TypeMapper typeMapper;
    private final Naming naming;

    public SchemaModelMapper(Dialect dialect) {
        this(dialect, new DefaultNaming(dialect.getMaxIdentifierLength()));
    }

    public SchemaModelMapper(Dialect dialect, Naming naming) {
        this.dialect = dialect;
        this.typeMapper = dialect.getTypeMapper();
        this.naming = naming;
    }

    public SchemaModel map(Schema schema) {
        List<ValidationError> errors = new ArrayList<>();
        SchemaModel model = SchemaModel.empty();
        Map<String, ModelDecl> mapped = new LinkedHashMap<>();
        for (ModelDecl decl : schema.models()) {
            if (decl.hasAttribute("ignore")) {
                log.debug("Skipping ignored model {}", decl.name());
                continue;
            }
            mapped.put(decl.name(), decl);
        }
        for (ModelDecl decl : mapped.values()) {
            model.addTable(mapTable(schema, decl, errors));
        }
        for (ModelDecl decl : mapped.values()) {
            TableModel table = model.getTables().get(tableName(decl));
            addForeignKeys(schema, decl, table, mapped, errors);
        }
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(errors);
        }
        return model;
    }

    public static String tableName(ModelDecl decl) {
        return decl.attribute("map").flatMap(Attribute::firstArgument).flatMap(ArgumentValue::asString).orElse(decl.name());
    }

    public static String columnName(FieldDecl field) {
        return field.attribute("map").flatMap(Attribute::firstArgument).flatMap(ArgumentValue::asString).orElse(field.name());
    }

    private TableModel mapTable(Schema schema, ModelDecl decl, List<ValidationError> errors) {
        String table = tableName(decl);
        TableModel model = TableModel.builder().tableName(table).build();

        for (FieldDecl field : decl.fields()) {
            if (!isColumn(schema, field)) {
                continue;
            }
            ColumnModel column = mapColumn(schema, decl, field, errors);
            model.addColumn(column);
            if (field.hasAttribute("id")) {
                model.getPrimaryKey().add(column.getColumnName());
                field.attribute("id").flatMap(a -> a.namedArgument("map")).flatMap(ArgumentValue::asString)
                        .ifPresent(model::setPrimaryKeyName);
            }
            field.attribute("unique").ifPresent(unique -> model.getIndexes().add(IndexModel.builder()
                    .indexName(explicitName(unique).orElse(naming.uniqueIndexName(table, List.of(column.getColumnName()))))
                    .columns(new ArrayList<>(List.of(IndexColumn.of(column.getColumnName()))))
                    .isUnique(true)
                    .build()));
        }

        for (Attribute attribute : decl.attributes()) {
            switch (attribute.name()) {
                case "id" -> {
                    List<IndexColumn> columns = indexColumns(decl, attribute);
                    for (IndexColumn c : columns) {
                        model.getPrimaryKey().add(c.getColumnName());
                        model.findColumn(c.getColumnName()).ifPresent(col -> {
                            col.setPrimaryKey(true);
                            col.setNullable(false);
                        });
                    }
                    explicitName(attribute).ifPresent(model::setPrimaryKeyName);
                }
                case "unique" -> model.getIndexes().add(blockIndex(decl, table, attribute, true));
                case "index" -> model.getIndexes().add(blockIndex(decl, table, attribute, false));
                default -> {
                }
            }
        }
        return model;
    }

    private boolean isColumn(Schema schema, FieldDecl field) {
        if (field.hasAttribute("ignore")) {
            return false;
        }
        String type = field.type().name();
        return field.type().isUnsupported() || ScalarType.isScalar(type) || schema.findEnum(type).isPresent();
    }

    private ColumnModel mapColumn(Schema schema, ModelDecl decl, FieldDecl field, List<ValidationError> errors) {
        boolean id = field.hasAttribute("id");
        return ColumnModel.builder()
                .columnName(columnName(field))
                .sqlType(sqlType(schema, decl, field, errors))
                .isNullable(field.type().optional() && !id)
                .isPrimaryKey(id)
                .isUnique(field.hasAttribute("unique"))
                .defaultValue(field.attribute("default").flatMap(Attribute::firstArgument).map(SchemaModelMapper::canonicalDefault).orElse(null))
                .build();
    }

    private String sqlType(Schema schema, ModelDecl decl, FieldDecl field, List<ValidationError> errors) {
        if (field.type().isUnsupported()) {
            return field.type().unsupported();
        }
        boolean list = field.type().list();
        if (list && !typeMapper.supportsScalarLists()) {
            errors.add(new ValidationError("scalar list field '" + decl.name() + "." + field.name()
                    + "' is not supported by " + dialect.getDatabaseType().getProviderName(), field.line()));
            return null;
        }
        ScalarType scalar = field.type().scalar().orElse(ScalarType.STRING); // enums are stored as text
        Optional<Attribute> nativeType = field.nativeTypeAttribute();
        if (nativeType.isPresent()) {
            List<String> args = nativeType.get().arguments().stream().map(SchemaModelMapper::argumentText).toList();
            Optional<String> resolved = typeMapper.mapNative(nativeType.get().nativeTypeName(), args);
            if (resolved.isPresent()) {
                return list ? resolved.get() + "[]" : resolved.get();
            }
            if (dialect.getDatabaseType() != DatabaseType.SQLITE) {
                errors.add(new ValidationError("native type @" + nativeType.get().name() + " on '" + decl.name() + "."
                        + field.name() + "' is not known to " + dialect.getDatabaseType().getProviderName(), nativeType.get().line()));
            }
        }
        return typeMapper.map(scalar, list);
    }

    private IndexModel blockIndex(ModelDecl decl, String table, Attribute attribute, boolean unique) {
        List<IndexColumn> columns = indexColumns(decl, attribute);
        List<String> names = columns.stream().map(IndexColumn::getColumnName).toList();
        String name = explicitName(attribute)
                .orElse(unique ? naming.uniqueIndexName(table, names) : naming.indexName(table, names));
        return IndexModel.builder().indexName(name).columns(columns).isUnique(unique).build();
    }

    /**
     * Elements are {@code field}, {@code field(sort: Desc)} or a wrapper such as {@code lower(field)}.
     */
    private List<IndexColumn> indexColumns(ModelDecl decl, Attribute attribute) {
        List<IndexColumn> result = new ArrayList<>();
        List<ArgumentValue> elements = attribute.argument("fields", 0).flatMap(ArgumentValue::asList).orElse(List.of());
        for (ArgumentValue element : elements) {
            IndexColumn column = element.accept(new ArgumentValue.Visitor<IndexColumn>() {
                @Override
                public IndexColumn visitScalar(ArgumentValue.Scalar scalar) {
                    return IndexColumn.of(fieldColumn(decl, scalar.text()));
                }

                @Override
                public IndexColumn visitList(ArgumentValue.ListValue list) {
                    return null;
                }

                @Override
                public IndexColumn visitFunction(ArgumentValue.FunctionCall call) {
                    List<ArgumentValue> positional = call.positionalArguments();
                    IndexColumn c;
                    if (!positional.isEmpty() && positional.get(0).asIdentifier().isPresent()) {
                        c = IndexColumn.of(fieldColumn(decl, positional.get(0).asIdentifier().get()));
                        c.setFunction(call.name());
                    } else {
                        c = IndexColumn.of(fieldColumn(decl, call.name()));
                    }
                    call.namedArgument("sort").flatMap(ArgumentValue::asIdentifier)
                            .filter("Desc"::equals)
                            .ifPresent(s -> c.setSortOrder(IndexColumn.SortOrder.DESC));
                    return c;
                }
            });
            if (column != null) {
                result.add(column);
            }
        }
        return result;
    }

    private static String fieldColumn(ModelDecl decl, String fieldName) {
        return decl.field(fieldName).map(SchemaModelMapper::columnName).orElse(fieldName);
    }

    private void addForeignKeys(Schema schema, ModelDecl decl, TableModel table, Map<String, ModelDecl> mapped,
                                List<ValidationError> errors) {
        for (FieldDecl field : decl.fields()) {
            Optional<ModelDecl> target = schema.findModel(field.type().name());
            Optional<Attribute> relation = field.attribute("relation");
            if (target.isEmpty() || relation.isEmpty() || field.hasAttribute("ignore")) {
                continue;
            }
            Optional<ArgumentValue> fields = relation.get().namedArgument("fields");
            Optional<ArgumentValue> references = relation.get().namedArgument("references");
            if (fields.isEmpty() || references.isEmpty()) {
                continue;
            }
            if (!mapped.containsKey(target.get().name())) {
                log.debug("Skipping relation {}.{} to ignored model {}", decl.name(), field.name(), target.get().name());
                continue;
            }
            List<String> columns = identifiers(fields.get()).stream().map(f -> fieldColumn(decl, f)).toList();
            List<String> referenced = identifiers(references.get()).stream().map(f -> fieldColumn(target.get(), f)).toList();

            boolean optional = columns.stream()
                    .map(table::findColumn)
                    .anyMatch(c -> c.map(ColumnModel::isNullable).orElse(false));
            ReferentialAction onDelete = action(relation.get(), "onDelete", errors)
                    .orElse(optional ? ReferentialAction.SET_NULL : ReferentialAction.RESTRICT);
            ReferentialAction onUpdate = action(relation.get(), "onUpdate", errors).orElse(ReferentialAction.CASCADE);

            table.getForeignKeys().add(ForeignKeyModel.builder()
                    .constraintName(explicitName(relation.get()).orElse(naming.foreignKeyName(table.getTableName(), columns)))
                    .columns(new ArrayList<>(columns))
                    .referencedTable(tableName(target.get()))
                    .referencedColumns(new ArrayList<>(referenced))
                    .onDelete(onDelete)
                    .onUpdate(onUpdate)
                    .build());
        }
    }

    private Optional<ReferentialAction> action(Attribute relation, String key, List<ValidationError> errors) {
        Optional<String> declared = relation.namedArgument(key).flatMap(ArgumentValue::asIdentifier);
        if (declared.isEmpty()) {
            return Optional.empty();
        }
        Optional<ReferentialAction> action = ReferentialAction.fromDeclaredName(declared.get());
        if (action.isEmpty()) {
            errors.add(new ValidationError("unknown referential action '" + declared.get() + "'", relation.line()));
        }
        return action;
    }

    /**
     * {@code map:} wins over {@code name:}; only the physical name matters to the database.
     */
    private static Optional<String> explicitName(Attribute attribute) {
        return attribute.namedArgument("map").or(() -> attribute.namedArgument("name")).flatMap(ArgumentValue::asString);
    }

    private static List<String> identifiers(ArgumentValue value) {
        return value.asList().orElse(List.of()).stream()
                .map(ArgumentValue::asIdentifier)
                .flatMap(Optional::stream)
                .toList();
    }

    private static String argumentText(Argument argument) {
        ArgumentValue value = argument.value();
        return value instanceof ArgumentValue.Scalar scalar ? scalar.text() : value.render();
    }

    /**
     * Canonical default expression of a {@code @default} argument. Enum values become string
     * literals.
     */
    static String canonicalDefault(ArgumentValue value) {
        return value.accept(new ArgumentValue.Visitor<String>() {
            @Override
            public String visitScalar(ArgumentValue.Scalar scalar) {
                return switch (scalar.kind()) {
                    case STRING, IDENTIFIER -> DefaultValues.stringLiteral(scalar.text());
                    case NUMBER -> DefaultValues.number(scalar.text());
                    case BOOLEAN -> scalar.text();
                };
            }

            @Override
            public String visitList(ArgumentValue.ListValue list) {
                // array literal text, e.g. {1,2} or {"a","b"}
                String body = list.elements().stream()
                        .map(e -> e.asString().map(ArgumentValue.Scalar::quote)
                                .orElseGet(() -> e instanceof ArgumentValue.Scalar sc ? sc.text() : e.render()))
                        .collect(Collectors.joining(","));
                return DefaultValues.stringLiteral("{" + body + "}");
            }

            @Override
            public String visitFunction(ArgumentValue.FunctionCall call) {
                if (call.name().equals("dbgenerated")) {
                    String sql = call.positionalArguments().stream().findFirst()
                            .flatMap(ArgumentValue::asString).orElse("");
                    return DefaultValues.dbGenerated(sql);
                }
                return call.render();
            }
        });
    }
}
