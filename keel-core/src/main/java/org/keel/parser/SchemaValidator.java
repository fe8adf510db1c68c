package org.keel.parser;

import org.keel.exception.SchemaValidationException;
import org.keel.parser.ast.ArgumentValue;
import org.keel.parser.ast.Attribute;
import org.keel.parser.ast.ConfigBlock;
import org.keel.parser.ast.EnumDecl;
import org.keel.parser.ast.EnumValue;
import org.keel.parser.ast.FieldDecl;
import org.keel.parser.ast.ModelDecl;
import org.keel.parser.ast.ScalarType;
import org.keel.parser.ast.Schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Semantic checks on a parsed declaration: references, duplicates, relation arguments.
 * Problems are reported, never corrected.
 */
public class SchemaValidator {

    public static final Set<String> PROVIDERS = Set.of("postgresql", "mysql", "sqlite");
    public static final Set<String> REFERENTIAL_ACTIONS = Set.of("Cascade", "Restrict", "NoAction", "SetNull", "SetDefault");

    private static final Set<String> FIELD_ATTRIBUTES = Set.of("id", "unique", "default", "relation", "map", "updatedAt", "ignore");
    private static final Set<String> BLOCK_ATTRIBUTES = Set.of("id", "unique", "index", "map", "ignore");

    public List<ValidationError> validate(Schema schema) {
        List<ValidationError> errors = new ArrayList<>();
        validateDatasources(schema, errors);
        validateGenerators(schema, errors);
        validateNames(schema, errors);

        String provider = schema.datasourceProvider().orElse(null);
        for (ModelDecl model : schema.models()) {
            validateModel(schema, model, provider, errors);
        }
        for (EnumDecl enumDecl : schema.enums()) {
            validateEnum(enumDecl, errors);
        }
        return errors;
    }

    public Schema validateOrThrow(Schema schema) {
        List<ValidationError> errors = validate(schema);
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(errors);
        }
        return schema;
    }

    private void validateDatasources(Schema schema, List<ValidationError> errors) {
        if (schema.datasources().isEmpty()) {
            errors.add(new ValidationError("a datasource block is required", 0));
            return;
        }
        if (schema.datasources().size() > 1) {
            errors.add(new ValidationError("only one datasource block is allowed, found "
                    + schema.datasources().size(), schema.datasources().get(1).line()));
        }
        ConfigBlock datasource = schema.datasources().get(0);
        Optional<ArgumentValue> provider = datasource.entry("provider");
        if (provider.isEmpty()) {
            errors.add(new ValidationError("datasource '" + datasource.name() + "' is missing 'provider'", datasource.line()));
        } else if (provider.get().asString().filter(PROVIDERS::contains).isEmpty()) {
            errors.add(new ValidationError("datasource provider " + provider.get().render()
                    + " is not supported; expected one of " + new TreeSet<>(PROVIDERS), datasource.line()));
        }
    }

    private void validateGenerators(Schema schema, List<ValidationError> errors) {
        for (ConfigBlock generator : schema.generators()) {
            if (generator.entry("provider").isEmpty()) {
                errors.add(new ValidationError("generator '" + generator.name() + "' is missing 'provider'", generator.line()));
            }
        }
    }

    private void validateNames(Schema schema, List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        for (ModelDecl model : schema.models()) {
            if (ScalarType.isScalar(model.name())) {
                errors.add(new ValidationError("model name '" + model.name() + "' is a reserved scalar type", model.line()));
            }
            if (!seen.add(model.name())) {
                errors.add(new ValidationError("duplicate model '" + model.name() + "'", model.line()));
            }
        }
        for (EnumDecl enumDecl : schema.enums()) {
            if (!seen.add(enumDecl.name())) {
                errors.add(new ValidationError("'" + enumDecl.name() + "' is already defined as a model or enum", enumDecl.line()));
            }
        }
    }

    private void validateModel(Schema schema, ModelDecl model, String provider, List<ValidationError> errors) {
        Set<String> fieldNames = new HashSet<>();
        for (FieldDecl field : model.fields()) {
            if (!fieldNames.add(field.name())) {
                errors.add(new ValidationError("duplicate field '" + field.name() + "' in model '" + model.name() + "'", field.line()));
            }
            validateField(schema, model, field, provider, errors);
        }

        for (Attribute attribute : model.attributes()) {
            if (!BLOCK_ATTRIBUTES.contains(attribute.name())) {
                errors.add(new ValidationError("unknown attribute " + attribute + " on model '" + model.name() + "'", attribute.line()));
                continue;
            }
            switch (attribute.name()) {
                case "id", "unique", "index" -> validateFieldList(schema, model, attribute, errors);
                case "map" -> requireStringArgument(attribute, model.name(), errors);
                default -> { }
            }
        }

        boolean ignored = model.hasAttribute("ignore");
        boolean hasCriterion = model.hasAttribute("id") || model.hasAttribute("unique")
                || model.fields().stream().anyMatch(f -> f.hasAttribute("id") || f.hasAttribute("unique"));
        if (!ignored && !hasCriterion) {
            errors.add(new ValidationError("model '" + model.name()
                    + "' needs a unique criterion (@id, @@id, @unique or @@unique)", model.line()));
        }
        long fieldIds = model.fields().stream().filter(f -> f.hasAttribute("id")).count();
        if (fieldIds > 1 || (fieldIds == 1 && model.hasAttribute("id"))) {
            errors.add(new ValidationError("model '" + model.name() + "' declares more than one primary key", model.line()));
        }
    }

    private void validateField(Schema schema, ModelDecl model, FieldDecl field, String provider, List<ValidationError> errors) {
        String typeName = field.type().name();
        boolean scalar = ScalarType.isScalar(typeName);
        boolean enumType = schema.findEnum(typeName).isPresent();
        Optional<ModelDecl> target = schema.findModel(typeName);

        if (!scalar && !enumType && target.isEmpty() && !field.type().isUnsupported()) {
            errors.add(new ValidationError("type '" + typeName + "' of field '" + model.name() + "." + field.name()
                    + "' is neither a built-in scalar nor a declared model or enum", field.line()));
        }
        if ((scalar || enumType) && field.type().list() && provider != null && !"postgresql".equals(provider)) {
            errors.add(new ValidationError("scalar list field '" + model.name() + "." + field.name()
                    + "' is only supported on postgresql", field.line()));
        }
        if (field.type().list() && field.type().optional()) {
            errors.add(new ValidationError("list field '" + model.name() + "." + field.name() + "' cannot be optional", field.line()));
        }

        for (Attribute attribute : field.attributes()) {
            if (!attribute.isNativeType() && !FIELD_ATTRIBUTES.contains(attribute.name())) {
                errors.add(new ValidationError("unknown attribute " + attribute + " on field '" + model.name() + "."
                        + field.name() + "'", attribute.line()));
            }
            if (attribute.name().equals("default")) {
                validateDefault(schema, model, field, attribute, errors);
            }
            if (attribute.name().equals("map")) {
                requireStringArgument(attribute, model.name() + "." + field.name(), errors);
            }
        }

        if (target.isPresent()) {
            validateRelation(model, field, target.get(), errors);
        } else if (field.hasAttribute("relation")) {
            errors.add(new ValidationError("@relation is only allowed on relation fields, '" + model.name() + "."
                    + field.name() + "' is " + typeName, field.line()));
        }
    }

    private void validateDefault(Schema schema, ModelDecl model, FieldDecl field, Attribute attribute, List<ValidationError> errors) {
        if (attribute.arguments().size() != 1) {
            errors.add(new ValidationError("@default on '" + model.name() + "." + field.name()
                    + "' takes exactly one value, found " + attribute.arguments().size(), attribute.line()));
            return;
        }
        Optional<String> identifier = attribute.arguments().get(0).value().asIdentifier();
        Optional<EnumDecl> enumDecl = schema.findEnum(field.type().name());
        if (identifier.isPresent() && enumDecl.isPresent() && !enumDecl.get().hasValue(identifier.get())) {
            errors.add(new ValidationError("default value '" + identifier.get() + "' is not a value of enum '"
                    + enumDecl.get().name() + "'", attribute.line()));
        }
    }

    private void validateRelation(ModelDecl model, FieldDecl field, ModelDecl target, List<ValidationError> errors) {
        String where = model.name() + "." + field.name();
        Optional<Attribute> relation = field.attribute("relation");
        Optional<ArgumentValue> fields = relation.flatMap(r -> r.namedArgument("fields"));
        Optional<ArgumentValue> references = relation.flatMap(r -> r.namedArgument("references"));

        if (fields.isEmpty() && references.isEmpty()) {
            if (!field.type().list() && !hasBackReferenceWithFields(model, field, target)) {
                errors.add(new ValidationError("relation field '" + where
                        + "' must specify fields and references on one side of the relation", field.line()));
            }
            validateActions(relation, where, errors);
            return;
        }
        if (field.type().list()) {
            errors.add(new ValidationError("list relation field '" + where + "' cannot define fields and references", field.line()));
            return;
        }
        if (fields.isEmpty() || references.isEmpty()) {
            errors.add(new ValidationError("@relation on '" + where + "' needs both fields and references", field.line()));
            return;
        }

        List<String> fieldNames = identifiers(fields.get());
        List<String> referenceNames = identifiers(references.get());
        if (fieldNames == null || referenceNames == null) {
            errors.add(new ValidationError("@relation on '" + where + "': fields and references must be lists of field names", field.line()));
            return;
        }
        if (fieldNames.isEmpty() || fieldNames.size() != referenceNames.size()) {
            errors.add(new ValidationError("@relation on '" + where + "': fields " + fieldNames
                    + " and references " + referenceNames + " must have the same non-zero length", field.line()));
        }
        for (String name : fieldNames) {
            Optional<FieldDecl> local = model.field(name);
            if (local.isEmpty() || !ScalarType.isScalar(local.get().type().name())) {
                errors.add(new ValidationError("@relation on '" + where + "' references unknown scalar field '"
                        + name + "' in model '" + model.name() + "'", field.line()));
            }
        }
        for (String name : referenceNames) {
            Optional<FieldDecl> remote = target.field(name);
            if (remote.isEmpty() || !ScalarType.isScalar(remote.get().type().name())) {
                errors.add(new ValidationError("@relation on '" + where + "' references unknown scalar field '"
                        + name + "' in model '" + target.name() + "'", field.line()));
            }
        }
        validateActions(relation, where, errors);
    }

    private void validateActions(Optional<Attribute> relation, String where, List<ValidationError> errors) {
        for (String key : List.of("onDelete", "onUpdate")) {
            relation.flatMap(r -> r.namedArgument(key)).ifPresent(value -> {
                String action = value.asIdentifier().orElse(value.render());
                if (!REFERENTIAL_ACTIONS.contains(action)) {
                    errors.add(new ValidationError("unknown referential action '" + action + "' for " + key
                            + " on '" + where + "'", relation.get().line()));
                }
            });
        }
    }

    private boolean hasBackReferenceWithFields(ModelDecl model, FieldDecl field, ModelDecl target) {
        return target.fields().stream()
                .filter(f -> f != field)
                .filter(f -> f.type().name().equals(model.name()))
                .anyMatch(f -> f.attribute("relation").flatMap(r -> r.namedArgument("fields")).isPresent());
    }

    private void validateFieldList(Schema schema, ModelDecl model, Attribute attribute, List<ValidationError> errors) {
        Optional<ArgumentValue> fields = attribute.argument("fields", 0);
        List<String> names = fields.map(SchemaValidator::indexFieldNames).orElse(null);
        if (names == null || names.isEmpty()) {
            errors.add(new ValidationError(attribute + " on model '" + model.name() + "' needs a list of fields", attribute.line()));
            return;
        }
        for (String name : names) {
            Optional<FieldDecl> field = model.field(name);
            if (field.isEmpty()) {
                errors.add(new ValidationError(attribute + " on model '" + model.name() + "' references unknown field '"
                        + name + "'", attribute.line()));
            } else if (schema.findModel(field.get().type().name()).isPresent() || field.get().type().list()) {
                errors.add(new ValidationError(attribute + " on model '" + model.name() + "' must reference scalar fields, '"
                        + name + "' is not", attribute.line()));
            }
        }
    }

    private void validateEnum(EnumDecl enumDecl, List<ValidationError> errors) {
        if (enumDecl.values().isEmpty()) {
            errors.add(new ValidationError("enum '" + enumDecl.name() + "' has no values", enumDecl.line()));
        }
        Set<String> seen = new HashSet<>();
        for (EnumValue value : enumDecl.values()) {
            if (!seen.add(value.name())) {
                errors.add(new ValidationError("duplicate value '" + value.name() + "' in enum '" + enumDecl.name() + "'", value.line()));
            }
        }
    }

    private void requireStringArgument(Attribute attribute, String where, List<ValidationError> errors) {
        if (attribute.firstArgument().flatMap(ArgumentValue::asString).isEmpty()) {
            errors.add(new ValidationError(attribute + " on '" + where + "' needs a string argument", attribute.line()));
        }
    }

    /**
     * Field names of a plain identifier list, or null when an element is not an identifier.
     */
    static List<String> identifiers(ArgumentValue value) {
        Optional<List<ArgumentValue>> list = value.asList();
        if (list.isEmpty()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (ArgumentValue element : list.get()) {
            Optional<String> name = element.asIdentifier();
            if (name.isEmpty()) {
                return null;
            }
            names.add(name.get());
        }
        return names;
    }

    /**
     * Field names of an index field list; elements may be {@code field}, {@code field(sort: Desc)}
     * or a wrapper such as {@code lower(field)}.
     */
    static List<String> indexFieldNames(ArgumentValue value) {
        Optional<List<ArgumentValue>> list = value.asList();
        if (list.isEmpty()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (ArgumentValue element : list.get()) {
            String name = element.accept(new ArgumentValue.Visitor<String>() {
                @Override
                public String visitScalar(ArgumentValue.Scalar scalar) {
                    return scalar.asIdentifier().orElse(null);
                }

                @Override
                public String visitList(ArgumentValue.ListValue listValue) {
                    return null;
                }

                @Override
                public String visitFunction(ArgumentValue.FunctionCall call) {
                    List<ArgumentValue> positional = call.positionalArguments();
                    if (!positional.isEmpty() && positional.get(0).asIdentifier().isPresent()) {
                        return positional.get(0).asIdentifier().get();
                    }
                    return call.name();
                }
            });
            if (name == null) {
                return null;
            }
            names.add(name);
        }
        return names;
    }
}
