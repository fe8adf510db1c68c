package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Value of an attribute argument or config entry. Closed set of variants: consumers either
 * use a {@link Visitor} or the typed accessors.
 */
public sealed interface ArgumentValue permits ArgumentValue.Scalar, ArgumentValue.ListValue, ArgumentValue.FunctionCall {

    <R> R accept(Visitor<R> visitor);

    /**
     * Declaration-style text of this value, e.g. {@code "abc"}, {@code [a, b]}, {@code now()}.
     */
    String render();

    default Optional<String> asString() {
        return Optional.empty();
    }

    default Optional<String> asIdentifier() {
        return Optional.empty();
    }

    default Optional<List<ArgumentValue>> asList() {
        return Optional.empty();
    }

    default Optional<FunctionCall> asFunction() {
        return Optional.empty();
    }

    interface Visitor<R> {
        R visitScalar(Scalar scalar);

        R visitList(ListValue list);

        R visitFunction(FunctionCall call);
    }

    enum ScalarKind { STRING, NUMBER, BOOLEAN, IDENTIFIER }

    record Scalar(ScalarKind kind, String text) implements ArgumentValue {

        public static Scalar string(String text) {
            return new Scalar(ScalarKind.STRING, text);
        }

        public static Scalar number(String text) {
            return new Scalar(ScalarKind.NUMBER, text);
        }

        public static Scalar bool(boolean value) {
            return new Scalar(ScalarKind.BOOLEAN, String.valueOf(value));
        }

        public static Scalar identifier(String text) {
            return new Scalar(ScalarKind.IDENTIFIER, text);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitScalar(this);
        }

        @Override
        public String render() {
            if (kind == ScalarKind.STRING) {
                return quote(text);
            }
            return text;
        }

        @Override
        public Optional<String> asString() {
            return kind == ScalarKind.STRING ? Optional.of(text) : Optional.empty();
        }

        @Override
        public Optional<String> asIdentifier() {
            return kind == ScalarKind.IDENTIFIER ? Optional.of(text) : Optional.empty();
        }

        public static String quote(String raw) {
            return "\"" + raw.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
    }

    record ListValue(List<ArgumentValue> elements) implements ArgumentValue {

        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public String render() {
            return elements.stream().map(ArgumentValue::render).collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public Optional<List<ArgumentValue>> asList() {
            return Optional.of(elements);
        }
    }

    record FunctionCall(String name, List<Argument> arguments) implements ArgumentValue {

        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public String render() {
            return name + arguments.stream().map(Argument::render).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public Optional<FunctionCall> asFunction() {
            return Optional.of(this);
        }

        public Optional<ArgumentValue> namedArgument(String argumentName) {
            return arguments.stream()
                    .filter(a -> argumentName.equals(a.name()))
                    .map(Argument::value)
                    .findFirst();
        }

        public List<ArgumentValue> positionalArguments() {
            return arguments.stream().filter(a -> !a.isNamed()).map(Argument::value).toList();
        }
    }
}
