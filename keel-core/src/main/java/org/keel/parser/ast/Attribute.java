package org.keel.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code @name(args)} on a field or {@code @@name(args)} on a block. Names may be dotted
 * ({@code db.VarChar}).
 */
public record Attribute(String name, List<Argument> arguments, boolean blockLevel, int line) {

    public static final String NATIVE_TYPE_PREFIX = "db.";

    public Attribute {
        arguments = List.copyOf(arguments);
    }

    /**
     * Named argument, or the positional argument at {@code position} when no argument carries
     * the name.
     */
    public Optional<ArgumentValue> argument(String argumentName, int position) {
        Optional<ArgumentValue> named = namedArgument(argumentName);
        if (named.isPresent()) {
            return named;
        }
        List<Argument> positional = arguments.stream().filter(a -> !a.isNamed()).toList();
        return position < positional.size() ? Optional.of(positional.get(position).value()) : Optional.empty();
    }

    public Optional<ArgumentValue> namedArgument(String argumentName) {
        return arguments.stream()
                .filter(a -> argumentName.equals(a.name()))
                .map(Argument::value)
                .findFirst();
    }

    public Optional<ArgumentValue> firstArgument() {
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments.get(0).value());
    }

    public boolean isNativeType() {
        return name.startsWith(NATIVE_TYPE_PREFIX);
    }

    public String nativeTypeName() {
        return isNativeType() ? name.substring(NATIVE_TYPE_PREFIX.length()) : name;
    }

    @Override
    public String toString() {
        return (blockLevel ? "@@" : "@") + name;
    }
}
