package org.keel.parser.ast;

/**
 * Attribute or function argument. {@code name} is null for positional arguments.
 */
public record Argument(String name, ArgumentValue value) {

    public static Argument positional(ArgumentValue value) {
        return new Argument(null, value);
    }

    public static Argument named(String name, ArgumentValue value) {
        return new Argument(name, value);
    }

    public boolean isNamed() {
        return name != null;
    }

    public String render() {
        return isNamed() ? name + ": " + value.render() : value.render();
    }
}
