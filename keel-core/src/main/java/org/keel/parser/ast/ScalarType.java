package org.keel.parser.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in scalar types recognized by name.
 */
public enum ScalarType {
    STRING("String"),
    INT("Int"),
    BIGINT("BigInt"),
    FLOAT("Float"),
    DECIMAL("Decimal"),
    BOOLEAN("Boolean"),
    DATETIME("DateTime"),
    JSON("Json"),
    BYTES("Bytes");

    private final String declaredName;

    ScalarType(String declaredName) {
        this.declaredName = declaredName;
    }

    public String declaredName() {
        return declaredName;
    }

    public static Optional<ScalarType> fromName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.declaredName.equals(name))
                .findFirst();
    }

    public static boolean isScalar(String name) {
        return fromName(name).isPresent();
    }
}
