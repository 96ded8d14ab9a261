package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Variable reference: x, map
 * <p>
 * The parser always produces an unqualified name here. A dotted lower-case
 * segment is read as an accessor, so {@code Data.Map.lookup} is not a
 * qualified variable and {@link QualifiedName#modulePath()} stays empty.
 */
public record VariableExpr(QualifiedName name) implements Value {
    public VariableExpr {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    public static VariableExpr of(String name) {
        return new VariableExpr(QualifiedName.of(name));
    }
}
