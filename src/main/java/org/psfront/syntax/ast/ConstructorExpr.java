package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Data constructor reference: Just, Data.Maybe.Nothing
 */
public record ConstructorExpr(QualifiedName name) implements Value {
    public ConstructorExpr {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    public static ConstructorExpr of(String dotted) {
        return new ConstructorExpr(QualifiedName.parse(dotted));
    }
}
