package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Property access expression: source.propertyName
 * The source is never a bare constructor reference.
 */
public record PropertyAccess(
        Value source,
        String propertyName) implements Value {

    public PropertyAccess {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(propertyName, "Property name cannot be null");
        if (source instanceof ConstructorExpr) {
            throw new IllegalArgumentException("Property access on constructor: " + source);
        }
    }
}
