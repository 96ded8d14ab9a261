package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * A named field in an object literal ({@code name: value}) or record update
 * ({@code name = value}).
 */
public record PropertyValue(
        String name,
        Value value) {

    public PropertyValue {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
