package org.psfront.syntax.ast;

import org.psfront.syntax.types.Type;

import java.util.Objects;

/**
 * Type ascription: value :: type
 *
 * @param checked Whether the ascription is checked by the type checker
 */
public record TypedValue(
        boolean checked,
        Type type,
        Value value) implements Value {

    public TypedValue {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
