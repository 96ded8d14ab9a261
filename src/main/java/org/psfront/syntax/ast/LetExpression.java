package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Let expression: let binding = value in body
 */
public record LetExpression(
        LetBinding binding,
        Value value,
        Value body) implements Value {

    public LetExpression {
        Objects.requireNonNull(binding, "Binding cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
    }
}
