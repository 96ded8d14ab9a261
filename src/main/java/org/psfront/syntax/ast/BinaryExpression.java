package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Binary operator application whose precedence is not yet known: left op right.
 * Re-association happens once fixity declarations are available.
 */
public record BinaryExpression(
        String operator,
        Value left,
        Value right) implements Value {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }
}
