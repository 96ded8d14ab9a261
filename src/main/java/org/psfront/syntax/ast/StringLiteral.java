package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * String literal: "hello"
 */
public record StringLiteral(String value) implements Value {
    public StringLiteral {
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
