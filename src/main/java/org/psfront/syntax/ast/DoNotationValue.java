package org.psfront.syntax.ast;

import java.util.Objects;

public record DoNotationValue(Value value) implements DoNotationElement {
    public DoNotationValue {
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
