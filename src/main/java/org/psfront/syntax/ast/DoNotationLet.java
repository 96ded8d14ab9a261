package org.psfront.syntax.ast;

import java.util.Objects;

public record DoNotationLet(
        Binder binder,
        Value value) implements DoNotationElement {

    public DoNotationLet {
        Objects.requireNonNull(binder, "Binder cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
