package org.psfront.syntax.ast;

import java.util.Objects;

public record DoNotationBind(
        Binder binder,
        Value value) implements DoNotationElement {

    public DoNotationBind {
        Objects.requireNonNull(binder, "Binder cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }
}
