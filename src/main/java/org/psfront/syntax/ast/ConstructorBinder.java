package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Constructor pattern: Just x, Nothing (empty argument list)
 */
public record ConstructorBinder(
        QualifiedName constructor,
        List<Binder> arguments) implements Binder {

    public ConstructorBinder {
        Objects.requireNonNull(constructor, "Constructor cannot be null");
        arguments = List.copyOf(arguments);
    }
}
