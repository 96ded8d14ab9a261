package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Left-hand side of a let expression.
 */
public sealed interface LetBinding permits LetBinding.Function, LetBinding.Destructure {

    /**
     * Named function binding: let f x y = ...
     * A plain let x = ... is a function binding with no arguments.
     */
    record Function(String name, List<Argument> arguments) implements LetBinding {
        public Function {
            Objects.requireNonNull(name, "Name cannot be null");
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Destructuring binding: let Tuple a b = ...
     */
    record Destructure(Binder binder) implements LetBinding {
        public Destructure {
            Objects.requireNonNull(binder, "Binder cannot be null");
        }
    }
}
