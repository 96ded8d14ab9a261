package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Sealed interface representing pattern binders.
 *
 * Used in lambda arguments, case alternatives, let bindings and do binds.
 */
public sealed interface Binder
        permits NullBinder, StringBinder, BooleanBinder, NumberBinder, VarBinder, NamedBinder,
        ConstructorBinder, ObjectBinder, ArrayBinder, ConsBinder {

    static Binder var(String name) {
        return new VarBinder(name);
    }

    static Binder constructor(String dotted, Binder... arguments) {
        return new ConstructorBinder(QualifiedName.parse(dotted), List.of(arguments));
    }

    static Binder cons(Binder head, Binder tail) {
        return new ConsBinder(Objects.requireNonNull(head), Objects.requireNonNull(tail));
    }
}
