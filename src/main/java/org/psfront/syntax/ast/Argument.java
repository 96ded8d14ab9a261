package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * A lambda or let-function argument: either a plain bound name or a pattern.
 */
public sealed interface Argument permits Argument.Named, Argument.Pattern {

    static Argument named(String name) {
        return new Named(name);
    }

    static Argument pattern(Binder binder) {
        return new Pattern(binder);
    }

    record Named(String name) implements Argument {
        public Named {
            Objects.requireNonNull(name, "Name cannot be null");
        }
    }

    record Pattern(Binder binder) implements Argument {
        public Pattern {
            Objects.requireNonNull(binder, "Binder cannot be null");
        }
    }
}
