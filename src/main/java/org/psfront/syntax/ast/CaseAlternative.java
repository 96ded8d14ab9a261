package org.psfront.syntax.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One alternative of a case expression: binder | guard -> result
 */
public record CaseAlternative(
        Binder binder,
        Optional<Guard> guard,
        Value result) {

    public CaseAlternative {
        Objects.requireNonNull(binder, "Binder cannot be null");
        Objects.requireNonNull(guard, "Guard cannot be null, use Optional.empty()");
        Objects.requireNonNull(result, "Result cannot be null");
    }
}
