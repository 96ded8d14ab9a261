package org.psfront.syntax.ast;

import java.util.Objects;

/**
 * Case alternative guard: | condition
 */
public record Guard(Value condition) {
    public Guard {
        Objects.requireNonNull(condition, "Condition cannot be null");
    }
}
