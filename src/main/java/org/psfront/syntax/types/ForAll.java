package org.psfront.syntax.types;

import java.util.List;
import java.util.Objects;

/**
 * Universally quantified type: forall a b. body
 */
public record ForAll(
        List<String> variables,
        Type body) implements Type {

    public ForAll {
        variables = List.copyOf(variables);
        Objects.requireNonNull(body, "Body cannot be null");
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("forall needs at least one variable");
        }
    }
}
