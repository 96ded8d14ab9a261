package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Case expression with a single scrutinee.
 *
 * Example:
 * case n of
 *   0 -> "zero"
 *   x | x > 0 -> "positive"
 */
public record CaseExpression(
        Value scrutinee,
        List<CaseAlternative> alternatives) implements Value {

    public CaseExpression {
        Objects.requireNonNull(scrutinee, "Scrutinee cannot be null");
        alternatives = List.copyOf(alternatives);
    }
}
