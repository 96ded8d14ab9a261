package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Represents a single-argument lambda abstraction.
 *
 * Example: \x -> x
 *          \x y -> x   is  \x -> \y -> x
 *
 * @param argument The bound name or pattern
 * @param body     The lambda body expression
 */
public record LambdaExpression(
        Argument argument,
        Value body) implements Value {

    public LambdaExpression {
        Objects.requireNonNull(argument, "Argument cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
    }

    /**
     * Nests one lambda per argument, the first argument outermost.
     */
    public static Value curried(List<Argument> arguments, Value body) {
        Value result = body;
        for (int i = arguments.size() - 1; i >= 0; i--) {
            result = new LambdaExpression(arguments.get(i), result);
        }
        return result;
    }
}
