package org.psfront.syntax.types;

/**
 * Function type: a -> b (right-associative)
 */
public record FunctionType(
        Type argument,
        Type result) implements Type {
}
