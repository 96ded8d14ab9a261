package org.psfront.syntax.types;

/**
 * Type variable: a
 */
public record TypeVar(String name) implements Type {
}
