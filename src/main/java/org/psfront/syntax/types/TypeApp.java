package org.psfront.syntax.types;

/**
 * Type application: Maybe a
 */
public record TypeApp(
        Type function,
        Type argument) implements Type {
}
