package org.psfront.syntax.types;

/**
 * Array type: [a]
 */
public record ArrayType(Type element) implements Type {
}
