package org.psfront.syntax.types;

/**
 * A labelled field of an object type: name :: type
 */
public record RowField(
        String name,
        Type type) {
}
