package org.psfront.syntax.ast;

/**
 * As-pattern: name@binder
 */
public record NamedBinder(
        String name,
        Binder binder) implements Binder {
}
