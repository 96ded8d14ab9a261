package org.psfront.syntax.ast;

/**
 * Field pattern inside an object binder: name = binder
 */
public record PropertyBinder(
        String name,
        Binder binder) {
}
