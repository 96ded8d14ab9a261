package org.psfront.syntax.ast;

/**
 * Cons pattern: head : tail (right-associative)
 */
public record ConsBinder(
        Binder head,
        Binder tail) implements Binder {
}
