package org.psfront.syntax.ast;

/**
 * Wildcard: _
 */
public record NullBinder() implements Binder {
}
