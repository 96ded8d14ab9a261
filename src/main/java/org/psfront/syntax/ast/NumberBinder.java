package org.psfront.syntax.ast;

/**
 * Numeric literal pattern; the value is a BigInteger or BigDecimal as in
 * {@link NumericLiteral}.
 */
public record NumberBinder(Number value) implements Binder {
}
