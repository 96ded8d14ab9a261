package org.psfront.syntax.ast;

/**
 * Explicit parentheses, kept so operator chains stay delimited.
 */
public record ParenthesizedExpr(Value value) implements Value {
}
