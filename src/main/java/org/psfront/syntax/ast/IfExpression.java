package org.psfront.syntax.ast;

/**
 * Conditional: if cond then a else b
 */
public record IfExpression(
        Value condition,
        Value thenBranch,
        Value elseBranch) implements Value {
}
