package org.psfront.syntax.ast;

/**
 * Boolean literal: true, false
 */
public record BooleanLiteral(boolean value) implements Value {
}
