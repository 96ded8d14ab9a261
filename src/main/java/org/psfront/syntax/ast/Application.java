package org.psfront.syntax.ast;

/**
 * Function application: f x
 */
public record Application(
        Value function,
        Value argument) implements Value {
}
