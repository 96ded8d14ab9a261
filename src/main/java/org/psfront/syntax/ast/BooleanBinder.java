package org.psfront.syntax.ast;

public record BooleanBinder(boolean value) implements Binder {
}
