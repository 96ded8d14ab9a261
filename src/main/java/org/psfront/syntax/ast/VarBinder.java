package org.psfront.syntax.ast;

public record VarBinder(String name) implements Binder {
}
