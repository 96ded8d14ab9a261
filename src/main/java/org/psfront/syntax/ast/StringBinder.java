package org.psfront.syntax.ast;

public record StringBinder(String value) implements Binder {
}
