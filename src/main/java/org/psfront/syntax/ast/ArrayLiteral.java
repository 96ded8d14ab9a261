package org.psfront.syntax.ast;

import java.util.List;

/**
 * Array literal: [expr1, expr2, ...]
 */
public record ArrayLiteral(List<Value> elements) implements Value {
    public ArrayLiteral {
        elements = List.copyOf(elements);
    }
}
