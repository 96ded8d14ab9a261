package org.psfront.syntax.ast;

import java.util.List;

/**
 * Do-notation block, elements in source order.
 */
public record DoExpression(List<DoNotationElement> elements) implements Value {
    public DoExpression {
        elements = List.copyOf(elements);
    }
}
