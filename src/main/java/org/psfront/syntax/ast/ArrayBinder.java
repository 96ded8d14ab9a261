package org.psfront.syntax.ast;

import java.util.List;

/**
 * Array pattern: [a, b, c]
 */
public record ArrayBinder(List<Binder> elements) implements Binder {
    public ArrayBinder {
        elements = List.copyOf(elements);
    }
}
