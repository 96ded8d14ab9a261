package org.psfront.syntax.ast;

import java.util.List;

/**
 * Object pattern: { name = binder, ... }
 */
public record ObjectBinder(List<PropertyBinder> properties) implements Binder {
    public ObjectBinder {
        properties = List.copyOf(properties);
    }
}
