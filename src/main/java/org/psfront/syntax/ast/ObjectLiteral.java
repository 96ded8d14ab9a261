package org.psfront.syntax.ast;

import java.util.List;

/**
 * Object literal: { name: value, ... }
 * Duplicate property names are kept; rejecting them is left to a later phase.
 */
public record ObjectLiteral(List<PropertyValue> properties) implements Value {
    public ObjectLiteral {
        properties = List.copyOf(properties);
    }
}
