package org.psfront.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Record update: source { name = value, ... }
 */
public record ObjectUpdate(
        Value source,
        List<PropertyValue> updates) implements Value {

    public ObjectUpdate {
        Objects.requireNonNull(source, "Source cannot be null");
        updates = List.copyOf(updates);
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("Record update needs at least one property");
        }
    }
}
