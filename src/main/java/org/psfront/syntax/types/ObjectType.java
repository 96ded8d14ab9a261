package org.psfront.syntax.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Object type: { name :: String, age :: Number | r }
 *
 * @param fields  The labelled fields in source order
 * @param rowTail The row variable closing an open row, if any
 */
public record ObjectType(
        List<RowField> fields,
        Optional<String> rowTail) implements Type {

    public ObjectType {
        fields = List.copyOf(fields);
        Objects.requireNonNull(rowTail, "Row tail cannot be null, use Optional.empty()");
    }
}
