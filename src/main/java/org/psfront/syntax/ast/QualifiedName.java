package org.psfront.syntax.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A name optionally prefixed by a module path.
 *
 * Example: Data.Maybe.Just has module path [Data, Maybe] and name Just
 *
 * @param modulePath The module segments, empty for an unqualified name
 * @param name       The unqualified name
 */
public record QualifiedName(List<String> modulePath, String name) {

    public QualifiedName {
        modulePath = List.copyOf(modulePath);
        Objects.requireNonNull(name, "Name cannot be null");
    }

    public static QualifiedName of(String name) {
        return new QualifiedName(List.of(), name);
    }

    /**
     * Splits dotted text such as {@code Data.Maybe.Just} into path and name.
     */
    public static QualifiedName parse(String dotted) {
        List<String> segments = Arrays.asList(dotted.split("\\."));
        return new QualifiedName(segments.subList(0, segments.size() - 1), segments.get(segments.size() - 1));
    }

    public boolean isQualified() {
        return !modulePath.isEmpty();
    }

    @Override
    public String toString() {
        return isQualified() ? String.join(".", modulePath) + "." + name : name;
    }
}
