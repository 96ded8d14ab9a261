package org.psfront.syntax.types;

import org.psfront.syntax.ast.QualifiedName;

/**
 * Named type: Number, Data.Maybe.Maybe
 */
public record TypeConstructor(QualifiedName name) implements Type {

    public static TypeConstructor of(String dotted) {
        return new TypeConstructor(QualifiedName.parse(dotted));
    }
}
