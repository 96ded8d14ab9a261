package org.psfront.syntax.types;

/**
 * Sealed interface for the types written after {@code ::} in a type ascription.
 */
public sealed interface Type
        permits TypeVar, TypeConstructor, TypeApp, FunctionType, ArrayType, ObjectType, ForAll {
}
