package org.psfront.syntax.ast;

/**
 * An element of a do block.
 *
 * DoNotationElement
 * ├── DoNotationBind   binder <- value
 * ├── DoNotationLet    let binder = value
 * └── DoNotationValue  value
 */
public sealed interface DoNotationElement
        permits DoNotationBind, DoNotationLet, DoNotationValue {
}
