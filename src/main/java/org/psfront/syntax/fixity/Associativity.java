package org.psfront.syntax.fixity;

/**
 * Associativity of an infix operator, as declared by infixl, infixr or infix.
 */
public enum Associativity {
    LEFT,
    RIGHT,
    NONE
}
