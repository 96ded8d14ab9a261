package org.psfront.syntax.fixity;

import java.util.Objects;

/**
 * Operator fixity: associativity plus precedence from 0 (loosest) to 9 (tightest).
 */
public record Fixity(Associativity associativity, int precedence) {

    public static final int MIN_PRECEDENCE = 0;
    public static final int MAX_PRECEDENCE = 9;

    public Fixity {
        Objects.requireNonNull(associativity, "Associativity cannot be null");
        if (precedence < MIN_PRECEDENCE || precedence > MAX_PRECEDENCE) {
            throw new IllegalArgumentException("Precedence must be between 0 and 9, got: " + precedence);
        }
    }

    public static Fixity infixl(int precedence) {
        return new Fixity(Associativity.LEFT, precedence);
    }

    public static Fixity infixr(int precedence) {
        return new Fixity(Associativity.RIGHT, precedence);
    }

    public static Fixity infix(int precedence) {
        return new Fixity(Associativity.NONE, precedence);
    }
}
