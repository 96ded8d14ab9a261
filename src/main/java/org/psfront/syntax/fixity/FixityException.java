package org.psfront.syntax.fixity;

/**
 * Exception thrown when an operator chain cannot be re-associated, e.g. two
 * non-associative operators of equal precedence side by side.
 */
public class FixityException extends RuntimeException {

    public FixityException(String message) {
        super(message);
    }
}
