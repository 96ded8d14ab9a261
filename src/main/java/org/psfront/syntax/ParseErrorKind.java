package org.psfront.syntax;

/**
 * Classification of parse failures.
 */
public enum ParseErrorKind {
    /** A continuation token fails the active column requirement. */
    LAYOUT_VIOLATION,
    /** No alternative matched at a position. */
    UNEXPECTED_TOKEN,
    /** Accessor applied directly to a bare constructor reference. */
    INVALID_ACCESSOR_TARGET,
    /** A binder production started but is structurally incomplete. */
    MALFORMED_BINDER,
    /** A value production started but is structurally incomplete. */
    MALFORMED_VALUE;

    boolean isMoreSpecificThan(ParseErrorKind other) {
        return other == UNEXPECTED_TOKEN && this != UNEXPECTED_TOKEN;
    }
}
