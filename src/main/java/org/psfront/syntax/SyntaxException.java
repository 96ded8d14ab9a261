package org.psfront.syntax;

import java.util.Objects;

/**
 * Exception thrown when lexing or parsing fails.
 * Always carries the source location of the offending token and the name of
 * the production that was being attempted.
 */
public class SyntaxException extends RuntimeException {

    private final ParseErrorKind kind;
    private final String label;
    private final int line;
    private final int column;
    private final int offset;

    public SyntaxException(ParseErrorKind kind, String label, String message, int line, int column, int offset) {
        super("line " + line + ":" + column + " " + message + " (" + label + ")");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.label = Objects.requireNonNull(label, "Label cannot be null");
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public SyntaxException(ParseErrorKind kind, String label, String message, Token at, int offset) {
        this(kind, label, message, at.line(), at.column(), offset);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * The production being attempted, e.g. "expression", "binder", "case alternative".
     */
    public String getLabel() {
        return label;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Index of the offending token in the token stream; the lexer reports the
     * character offset instead.
     */
    public int getOffset() {
        return offset;
    }

    boolean reachesFurtherThan(SyntaxException other) {
        if (other == null) {
            return true;
        }
        if (offset != other.offset) {
            return offset > other.offset;
        }
        return kind.isMoreSpecificThan(other.kind);
    }
}
