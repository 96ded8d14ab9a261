package org.psfront.syntax;

/**
 * A token produced by the {@link Lexer}.
 *
 * @param type     The token type
 * @param value    The token text (decoded for string literals)
 * @param position The character offset in the source string
 * @param line     1-based source line
 * @param column   1-based source column, tabs expanded
 */
public record Token(TokenType type, String value, int position, int line, int column) {

    public enum TokenType {
        // Names and literals
        IDENTIFIER, // map, x, foo'
        PROPER_NAME, // Just, Data.Maybe.Just
        STRING_LITERAL, // "hi"
        INTEGER_LITERAL, // 42
        FLOAT_LITERAL, // 3.14, 1e10
        OPERATOR, // +, <>, >>=

        // Keywords
        TRUE,
        FALSE,
        CASE,
        OF,
        IF,
        THEN,
        ELSE,
        DO,
        LET,
        IN,
        FORALL,
        RESERVED, // data, type, where, ...

        // Reserved operators
        BACKSLASH, // \
        ARROW, // ->
        LEFT_ARROW, // <-
        DOUBLE_COLON, // ::
        EQUALS, // =
        PIPE, // |
        DOT, // .
        COLON, // :
        AT, // @
        UNDERSCORE, // _

        // Delimiters
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        COMMA,
        SEMICOLON,
        BACKTICK,

        EOF,
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + line + ":" + column;
    }
}
