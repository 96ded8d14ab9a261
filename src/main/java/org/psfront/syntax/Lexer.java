package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexer for the expression language.
 * Converts source text into a list of tokens, each carrying the line and
 * column the layout rules are checked against.
 */
public final class Lexer {

    private static final String OPERATOR_CHARS = ":!#$%&*+./<=>?@\\^|-~";

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("case", TokenType.CASE),
            Map.entry("of", TokenType.OF),
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("do", TokenType.DO),
            Map.entry("let", TokenType.LET),
            Map.entry("in", TokenType.IN),
            Map.entry("forall", TokenType.FORALL),
            Map.entry("data", TokenType.RESERVED),
            Map.entry("type", TokenType.RESERVED),
            Map.entry("foreign", TokenType.RESERVED),
            Map.entry("import", TokenType.RESERVED),
            Map.entry("infixl", TokenType.RESERVED),
            Map.entry("infixr", TokenType.RESERVED),
            Map.entry("infix", TokenType.RESERVED),
            Map.entry("class", TokenType.RESERVED),
            Map.entry("instance", TokenType.RESERVED),
            Map.entry("module", TokenType.RESERVED),
            Map.entry("where", TokenType.RESERVED));

    private static final Map<String, TokenType> RESERVED_OPERATORS = Map.of(
            "\\", TokenType.BACKSLASH,
            "->", TokenType.ARROW,
            "<-", TokenType.LEFT_ARROW,
            "::", TokenType.DOUBLE_COLON,
            "=", TokenType.EQUALS,
            "|", TokenType.PIPE,
            ".", TokenType.DOT,
            ":", TokenType.COLON,
            "@", TokenType.AT);

    private final String input;
    private final int tabWidth;
    private int position;
    private int line;
    private int column;

    public Lexer(String input) {
        this(input, ParserOptions.defaults());
    }

    public Lexer(String input, ParserOptions options) {
        this.input = input;
        this.tabWidth = options.tabWidth();
        this.position = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens, always terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (position >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, null, position, line, column));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '{' && peekChar(1) == '-') {
                skipBlockComment();
            } else if (c == '-' && isLineComment()) {
                while (position < input.length() && input.charAt(position) != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    // A run of two or more dashes not followed by another operator character
    private boolean isLineComment() {
        int end = position;
        while (end < input.length() && input.charAt(end) == '-') {
            end++;
        }
        if (end - position < 2) {
            return false;
        }
        return end >= input.length() || OPERATOR_CHARS.indexOf(input.charAt(end)) < 0;
    }

    private void skipBlockComment() {
        int startLine = line;
        int startColumn = column;
        int depth = 0;
        do {
            if (position >= input.length()) {
                throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "comment",
                        "Unterminated block comment", startLine, startColumn, position);
            }
            if (input.startsWith("{-", position)) {
                depth++;
                advance();
                advance();
            } else if (input.startsWith("-}", position)) {
                depth--;
                advance();
                advance();
            } else {
                advance();
            }
        } while (depth > 0);
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;
        int startLine = line;
        int startColumn = column;

        TokenType delimiter = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            case '`' -> TokenType.BACKTICK;
            default -> null;
        };
        if (delimiter != null) {
            advance();
            return new Token(delimiter, String.valueOf(c), start, startLine, startColumn);
        }

        if (c == '"') {
            return readStringLiteral();
        }

        if (Character.isDigit(c)) {
            return readNumberLiteral();
        }

        if (Character.isUpperCase(c)) {
            return readProperName();
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }

        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            return readOperator();
        }

        throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "token",
                "Unexpected character: '" + c + "'", startLine, startColumn, start);
    }

    private Token readStringLiteral() {
        int start = position;
        int startLine = line;
        int startColumn = column;
        advance(); // opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length() && input.charAt(position) != '"') {
            char c = input.charAt(position);
            if (c == '\n') {
                break;
            }
            if (c == '\\' && position + 1 < input.length()) {
                advance();
                char escaped = input.charAt(position);
                if (escaped == 'u') {
                    sb.append(readUnicodeEscape(startLine, startColumn));
                    continue;
                }
                sb.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    case 'b' -> '\b';
                    case 'f' -> '\f';
                    case '0' -> '\0';
                    case '"', '\'', '\\' -> escaped;
                    default -> throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "string literal",
                            "Unknown escape sequence: \\" + escaped, line, column, position);
                });
            } else {
                sb.append(c);
            }
            advance();
        }

        if (position >= input.length() || input.charAt(position) != '"') {
            throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "string literal",
                    "Unterminated string literal", startLine, startColumn, start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING_LITERAL, sb.toString(), start, startLine, startColumn);
    }

    private char readUnicodeEscape(int startLine, int startColumn) {
        advance(); // u
        if (position + 4 > input.length()) {
            throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "string literal",
                    "Truncated unicode escape", startLine, startColumn, position);
        }
        String hex = input.substring(position, position + 4);
        int decoded = 0;
        for (int i = 0; i < 4; i++) {
            char c = hex.charAt(i);
            int digit = c < 128 ? Character.digit(c, 16) : -1;
            if (digit < 0) {
                throw new SyntaxException(ParseErrorKind.UNEXPECTED_TOKEN, "string literal",
                        "Invalid unicode escape: \\u" + hex, line, column, position);
            }
            decoded = decoded * 16 + digit;
        }
        for (int i = 0; i < 4; i++) {
            advance();
        }
        return (char) decoded;
    }

    private Token readNumberLiteral() {
        int start = position;
        int startLine = line;
        int startColumn = column;
        boolean fractional = false;

        readDigits();
        if (peekChar(0) == '.' && Character.isDigit(peekChar(1))) {
            fractional = true;
            advance();
            readDigits();
        }
        if ((peekChar(0) == 'e' || peekChar(0) == 'E') && startsExponent()) {
            fractional = true;
            advance();
            if (peekChar(0) == '+' || peekChar(0) == '-') {
                advance();
            }
            readDigits();
        }

        return new Token(
                fractional ? TokenType.FLOAT_LITERAL : TokenType.INTEGER_LITERAL,
                input.substring(start, position),
                start, startLine, startColumn);
    }

    private boolean startsExponent() {
        char next = peekChar(1);
        if (next == '+' || next == '-') {
            return Character.isDigit(peekChar(2));
        }
        return Character.isDigit(next);
    }

    private void readDigits() {
        while (position < input.length() && Character.isDigit(input.charAt(position))) {
            advance();
        }
    }

    /**
     * Reads a proper name, joining module segments: {@code Data.Maybe.Just}.
     * Only a dot directly followed by another upper-case segment extends the name.
     */
    private Token readProperName() {
        int start = position;
        int startLine = line;
        int startColumn = column;

        readNameChars();
        while (peekChar(0) == '.' && Character.isUpperCase(peekChar(1))) {
            advance();
            readNameChars();
        }

        return new Token(TokenType.PROPER_NAME, input.substring(start, position), start, startLine, startColumn);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        int startLine = line;
        int startColumn = column;

        readNameChars();
        String value = input.substring(start, position);

        if (value.equals("_")) {
            return new Token(TokenType.UNDERSCORE, value, start, startLine, startColumn);
        }
        TokenType keyword = KEYWORDS.get(value);
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, value, start, startLine, startColumn);
    }

    private void readNameChars() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '\'') {
                advance();
            } else {
                break;
            }
        }
    }

    private Token readOperator() {
        int start = position;
        int startLine = line;
        int startColumn = column;

        while (position < input.length() && OPERATOR_CHARS.indexOf(input.charAt(position)) >= 0) {
            advance();
        }

        String value = input.substring(start, position);
        TokenType type = RESERVED_OPERATORS.getOrDefault(value, TokenType.OPERATOR);
        return new Token(type, value, start, startLine, startColumn);
    }

    private char peekChar(int ahead) {
        int index = position + ahead;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\t') {
            column += tabWidth - ((column - 1) % tabWidth);
        } else {
            column++;
        }
    }
}
