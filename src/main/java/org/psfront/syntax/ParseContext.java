package org.psfront.syntax;

import org.eclipse.collections.api.factory.Stacks;
import org.eclipse.collections.api.stack.ImmutableStack;
import org.psfront.syntax.Token.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cursor over a token list shared by the binder, type and value parsers.
 *
 * The parse state is the token index plus an immutable stack of layout
 * reference columns. {@link #snapshot()} captures both and
 * {@link #restore(Snapshot)} puts both back, so a failed alternative leaves
 * no trace. Not thread-safe; one context per parse.
 */
public final class ParseContext {

    /**
     * Parser state at a point in the token stream.
     */
    public record Snapshot(int position, ImmutableStack<Integer> layout) {
    }

    // tokens that may close or continue an enclosing construct after a layout block
    private static final Set<TokenType> CONTINUATION_TOKENS = EnumSet.of(
            TokenType.EOF, TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE, TokenType.COMMA,
            TokenType.SEMICOLON, TokenType.THEN, TokenType.ELSE, TokenType.OF, TokenType.IN,
            TokenType.OPERATOR, TokenType.BACKTICK, TokenType.DOUBLE_COLON, TokenType.ARROW,
            TokenType.PIPE, TokenType.LEFT_ARROW, TokenType.EQUALS, TokenType.DOT, TokenType.COLON);

    private final List<Token> tokens;
    private int position;
    private ImmutableStack<Integer> layout;
    private SyntaxException furthestFailure;

    public ParseContext(List<Token> tokens, ParserOptions options) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
        this.position = 0;
        this.layout = Stacks.immutable.of(options.initialColumn());
    }

    // ==================== Tokens ====================

    public Token peek() {
        return tokens.get(position);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(position + ahead, tokens.size() - 1));
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean checkAhead(int ahead, TokenType type) {
        return peek(ahead).is(type);
    }

    public boolean isAtEnd() {
        return check(TokenType.EOF);
    }

    public Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }

    /**
     * Consumes a token of the given type or fails with UNEXPECTED_TOKEN.
     */
    public Token expect(TokenType type, String label, String message) {
        return expect(type, ParseErrorKind.UNEXPECTED_TOKEN, label, message);
    }

    public Token expect(TokenType type, ParseErrorKind kind, String label, String message) {
        if (check(type)) {
            return advance();
        }
        throw fail(kind, label, message + ", got: " + describe(peek()));
    }

    public int position() {
        return position;
    }

    // ==================== Failures ====================

    /**
     * Creates a failure at the current token and remembers it if it reaches
     * further than any failure seen so far.
     */
    public SyntaxException fail(ParseErrorKind kind, String label, String message) {
        SyntaxException failure = new SyntaxException(kind, label, message, peek(), position);
        if (failure.reachesFurtherThan(furthestFailure)) {
            furthestFailure = failure;
        }
        return failure;
    }

    public SyntaxException unexpected(String label) {
        return fail(ParseErrorKind.UNEXPECTED_TOKEN, label, "Unexpected " + describe(peek()));
    }

    /**
     * The most informative failure for reporting: the one that got furthest
     * into the input, or {@code thrown} when nothing reached past it.
     */
    public SyntaxException reportable(SyntaxException thrown) {
        if (furthestFailure != null && furthestFailure.reachesFurtherThan(thrown)) {
            return furthestFailure;
        }
        return thrown;
    }

    static String describe(Token token) {
        if (token.is(TokenType.EOF)) {
            return "end of input";
        }
        return "'" + token.value() + "'";
    }

    // ==================== Layout ====================

    public int referenceColumn() {
        return layout.peek();
    }

    /**
     * Requires the current token to sit strictly right of the reference column.
     */
    public void indented(String label) {
        Token token = peek();
        if (token.is(TokenType.EOF)) {
            throw unexpected(label);
        }
        if (token.column() <= referenceColumn()) {
            throw fail(ParseErrorKind.LAYOUT_VIOLATION, label,
                    "Expected indentation past column " + referenceColumn() + ", got " + describe(token)
                            + " at column " + token.column());
        }
    }

    /**
     * Requires the current token to start exactly at the reference column.
     */
    public void same(String label) {
        Token token = peek();
        if (token.is(TokenType.EOF)) {
            throw unexpected(label);
        }
        if (token.column() != referenceColumn()) {
            throw fail(ParseErrorKind.LAYOUT_VIOLATION, label,
                    "Expected " + describe(token) + " at column " + referenceColumn() + ", found column "
                            + token.column());
        }
    }

    /**
     * Runs {@code body} with the current token's column as reference column.
     */
    public <T> T mark(Supplier<T> body) {
        return withReferenceColumn(peek().column(), body);
    }

    public <T> T withReferenceColumn(int column, Supplier<T> body) {
        ImmutableStack<Integer> saved = layout;
        layout = layout.push(column);
        try {
            return body.get();
        } finally {
            layout = saved;
        }
    }

    public int layoutDepth() {
        return layout.size();
    }

    /**
     * Called after a layout block whose elements started at {@code blockColumn}.
     * A token on a new line that lands between the enclosing reference column
     * and the block column is an under-indented element, not a continuation of
     * the enclosing expression. Closing delimiters, operators and keywords
     * that continue an enclosing construct may dedent freely.
     */
    public void requireBlockEnd(int blockColumn, String label) {
        Token next = peek();
        if (position == 0 || CONTINUATION_TOKENS.contains(next.type())) {
            return;
        }
        Token previous = tokens.get(position - 1);
        if (next.line() > previous.line() && next.column() < blockColumn && next.column() > referenceColumn()) {
            throw fail(ParseErrorKind.LAYOUT_VIOLATION, label,
                    describe(next) + " at column " + next.column() + " is indented less than the block at column "
                            + blockColumn);
        }
    }

    // ==================== Backtracking ====================

    public Snapshot snapshot() {
        return new Snapshot(position, layout);
    }

    public void restore(Snapshot snapshot) {
        this.position = snapshot.position();
        this.layout = snapshot.layout();
    }

    /**
     * Runs {@code parser}; on failure restores the state and returns empty.
     */
    public <T> Optional<T> attempt(Supplier<T> parser) {
        Snapshot start = snapshot();
        try {
            return Optional.of(parser.get());
        } catch (SyntaxException e) {
            restore(start);
            return Optional.empty();
        }
    }

    /**
     * Ordered choice: the first alternative that succeeds wins. Each failed
     * alternative is rolled back before the next is tried. When all fail, the
     * failure that got furthest is rethrown, or an UNEXPECTED_TOKEN labelled
     * with {@code label} if none got past the starting token.
     */
    @SafeVarargs
    public final <T> T choice(String label, Supplier<? extends T>... alternatives) {
        Snapshot start = snapshot();
        SyntaxException best = null;
        for (Supplier<? extends T> alternative : alternatives) {
            try {
                return alternative.get();
            } catch (SyntaxException e) {
                restore(start);
                if (e.reachesFurtherThan(best)) {
                    best = e;
                }
            }
        }
        if (best == null || (best.getOffset() <= start.position() && best.getKind() == ParseErrorKind.UNEXPECTED_TOKEN)) {
            throw fail(ParseErrorKind.UNEXPECTED_TOKEN, label, "Expected " + label + ", got: " + describe(peek()));
        }
        throw best;
    }

    /**
     * Zero or more repetitions; stops at the first failing attempt, which is
     * rolled back.
     */
    public <T> List<T> many(Supplier<T> parser) {
        List<T> results = new ArrayList<>();
        while (true) {
            int before = position;
            Optional<T> next = attempt(parser);
            if (next.isEmpty()) {
                return results;
            }
            results.add(next.get());
            if (position == before) {
                return results;
            }
        }
    }

    /**
     * Elements of a layout block, each starting at the current token's column.
     * Only the column check is backtracked: an element that starts at the
     * block column and then fails fails the whole block.
     */
    public <T> List<T> layoutBlock(String label, Supplier<T> element) {
        return mark(() -> {
            List<T> results = new ArrayList<>();
            same(label);
            results.add(mark(element));
            while (atReferenceColumn()) {
                results.add(mark(element));
            }
            return results;
        });
    }

    private boolean atReferenceColumn() {
        Token token = peek();
        return !token.is(TokenType.EOF) && token.column() == referenceColumn();
    }

    public <T> List<T> many1(Supplier<T> parser) {
        List<T> results = new ArrayList<>();
        results.add(parser.get());
        results.addAll(many(parser));
        return results;
    }

    /**
     * Zero or more elements separated by {@code separator}. An element is
     * required after every separator.
     */
    public <T> List<T> sepBy(Supplier<T> element, TokenType separator) {
        List<T> results = new ArrayList<>();
        Optional<T> first = attempt(element);
        if (first.isEmpty()) {
            return results;
        }
        results.add(first.get());
        while (check(separator)) {
            advance();
            results.add(element.get());
        }
        return results;
    }

    public <T> List<T> sepBy1(Supplier<T> element, TokenType separator) {
        List<T> results = new ArrayList<>();
        results.add(element.get());
        while (check(separator)) {
            advance();
            results.add(element.get());
        }
        return results;
    }
}
