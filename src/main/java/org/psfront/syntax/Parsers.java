package org.psfront.syntax;

import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.DoNotationElement;
import org.psfront.syntax.ast.Guard;
import org.psfront.syntax.ast.Value;
import org.psfront.syntax.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Entry points that parse a whole source string into one production.
 *
 * Example:
 * Value v = Parsers.parseValue("\\x -> x.name");
 * Binder b = Parsers.parseBinder("x : xs");
 *
 * Each call lexes the input, parses the production and requires the input to
 * be fully consumed. On failure the furthest-reaching {@link SyntaxException}
 * seen during the attempt is thrown.
 */
public final class Parsers {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parsers.class);

    private Parsers() {
    }

    public static Value parseValue(String source) {
        return parseValue(source, ParserOptions.defaults());
    }

    public static Value parseValue(String source, ParserOptions options) {
        return parse(source, options, ValueParser.EXPRESSION, ValueParser::parseValue);
    }

    public static Binder parseBinder(String source) {
        return parseBinder(source, ParserOptions.defaults());
    }

    public static Binder parseBinder(String source, ParserOptions options) {
        return parse(source, options, BinderParser.BINDER, parser -> parser.binders().parseBinder());
    }

    /**
     * Parses a binder in argument position, where a constructor with
     * arguments must be parenthesized.
     */
    public static Binder parseBinderNoParens(String source) {
        return parse(source, ParserOptions.defaults(), BinderParser.BINDER,
                parser -> parser.binders().parseBinderNoParens());
    }

    public static Guard parseGuard(String source) {
        return parse(source, ParserOptions.defaults(), "guard", parser -> parser.doNotation().parseGuard());
    }

    /**
     * Parses the elements of a do block, without the {@code do} keyword.
     */
    public static List<DoNotationElement> parseDoNotationElements(String source) {
        return parseDoNotationElements(source, ParserOptions.defaults());
    }

    public static List<DoNotationElement> parseDoNotationElements(String source, ParserOptions options) {
        return parse(source, options, DoNotationParser.DO_BLOCK,
                parser -> parser.doNotation().parseDoNotationElements());
    }

    public static Type parseType(String source) {
        return parse(source, ParserOptions.defaults(), TypeParser.TYPE, parser -> parser.types().parsePolyType());
    }

    private static <T> T parse(String source, ParserOptions options, String production,
                               Function<ValueParser, T> parser) {
        List<Token> tokens = new Lexer(source, options).tokenize();
        ParseContext ctx = new ParseContext(tokens, options);
        try {
            T result = parser.apply(new ValueParser(ctx));
            if (!ctx.isAtEnd()) {
                throw ctx.unexpected(production);
            }
            LOGGER.debug("Parsed {} from {} tokens", production, tokens.size());
            return result;
        } catch (SyntaxException e) {
            SyntaxException reported = ctx.reportable(e);
            LOGGER.debug("Failed to parse {}: {}", production, reported.getMessage());
            throw reported;
        }
    }
}
