package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;
import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.DoExpression;
import org.psfront.syntax.ast.DoNotationBind;
import org.psfront.syntax.ast.DoNotationElement;
import org.psfront.syntax.ast.DoNotationLet;
import org.psfront.syntax.ast.DoNotationValue;
import org.psfront.syntax.ast.Guard;

import java.util.List;

/**
 * Parses guards and do-notation blocks.
 *
 * A do block is written either with layout:
 * do
 *   x <- m
 *   let y = f x
 *   pure y
 *
 * or with explicit braces: do { x <- m ; let y = f x ; pure y }
 */
public final class DoNotationParser {

    static final String DO_BLOCK = "do block";
    static final String DO_ELEMENT = "do notation element";

    private final ParseContext ctx;
    private final ValueParser values;
    private final BinderParser binders;

    DoNotationParser(ParseContext ctx, ValueParser values, BinderParser binders) {
        this.ctx = ctx;
        this.values = values;
        this.binders = binders;
    }

    /**
     * Parses {@code | condition}.
     */
    public Guard parseGuard() {
        ctx.indented("guard");
        ctx.expect(TokenType.PIPE, "guard", "Expected '|'");
        ctx.indented("guard");
        return new Guard(values.parseValue());
    }

    public DoExpression parseDoBlock() {
        ctx.expect(TokenType.DO, ValueParser.EXPRESSION, "Expected 'do'");
        return new DoExpression(parseDoNotationElements());
    }

    /**
     * Parses the element sequence that follows {@code do}, braced or laid out.
     */
    public List<DoNotationElement> parseDoNotationElements() {
        return ctx.choice(DO_BLOCK,
                this::parseBracedElements,
                this::parseLayoutElements);
    }

    private List<DoNotationElement> parseBracedElements() {
        ctx.expect(TokenType.LBRACE, DO_BLOCK, "Expected '{'");
        List<DoNotationElement> elements = ctx.withReferenceColumn(0,
                () -> ctx.sepBy1(this::parseDoNotationElement, TokenType.SEMICOLON));
        ctx.expect(TokenType.RBRACE, ParseErrorKind.MALFORMED_VALUE, DO_BLOCK, "Expected '}' to close do block");
        return elements;
    }

    private List<DoNotationElement> parseLayoutElements() {
        ctx.indented(DO_BLOCK);
        int blockColumn = ctx.peek().column();
        List<DoNotationElement> elements = ctx.layoutBlock(DO_ELEMENT, this::parseDoNotationElement);
        ctx.requireBlockEnd(blockColumn, DO_ELEMENT);
        return elements;
    }

    /**
     * Bind is tried first, then let, then a bare value.
     */
    public DoNotationElement parseDoNotationElement() {
        return ctx.choice(DO_ELEMENT,
                this::parseBind,
                this::parseLet,
                () -> new DoNotationValue(values.parseValue()));
    }

    private DoNotationElement parseBind() {
        Binder binder = binders.parseBinder();
        ctx.indented(DO_ELEMENT);
        ctx.expect(TokenType.LEFT_ARROW, DO_ELEMENT, "Expected '<-'");
        return new DoNotationBind(binder, values.parseValue());
    }

    private DoNotationElement parseLet() {
        ctx.expect(TokenType.LET, DO_ELEMENT, "Expected 'let'");
        ctx.indented(DO_ELEMENT);
        Binder binder = binders.parseBinder();
        ctx.indented(DO_ELEMENT);
        ctx.expect(TokenType.EQUALS, ParseErrorKind.MALFORMED_VALUE, DO_ELEMENT, "Expected '=' in let element");
        return new DoNotationLet(binder, values.parseValue());
    }
}
