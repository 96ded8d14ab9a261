package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;
import org.psfront.syntax.ast.ArrayBinder;
import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.BooleanBinder;
import org.psfront.syntax.ast.ConsBinder;
import org.psfront.syntax.ast.ConstructorBinder;
import org.psfront.syntax.ast.NamedBinder;
import org.psfront.syntax.ast.NullBinder;
import org.psfront.syntax.ast.NumberBinder;
import org.psfront.syntax.ast.ObjectBinder;
import org.psfront.syntax.ast.PropertyBinder;
import org.psfront.syntax.ast.QualifiedName;
import org.psfront.syntax.ast.StringBinder;
import org.psfront.syntax.ast.VarBinder;

import java.util.List;

/**
 * Recursive descent parser for pattern binders.
 *
 * Binders:
 * _                     wildcard
 * "s", true, 42         literal binders
 * name@binder           as-pattern
 * x                     variable
 * Just x (Tuple a b)    constructor with no-parens arguments
 * { name = binder }     object binder
 * [a, b]                array binder
 * (binder)              parenthesized
 * head : tail           cons, right-associative, lowest precedence
 */
public final class BinderParser {

    static final String BINDER = "binder";

    private final ParseContext ctx;

    public BinderParser(ParseContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Parses a binder including the cons tier.
     */
    public Binder parseBinder() {
        Binder head = parseBinderAtom();
        if (ctx.attempt(this::consOperator).isPresent()) {
            return new ConsBinder(head, parseBinder());
        }
        return head;
    }

    /**
     * Parses a binder as it appears in lambda arguments and let-function
     * arguments: like an atom, but a constructor may only appear bare and
     * nullary unless parenthesized.
     */
    public Binder parseBinderNoParens() {
        return ctx.choice(BINDER,
                this::parseNullBinder,
                this::parseStringBinder,
                this::parseBooleanBinder,
                this::parseNumberBinder,
                this::parseNamedBinder,
                this::parseVarBinder,
                this::parseNullaryConstructorBinder,
                this::parseObjectBinder,
                this::parseArrayBinder,
                this::parseParenthesizedBinder);
    }

    private Binder parseBinderAtom() {
        return ctx.choice(BINDER,
                this::parseNullBinder,
                this::parseStringBinder,
                this::parseBooleanBinder,
                this::parseNumberBinder,
                this::parseNamedBinder,
                this::parseVarBinder,
                this::parseConstructorBinder,
                this::parseObjectBinder,
                this::parseArrayBinder,
                this::parseParenthesizedBinder);
    }

    private Token consOperator() {
        ctx.indented(BINDER);
        return ctx.expect(TokenType.COLON, BINDER, "Expected ':'");
    }

    private Binder parseNullBinder() {
        ctx.expect(TokenType.UNDERSCORE, BINDER, "Expected '_'");
        return new NullBinder();
    }

    private Binder parseStringBinder() {
        return new StringBinder(ctx.expect(TokenType.STRING_LITERAL, BINDER, "Expected string literal").value());
    }

    private Binder parseBooleanBinder() {
        if (ctx.check(TokenType.TRUE)) {
            ctx.advance();
            return new BooleanBinder(true);
        }
        ctx.expect(TokenType.FALSE, BINDER, "Expected boolean literal");
        return new BooleanBinder(false);
    }

    private Binder parseNumberBinder() {
        return new NumberBinder(Literals.number(ctx, BINDER));
    }

    private Binder parseNamedBinder() {
        String name = ctx.expect(TokenType.IDENTIFIER, BINDER, "Expected identifier").value();
        ctx.indented(BINDER);
        ctx.expect(TokenType.AT, BINDER, "Expected '@'");
        ctx.indented(BINDER);
        return new NamedBinder(name, parseBinder());
    }

    private Binder parseVarBinder() {
        return new VarBinder(ctx.expect(TokenType.IDENTIFIER, BINDER, "Expected identifier").value());
    }

    private Binder parseNullaryConstructorBinder() {
        return new ConstructorBinder(constructorName(), List.of());
    }

    private Binder parseConstructorBinder() {
        QualifiedName name = constructorName();
        List<Binder> arguments = ctx.many(() -> {
            ctx.indented(BINDER);
            return parseBinderNoParens();
        });
        return new ConstructorBinder(name, arguments);
    }

    private QualifiedName constructorName() {
        return QualifiedName.parse(ctx.expect(TokenType.PROPER_NAME, BINDER, "Expected constructor").value());
    }

    private Binder parseObjectBinder() {
        ctx.expect(TokenType.LBRACE, BINDER, "Expected '{'");
        List<PropertyBinder> properties = ctx.sepBy(() -> {
            ctx.indented(BINDER);
            return parsePropertyBinder();
        }, TokenType.COMMA);
        ctx.expect(TokenType.RBRACE, ParseErrorKind.MALFORMED_BINDER, "object binder", "Expected '}'");
        return new ObjectBinder(properties);
    }

    private PropertyBinder parsePropertyBinder() {
        String name = ctx.expect(TokenType.IDENTIFIER, BINDER, "Expected property name").value();
        ctx.indented(BINDER);
        ctx.expect(TokenType.EQUALS, ParseErrorKind.MALFORMED_BINDER, "object binder", "Expected '=' after property name");
        ctx.indented(BINDER);
        return new PropertyBinder(name, parseBinder());
    }

    private Binder parseArrayBinder() {
        ctx.expect(TokenType.LBRACKET, BINDER, "Expected '['");
        List<Binder> elements = ctx.sepBy(() -> {
            ctx.indented(BINDER);
            return parseBinder();
        }, TokenType.COMMA);
        ctx.expect(TokenType.RBRACKET, ParseErrorKind.MALFORMED_BINDER, "array binder", "Expected ']'");
        return new ArrayBinder(elements);
    }

    private Binder parseParenthesizedBinder() {
        ctx.expect(TokenType.LPAREN, BINDER, "Expected '('");
        Binder inner = parseBinder();
        ctx.expect(TokenType.RPAREN, ParseErrorKind.MALFORMED_BINDER, BINDER, "Expected ')'");
        return inner;
    }
}
