package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;
import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.Argument;
import org.psfront.syntax.ast.ArrayLiteral;
import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.BooleanLiteral;
import org.psfront.syntax.ast.CaseAlternative;
import org.psfront.syntax.ast.CaseExpression;
import org.psfront.syntax.ast.ConstructorExpr;
import org.psfront.syntax.ast.Guard;
import org.psfront.syntax.ast.IfExpression;
import org.psfront.syntax.ast.LambdaExpression;
import org.psfront.syntax.ast.LetBinding;
import org.psfront.syntax.ast.LetExpression;
import org.psfront.syntax.ast.NumericLiteral;
import org.psfront.syntax.ast.ObjectLiteral;
import org.psfront.syntax.ast.ObjectUpdate;
import org.psfront.syntax.ast.ParenthesizedExpr;
import org.psfront.syntax.ast.PropertyAccess;
import org.psfront.syntax.ast.PropertyValue;
import org.psfront.syntax.ast.QualifiedName;
import org.psfront.syntax.ast.StringLiteral;
import org.psfront.syntax.ast.TypedValue;
import org.psfront.syntax.ast.Value;
import org.psfront.syntax.ast.VariableExpr;

import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser for values.
 *
 * A value is assembled in three tiers around an atom:
 * 1. accessors and record updates:  atom.field, atom { field = value }
 * 2. application and ascription:    f x y, value :: Type
 * 3. user-defined infix operators:  a <> b, x `div` y
 *
 * Infix chains are kept as unresolved {@link BinaryExpression} nodes nested to
 * the right; their real precedence is applied by a later pass.
 */
public final class ValueParser {

    static final String EXPRESSION = "expression";
    static final String CASE_ALTERNATIVE = "case alternative";

    private final ParseContext ctx;
    private final BinderParser binders;
    private final TypeParser types;
    private final DoNotationParser doNotation;

    public ValueParser(ParseContext ctx) {
        this.ctx = ctx;
        this.binders = new BinderParser(ctx);
        this.types = new TypeParser(ctx);
        this.doNotation = new DoNotationParser(ctx, this, binders);
    }

    public BinderParser binders() {
        return binders;
    }

    public TypeParser types() {
        return types;
    }

    public DoNotationParser doNotation() {
        return doNotation;
    }

    /**
     * Parses a complete value: tier 3 over tier 2 over tier 1.
     */
    public Value parseValue() {
        Value left = parseApplications();
        Optional<String> operator = ctx.attempt(this::infixOperator);
        if (operator.isEmpty()) {
            return left;
        }
        return new BinaryExpression(operator.get(), left, parseValue());
    }

    // ==================== Tier 3: infix operators ====================

    private String infixOperator() {
        ctx.indented("operator");
        if (ctx.check(TokenType.OPERATOR)) {
            return ctx.advance().value();
        }
        ctx.expect(TokenType.BACKTICK, "operator", "Expected operator");
        String name = ctx.expect(TokenType.IDENTIFIER, "operator", "Expected identifier after '`'").value();
        ctx.expect(TokenType.BACKTICK, ParseErrorKind.MALFORMED_VALUE, "operator", "Expected closing '`'");
        return name;
    }

    // ==================== Tier 2: application and ascription ====================

    private Value parseApplications() {
        Value value = parseAccessorsAndUpdates(parseValueAtom());
        while (true) {
            Value function = value;
            Optional<Value> next = ctx.attempt(() -> ctx.choice(EXPRESSION,
                    () -> parseApplication(function),
                    () -> parseTypeAscription(function)));
            if (next.isEmpty()) {
                return value;
            }
            value = next.get();
        }
    }

    private Value parseApplication(Value function) {
        ctx.indented(EXPRESSION);
        return new Application(function, parseAccessorsAndUpdates(parseValueAtom()));
    }

    private Value parseTypeAscription(Value value) {
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.DOUBLE_COLON, EXPRESSION, "Expected '::'");
        return new TypedValue(true, types.parsePolyType(), value);
    }

    // ==================== Tier 1: accessors and record updates ====================

    private Value parseAccessorsAndUpdates(Value atom) {
        Value value = atom;
        while (true) {
            Value source = value;
            Optional<Value> next = ctx.attempt(() -> ctx.choice(EXPRESSION,
                    () -> parseAccessor(source),
                    () -> parseObjectUpdate(source)));
            if (next.isEmpty()) {
                return value;
            }
            value = next.get();
        }
    }

    private Value parseAccessor(Value source) {
        ctx.indented(EXPRESSION);
        if (source instanceof ConstructorExpr constructor && ctx.check(TokenType.DOT)) {
            throw ctx.fail(ParseErrorKind.INVALID_ACCESSOR_TARGET, "accessor",
                    "Cannot access a property of constructor " + constructor.name());
        }
        ctx.expect(TokenType.DOT, EXPRESSION, "Expected '.'");
        ctx.indented(EXPRESSION);
        String property = ctx.expect(TokenType.IDENTIFIER, ParseErrorKind.MALFORMED_VALUE, "accessor",
                "Expected property name after '.'").value();
        return new PropertyAccess(source, property);
    }

    private Value parseObjectUpdate(Value source) {
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.LBRACE, EXPRESSION, "Expected '{'");
        List<PropertyValue> updates = ctx.sepBy1(() -> {
            ctx.indented(EXPRESSION);
            return parsePropertyUpdate();
        }, TokenType.COMMA);
        ctx.expect(TokenType.RBRACE, ParseErrorKind.MALFORMED_VALUE, "record update", "Expected '}'");
        return new ObjectUpdate(source, updates);
    }

    private PropertyValue parsePropertyUpdate() {
        String name = ctx.expect(TokenType.IDENTIFIER, "record update", "Expected property name").value();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.EQUALS, "record update", "Expected '='");
        ctx.indented(EXPRESSION);
        return new PropertyValue(name, parseValue());
    }

    // ==================== Atoms ====================

    /**
     * Parses an irreducible value form. Alternatives are tried in order and
     * the first to succeed wins.
     */
    public Value parseValueAtom() {
        return ctx.choice(EXPRESSION,
                this::parseNumericLiteral,
                this::parseStringLiteral,
                this::parseBooleanLiteral,
                this::parseArrayLiteral,
                this::parseObjectLiteral,
                this::parseLambda,
                this::parseConstructor,
                this::parseVariable,
                this::parseCase,
                this::parseIfThenElse,
                doNotation::parseDoBlock,
                this::parseLet,
                this::parseParenthesized);
    }

    private Value parseNumericLiteral() {
        return new NumericLiteral(Literals.number(ctx, EXPRESSION));
    }

    private Value parseStringLiteral() {
        return new StringLiteral(ctx.expect(TokenType.STRING_LITERAL, EXPRESSION, "Expected string literal").value());
    }

    private Value parseBooleanLiteral() {
        if (ctx.check(TokenType.TRUE)) {
            ctx.advance();
            return new BooleanLiteral(true);
        }
        ctx.expect(TokenType.FALSE, EXPRESSION, "Expected boolean literal");
        return new BooleanLiteral(false);
    }

    private Value parseArrayLiteral() {
        ctx.expect(TokenType.LBRACKET, EXPRESSION, "Expected '['");
        List<Value> elements = ctx.sepBy(this::parseValue, TokenType.COMMA);
        ctx.expect(TokenType.RBRACKET, ParseErrorKind.MALFORMED_VALUE, "array literal", "Expected ']'");
        return new ArrayLiteral(elements);
    }

    private Value parseObjectLiteral() {
        ctx.expect(TokenType.LBRACE, EXPRESSION, "Expected '{'");
        List<PropertyValue> properties = ctx.sepBy(this::parseObjectProperty, TokenType.COMMA);
        ctx.expect(TokenType.RBRACE, ParseErrorKind.MALFORMED_VALUE, "object literal", "Expected '}'");
        return new ObjectLiteral(properties);
    }

    private PropertyValue parseObjectProperty() {
        ctx.indented(EXPRESSION);
        String name = ctx.expect(TokenType.IDENTIFIER, "object literal", "Expected property name").value();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.COLON, "object literal", "Expected ':'");
        ctx.indented(EXPRESSION);
        return new PropertyValue(name, parseValue());
    }

    /**
     * Parses {@code \a b c -> body} into nested single-argument lambdas.
     * Arguments are collected right of the backslash column until {@code ->}.
     */
    private Value parseLambda() {
        Token backslash = ctx.expect(TokenType.BACKSLASH, EXPRESSION, "Expected '\\'");
        List<Argument> arguments = ctx.withReferenceColumn(backslash.column(), () -> ctx.many1(() -> {
            ctx.indented("lambda argument");
            return parseArgument();
        }));
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.ARROW, ParseErrorKind.MALFORMED_VALUE, "lambda", "Expected '->' after lambda arguments");
        return LambdaExpression.curried(arguments, parseValue());
    }

    /**
     * A plain name, or a pattern in no-parens position. A name followed by
     * {@code @} is an as-pattern, not a plain name.
     */
    Argument parseArgument() {
        if (ctx.check(TokenType.IDENTIFIER) && !ctx.checkAhead(1, TokenType.AT)) {
            return Argument.named(ctx.advance().value());
        }
        return Argument.pattern(binders.parseBinderNoParens());
    }

    private Value parseConstructor() {
        String name = ctx.expect(TokenType.PROPER_NAME, EXPRESSION, "Expected constructor").value();
        return new ConstructorExpr(QualifiedName.parse(name));
    }

    private Value parseVariable() {
        return VariableExpr.of(ctx.expect(TokenType.IDENTIFIER, EXPRESSION, "Expected identifier").value());
    }

    private Value parseCase() {
        ctx.expect(TokenType.CASE, EXPRESSION, "Expected 'case'");
        Value scrutinee = parseValue();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.OF, ParseErrorKind.MALFORMED_VALUE, "case expression", "Expected 'of' after case scrutinee");
        ctx.indented(CASE_ALTERNATIVE);
        int blockColumn = ctx.peek().column();
        List<CaseAlternative> alternatives = ctx.layoutBlock(CASE_ALTERNATIVE, this::parseCaseAlternative);
        ctx.requireBlockEnd(blockColumn, CASE_ALTERNATIVE);
        return new CaseExpression(scrutinee, alternatives);
    }

    private CaseAlternative parseCaseAlternative() {
        Binder binder = binders.parseBinder();
        Optional<Guard> guard = ctx.attempt(doNotation::parseGuard);
        if (!ctx.check(TokenType.ARROW)) {
            throw ctx.fail(ParseErrorKind.MALFORMED_VALUE, CASE_ALTERNATIVE,
                    "Expected '->' after case alternative binder");
        }
        ctx.indented(CASE_ALTERNATIVE);
        ctx.advance();
        return new CaseAlternative(binder, guard, parseValue());
    }

    private Value parseIfThenElse() {
        ctx.expect(TokenType.IF, EXPRESSION, "Expected 'if'");
        ctx.indented(EXPRESSION);
        Value condition = parseValue();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.THEN, ParseErrorKind.MALFORMED_VALUE, "if expression", "Expected 'then'");
        ctx.indented(EXPRESSION);
        Value thenBranch = parseValue();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.ELSE, ParseErrorKind.MALFORMED_VALUE, "if expression", "Expected 'else'");
        ctx.indented(EXPRESSION);
        Value elseBranch = parseValue();
        return new IfExpression(condition, thenBranch, elseBranch);
    }

    private Value parseLet() {
        ctx.expect(TokenType.LET, EXPRESSION, "Expected 'let'");
        ctx.indented(EXPRESSION);
        LetBinding binding = ctx.choice("let binding",
                this::parseFunctionBinding,
                this::parseDestructuringBinding);
        ctx.indented(EXPRESSION);
        Value value = parseValue();
        ctx.indented(EXPRESSION);
        ctx.expect(TokenType.IN, ParseErrorKind.MALFORMED_VALUE, "let expression", "Expected 'in'");
        Value body = parseValue();
        return new LetExpression(binding, value, body);
    }

    // f x (Just y) =
    private LetBinding parseFunctionBinding() {
        String name = ctx.expect(TokenType.IDENTIFIER, "let binding", "Expected identifier").value();
        List<Argument> arguments = ctx.many(() -> {
            ctx.indented("let binding");
            return parseArgument();
        });
        ctx.indented("let binding");
        ctx.expect(TokenType.EQUALS, "let binding", "Expected '='");
        return new LetBinding.Function(name, arguments);
    }

    // Tuple a b =
    private LetBinding parseDestructuringBinding() {
        Binder binder = binders.parseBinder();
        ctx.indented("let binding");
        ctx.expect(TokenType.EQUALS, ParseErrorKind.MALFORMED_VALUE, "let binding", "Expected '=' after let binder");
        return new LetBinding.Destructure(binder);
    }

    private Value parseParenthesized() {
        ctx.expect(TokenType.LPAREN, EXPRESSION, "Expected '('");
        Value inner = parseValue();
        ctx.expect(TokenType.RPAREN, ParseErrorKind.MALFORMED_VALUE, EXPRESSION, "Expected ')'");
        return new ParenthesizedExpr(inner);
    }
}
