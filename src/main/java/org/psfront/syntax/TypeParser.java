package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;
import org.psfront.syntax.ast.QualifiedName;
import org.psfront.syntax.types.ArrayType;
import org.psfront.syntax.types.ForAll;
import org.psfront.syntax.types.FunctionType;
import org.psfront.syntax.types.ObjectType;
import org.psfront.syntax.types.RowField;
import org.psfront.syntax.types.Type;
import org.psfront.syntax.types.TypeApp;
import org.psfront.syntax.types.TypeConstructor;
import org.psfront.syntax.types.TypeVar;

import java.util.List;
import java.util.Optional;

/**
 * Parses the types that follow {@code ::} in a type ascription.
 *
 * polyType := 'forall' ident+ '.' type | type
 * type     := appType ('->' type)?
 * appType  := atom atom*
 * atom     := ident | ProperName | '[' polyType ']' | '{' fields ('|' ident)? '}' | '(' polyType ')'
 */
public final class TypeParser {

    static final String TYPE = "type";

    private final ParseContext ctx;

    public TypeParser(ParseContext ctx) {
        this.ctx = ctx;
    }

    public Type parsePolyType() {
        if (!ctx.check(TokenType.FORALL)) {
            return parseType();
        }
        ctx.advance();
        List<String> variables = ctx.many1(() -> {
            ctx.indented(TYPE);
            return ctx.expect(TokenType.IDENTIFIER, TYPE, "Expected type variable").value();
        });
        ctx.indented(TYPE);
        ctx.expect(TokenType.DOT, ParseErrorKind.MALFORMED_VALUE, TYPE, "Expected '.' after forall variables");
        ctx.indented(TYPE);
        return new ForAll(variables, parseType());
    }

    private Type parseType() {
        Type argument = parseTypeApplication();
        if (ctx.attempt(this::arrow).isPresent()) {
            return new FunctionType(argument, parseType());
        }
        return argument;
    }

    private Token arrow() {
        ctx.indented(TYPE);
        return ctx.expect(TokenType.ARROW, TYPE, "Expected '->'");
    }

    private Type parseTypeApplication() {
        Type result = parseTypeAtom();
        List<Type> arguments = ctx.many(() -> {
            ctx.indented(TYPE);
            return parseTypeAtom();
        });
        for (Type argument : arguments) {
            result = new TypeApp(result, argument);
        }
        return result;
    }

    private Type parseTypeAtom() {
        return ctx.choice(TYPE,
                this::parseTypeVariable,
                this::parseTypeConstructor,
                this::parseArrayType,
                this::parseObjectType,
                this::parseParenthesizedType);
    }

    private Type parseTypeVariable() {
        return new TypeVar(ctx.expect(TokenType.IDENTIFIER, TYPE, "Expected type variable").value());
    }

    private Type parseTypeConstructor() {
        return new TypeConstructor(QualifiedName.parse(
                ctx.expect(TokenType.PROPER_NAME, TYPE, "Expected type constructor").value()));
    }

    private Type parseArrayType() {
        ctx.expect(TokenType.LBRACKET, TYPE, "Expected '['");
        ctx.indented(TYPE);
        Type element = parsePolyType();
        ctx.expect(TokenType.RBRACKET, ParseErrorKind.MALFORMED_VALUE, TYPE, "Expected ']'");
        return new ArrayType(element);
    }

    private Type parseObjectType() {
        ctx.expect(TokenType.LBRACE, TYPE, "Expected '{'");
        List<RowField> fields = ctx.sepBy(() -> {
            ctx.indented(TYPE);
            return parseRowField();
        }, TokenType.COMMA);
        Optional<String> rowTail = Optional.empty();
        if (ctx.check(TokenType.PIPE)) {
            ctx.advance();
            ctx.indented(TYPE);
            rowTail = Optional.of(ctx.expect(TokenType.IDENTIFIER, ParseErrorKind.MALFORMED_VALUE, TYPE,
                    "Expected row variable after '|'").value());
        }
        ctx.expect(TokenType.RBRACE, ParseErrorKind.MALFORMED_VALUE, TYPE, "Expected '}'");
        return new ObjectType(fields, rowTail);
    }

    private RowField parseRowField() {
        String name = ctx.expect(TokenType.IDENTIFIER, TYPE, "Expected field name").value();
        ctx.indented(TYPE);
        ctx.expect(TokenType.DOUBLE_COLON, TYPE, "Expected '::' after field name");
        ctx.indented(TYPE);
        return new RowField(name, parsePolyType());
    }

    private Type parseParenthesizedType() {
        ctx.expect(TokenType.LPAREN, TYPE, "Expected '('");
        Type inner = parsePolyType();
        ctx.expect(TokenType.RPAREN, ParseErrorKind.MALFORMED_VALUE, TYPE, "Expected ')'");
        return inner;
    }
}
