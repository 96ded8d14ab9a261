package org.psfront.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.Argument;
import org.psfront.syntax.ast.ArrayLiteral;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.BooleanLiteral;
import org.psfront.syntax.ast.CaseAlternative;
import org.psfront.syntax.ast.CaseExpression;
import org.psfront.syntax.ast.ConstructorExpr;
import org.psfront.syntax.ast.Guard;
import org.psfront.syntax.ast.IfExpression;
import org.psfront.syntax.ast.LambdaExpression;
import org.psfront.syntax.ast.LetBinding;
import org.psfront.syntax.ast.LetExpression;
import org.psfront.syntax.ast.NamedBinder;
import org.psfront.syntax.ast.NullBinder;
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
import org.psfront.syntax.types.TypeConstructor;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for value parsing: atoms, the three postfix/infix tiers and layout.
 */
class ValueParserTest {

    private static Value var(String name) {
        return VariableExpr.of(name);
    }

    private static Value num(long value) {
        return NumericLiteral.integer(value);
    }

    private static Value app(Value function, Value... arguments) {
        Value result = function;
        for (Value argument : arguments) {
            result = new Application(result, argument);
        }
        return result;
    }

    @Nested
    @DisplayName("Literals")
    class LiteralTests {

        @Test
        @DisplayName("Integer literal converts to a BigInteger")
        void testInteger() {
            NumericLiteral literal = assertInstanceOf(NumericLiteral.class, Parsers.parseValue("42"));
            assertEquals(BigInteger.valueOf(42), literal.value());
        }

        @Test
        @DisplayName("Fractional literal converts to a BigDecimal")
        void testDecimal() {
            assertEquals(NumericLiteral.decimal("3.25"), Parsers.parseValue("3.25"));
        }

        @Test
        @DisplayName("String and boolean literals")
        void testStringAndBoolean() {
            assertEquals(new StringLiteral("hi"), Parsers.parseValue("\"hi\""));
            assertEquals(new BooleanLiteral(true), Parsers.parseValue("true"));
            assertEquals(new BooleanLiteral(false), Parsers.parseValue("false"));
        }

        @Test
        @DisplayName("Array literal, possibly empty")
        void testArray() {
            assertEquals(new ArrayLiteral(List.of(num(1), app(var("f"), var("x")))), Parsers.parseValue("[1, f x]"));
            assertEquals(new ArrayLiteral(List.of()), Parsers.parseValue("[]"));
        }

        @Test
        @DisplayName("Object literal uses ':' between name and value")
        void testObjectLiteral() {
            ObjectLiteral object = assertInstanceOf(ObjectLiteral.class,
                    Parsers.parseValue("{ name: \"Ada\", age: 36 }"));
            assertEquals(List.of(new PropertyValue("name", new StringLiteral("Ada")),
                    new PropertyValue("age", num(36))), object.properties());
            assertEquals(new ObjectLiteral(List.of()), Parsers.parseValue("{}"));
        }
    }

    @Nested
    @DisplayName("References")
    class ReferenceTests {

        @Test
        @DisplayName("Variable and constructor references")
        void testReferences() {
            assertEquals(var("map"), Parsers.parseValue("map"));
            assertEquals(ConstructorExpr.of("Nothing"), Parsers.parseValue("Nothing"));
        }

        @Test
        @DisplayName("Qualified constructor keeps its module path")
        void testQualifiedConstructor() {
            ConstructorExpr constructor = assertInstanceOf(ConstructorExpr.class,
                    Parsers.parseValue("Data.Maybe.Nothing"));
            assertEquals(new QualifiedName(List.of("Data", "Maybe"), "Nothing"), constructor.name());
        }

        @Test
        @DisplayName("Dotted lower-case name is an accessor on a constructor, not a qualified variable")
        void testQualifiedVariableNotExpressible() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("Data.Map.lookup"));
            assertEquals(ParseErrorKind.INVALID_ACCESSOR_TARGET, e.getKind());
            assertTrue(VariableExpr.of("lookup").name().modulePath().isEmpty());
        }
    }

    @Nested
    @DisplayName("Parentheses")
    class ParenthesesTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "42",
                "f x y",
                "\\x -> x",
                "a + b * c",
                "x.foo.bar",
                "r { a = 1 }",
                "if a then b else c",
                "[1, 2]",
                "x :: Number"
        })
        @DisplayName("Parsing (e) wraps the tree of e")
        void testParenthesesAreTransparent(String source) {
            assertEquals(new ParenthesizedExpr(Parsers.parseValue(source)), Parsers.parseValue("(" + source + ")"));
        }

        @Test
        @DisplayName("Unclosed parenthesis is a malformed value")
        void testUnclosed() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("(f x"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
            assertEquals(5, e.getColumn());
        }
    }

    @Nested
    @DisplayName("Lambdas")
    class LambdaTests {

        @Test
        @DisplayName("Multi-argument lambda equals nested single-argument lambdas")
        void testCurried() {
            Value curried = Parsers.parseValue("\\x y -> x");
            assertEquals(Parsers.parseValue("\\x -> \\y -> x"), curried);
            assertEquals(new LambdaExpression(Argument.named("x"),
                    new LambdaExpression(Argument.named("y"), var("x"))), curried);
        }

        @Test
        @DisplayName("Pattern arguments use no-parens binders")
        void testPatternArguments() {
            Value lambda = Parsers.parseValue("\\(Tuple a b) _ -> a");
            assertEquals(new LambdaExpression(Argument.pattern(Binder.constructor("Tuple", Binder.var("a"), Binder.var("b"))),
                    new LambdaExpression(Argument.pattern(new NullBinder()), var("a"))), lambda);
        }

        @Test
        @DisplayName("Name followed by '@' is an as-pattern argument")
        void testAsPatternArgument() {
            LambdaExpression lambda = assertInstanceOf(LambdaExpression.class,
                    Parsers.parseValue("\\all@(Just x) -> x"));
            assertEquals(Argument.pattern(new NamedBinder("all", Binder.constructor("Just", Binder.var("x")))),
                    lambda.argument());
        }

        @Test
        @DisplayName("Body extends as far as possible")
        void testBodyExtent() {
            assertEquals(new LambdaExpression(Argument.named("x"), new BinaryExpression("+", var("x"), num(1))),
                    Parsers.parseValue("\\x -> x + 1"));
        }

        @Test
        @DisplayName("Missing arrow is a malformed value")
        void testMissingArrow() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("\\x y = 1"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
            assertEquals(6, e.getColumn());
        }
    }

    @Nested
    @DisplayName("Accessors and updates")
    class AccessorTests {

        @Test
        @DisplayName("Accessor on a variable")
        void testAccessor() {
            assertEquals(new PropertyAccess(var("x"), "foo"), Parsers.parseValue("x.foo"));
        }

        @Test
        @DisplayName("Accessors chain left to right")
        void testAccessorChain() {
            assertEquals(new PropertyAccess(new PropertyAccess(var("a"), "b"), "c"), Parsers.parseValue("a.b.c"));
        }

        @Test
        @DisplayName("Accessor on a constructor is rejected")
        void testAccessorOnConstructor() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("Just.foo"));
            assertEquals(ParseErrorKind.INVALID_ACCESSOR_TARGET, e.getKind());
            assertEquals("accessor", e.getLabel());
            assertEquals(5, e.getColumn());
        }

        @Test
        @DisplayName("Accessor binds tighter than application")
        void testAccessorInArgument() {
            assertEquals(app(var("f"), new PropertyAccess(var("x"), "y")), Parsers.parseValue("f x.y"));
        }

        @Test
        @DisplayName("Record update uses '=' and may be followed by an accessor")
        void testObjectUpdate() {
            Value value = Parsers.parseValue("r { a = 1, b = x }.a");
            assertEquals(new PropertyAccess(new ObjectUpdate(var("r"),
                    List.of(new PropertyValue("a", num(1)), new PropertyValue("b", var("x")))), "a"), value);
        }

        @Test
        @DisplayName("Object literal in argument position is not an update")
        void testObjectLiteralArgument() {
            assertEquals(app(var("f"), new ObjectLiteral(List.of(new PropertyValue("a", num(1))))),
                    Parsers.parseValue("f { a: 1 }"));
        }
    }

    @Nested
    @DisplayName("Application, ascription and operators")
    class TierTests {

        @Test
        @DisplayName("Application is left-nested")
        void testApplication() {
            assertEquals(app(var("f"), var("x"), var("y")), Parsers.parseValue("f x y"));
        }

        @Test
        @DisplayName("Type ascription wraps the value in a checked TypedValue")
        void testTypeAscription() {
            assertEquals(new TypedValue(true, TypeConstructor.of("Number"), app(var("f"), var("x"))),
                    Parsers.parseValue("f x :: Number"));
        }

        @Test
        @DisplayName("Operator chains stay unresolved and nest to the right")
        void testOperatorChain() {
            assertEquals(new BinaryExpression("+", var("a"), new BinaryExpression("*", var("b"), var("c"))),
                    Parsers.parseValue("a + b * c"));
            assertEquals(new BinaryExpression("-", var("a"), new BinaryExpression("-", var("b"), var("c"))),
                    Parsers.parseValue("a - b - c"));
        }

        @Test
        @DisplayName("Back-ticked identifier is an infix operator")
        void testBacktickOperator() {
            assertEquals(new BinaryExpression("div", app(var("f"), var("x")), var("y")),
                    Parsers.parseValue("f x `div` y"));
        }

        @Test
        @DisplayName("Unclosed back-tick is a malformed value")
        void testUnclosedBacktick() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("x `div y"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
        }
    }

    @Nested
    @DisplayName("Case expressions")
    class CaseTests {

        @Test
        @DisplayName("Guarded alternative keeps binder, guard and result")
        void testCaseWithGuard() {
            CaseExpression caseExpr = assertInstanceOf(CaseExpression.class,
                    Parsers.parseValue("case n of x | x > 0 -> 1"));

            assertEquals(var("n"), caseExpr.scrutinee());
            assertEquals(List.of(new CaseAlternative(Binder.var("x"),
                            Optional.of(new Guard(new BinaryExpression(">", var("x"), num(0)))), num(1))),
                    caseExpr.alternatives());
        }

        @Test
        @DisplayName("Alternatives are laid out at the same column")
        void testLayoutAlternatives() {
            String source = """
                    case m of
                      Just x -> f x
                      Nothing -> 0
                    """;

            CaseExpression caseExpr = assertInstanceOf(CaseExpression.class, Parsers.parseValue(source));

            assertEquals(List.of(
                    new CaseAlternative(Binder.constructor("Just", Binder.var("x")), Optional.empty(),
                            app(var("f"), var("x"))),
                    new CaseAlternative(Binder.constructor("Nothing"), Optional.empty(), num(0))),
                    caseExpr.alternatives());
        }

        @Test
        @DisplayName("Nested case ends where the outer alternatives resume")
        void testNestedCase() {
            String source = """
                    case a of
                      Just x -> case x of
                        0 -> true
                        _ -> false
                      Nothing -> false
                    """;

            CaseExpression outer = assertInstanceOf(CaseExpression.class, Parsers.parseValue(source));

            assertEquals(2, outer.alternatives().size());
            CaseExpression inner = assertInstanceOf(CaseExpression.class, outer.alternatives().get(0).result());
            assertEquals(2, inner.alternatives().size());
        }

        @Test
        @DisplayName("Missing arrow is reported as a malformed case alternative")
        void testMissingArrow() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("case x of y = 1"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
            assertEquals("case alternative", e.getLabel());
        }

        @Test
        @DisplayName("Malformed later alternative fails the case instead of becoming an argument")
        void testMalformedSecondAlternative() {
            // GIVEN: the second alternative starts at the block column but has no arrow
            for (String source : new String[] {"case a of\n  A -> 1\n  B", "case a of\n  A -> 1\n  B x"}) {
                // WHEN
                SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue(source));

                // THEN
                assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind(), source);
                assertEquals("case alternative", e.getLabel(), source);
            }
        }

        @Test
        @DisplayName("Missing 'of' is a malformed value")
        void testMissingOf() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("case x -> y"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
        }

        @Test
        @DisplayName("Under-indented alternative is a layout violation")
        void testUnderIndentedAlternative() {
            String source = "case m of\n    Just x -> x\n  Nothing -> 0";

            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue(source));

            assertEquals(ParseErrorKind.LAYOUT_VIOLATION, e.getKind());
            assertEquals(3, e.getLine());
            assertEquals(3, e.getColumn());
        }
    }

    @Nested
    @DisplayName("If and let")
    class IfLetTests {

        @Test
        @DisplayName("If-then-else")
        void testIf() {
            assertEquals(new IfExpression(var("c"), num(1), app(var("f"), num(2))),
                    Parsers.parseValue("if c then 1 else f 2"));
        }

        @Test
        @DisplayName("Missing else is a malformed value")
        void testMissingElse() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("if c then 1 then 2"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
        }

        @Test
        @DisplayName("Let with a function binding")
        void testLetFunction() {
            Value value = Parsers.parseValue("let f x = x + 1 in f 2");
            assertEquals(new LetExpression(new LetBinding.Function("f", List.of(Argument.named("x"))),
                    new BinaryExpression("+", var("x"), num(1)), app(var("f"), num(2))), value);
        }

        @Test
        @DisplayName("Let with a plain name is a function binding without arguments")
        void testLetValue() {
            LetExpression let = assertInstanceOf(LetExpression.class, Parsers.parseValue("let x = 1 in x"));
            assertEquals(new LetBinding.Function("x", List.of()), let.binding());
        }

        @Test
        @DisplayName("Let falls back to a destructuring binder")
        void testLetDestructure() {
            LetExpression let = assertInstanceOf(LetExpression.class,
                    Parsers.parseValue("let Tuple a b = t in a"));
            assertEquals(new LetBinding.Destructure(Binder.constructor("Tuple", Binder.var("a"), Binder.var("b"))),
                    let.binding());
        }

        @Test
        @DisplayName("As-pattern on the left of a let destructures")
        void testLetAsPattern() {
            LetExpression let = assertInstanceOf(LetExpression.class,
                    Parsers.parseValue("let all@(Just x) = m in x"));
            assertEquals(new LetBinding.Destructure(
                    new NamedBinder("all", Binder.constructor("Just", Binder.var("x")))), let.binding());
        }

        @Test
        @DisplayName("Missing 'in' is a malformed value")
        void testMissingIn() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("let x = 1, x"));
            assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
        }
    }

    @Nested
    @DisplayName("Layout")
    class LayoutTests {

        @Test
        @DisplayName("Indented continuation line is an application argument")
        void testIndentedContinuation() {
            assertEquals(app(var("f"), var("x")), Parsers.parseValue("f\n  x"));
        }

        @Test
        @DisplayName("Continuation at the reference column is rejected")
        void testContinuationAtReferenceColumn() {
            ParserOptions options = ParserOptions.defaults().withInitialColumn(1);

            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("f\nx", options));

            assertEquals(ParseErrorKind.LAYOUT_VIOLATION, e.getKind());
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Trailing garbage is reported at its location")
        void testTrailingToken() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseValue("f x )"));
            assertEquals(1, e.getLine());
            assertEquals(5, e.getColumn());
            assertTrue(e.getMessage().startsWith("line 1:5"));
        }
    }
}
