package org.psfront.syntax.fixity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.psfront.syntax.Parsers;
import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.Argument;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.CaseExpression;
import org.psfront.syntax.ast.LambdaExpression;
import org.psfront.syntax.ast.NumericLiteral;
import org.psfront.syntax.ast.ParenthesizedExpr;
import org.psfront.syntax.ast.Value;
import org.psfront.syntax.ast.VariableExpr;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for re-associating operator chains by declared fixity.
 */
class OperatorRebracketerTest {

    private static final FixityTable PRELUDE = FixityTable.empty()
            .with("+", Fixity.infixl(6))
            .with("-", Fixity.infixl(6))
            .with("*", Fixity.infixl(7))
            .with("<>", Fixity.infixr(5))
            .with("==", Fixity.infix(4))
            .with("++", Fixity.infixr(6))
            .with("div", Fixity.infixl(7));

    private static Value var(String name) {
        return VariableExpr.of(name);
    }

    private static Value num(long value) {
        return NumericLiteral.integer(value);
    }

    private static Value op(String operator, Value left, Value right) {
        return new Application(new Application(var(operator), left), right);
    }

    private static Value rebracket(String source) {
        return OperatorRebracketer.rebracket(Parsers.parseValue(source), PRELUDE);
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class ResolutionTests {

        @Test
        @DisplayName("Higher precedence binds tighter")
        void testPrecedence() {
            assertEquals(op("+", var("a"), op("*", var("b"), var("c"))), rebracket("a + b * c"));
            assertEquals(op("+", op("*", var("a"), var("b")), var("c")), rebracket("a * b + c"));
        }

        @Test
        @DisplayName("Left-associative operators group to the left")
        void testLeftAssociative() {
            assertEquals(op("-", op("-", var("a"), var("b")), var("c")), rebracket("a - b - c"));
        }

        @Test
        @DisplayName("Right-associative operators group to the right")
        void testRightAssociative() {
            assertEquals(op("<>", var("a"), op("<>", var("b"), var("c"))), rebracket("a <> b <> c"));
        }

        @Test
        @DisplayName("Undeclared operators default to infixl 9")
        void testDefaultFixity() {
            assertEquals(op("!", op("!", var("a"), var("b")), var("c")), rebracket("a ! b ! c"));
            assertEquals(op("+", var("a"), op("!", var("b"), var("c"))), rebracket("a + b ! c"));
        }

        @Test
        @DisplayName("Back-ticked functions take their declared fixity")
        void testBacktickFixity() {
            assertEquals(op("+", op("div", var("x"), var("y")), var("z")), rebracket("x `div` y + z"));
        }

        @Test
        @DisplayName("Application operands are kept whole")
        void testApplicationOperands() {
            Value fx = new Application(var("f"), var("x"));
            assertEquals(op("+", fx, var("y")), rebracket("f x + y"));
        }
    }

    @Nested
    @DisplayName("Tree traversal")
    class TraversalTests {

        @Test
        @DisplayName("Parentheses delimit chains")
        void testParenthesesDelimit() {
            Value expected = op("*", new ParenthesizedExpr(op("+", var("a"), var("b"))), var("c"));
            assertEquals(expected, rebracket("(a + b) * c"));
        }

        @Test
        @DisplayName("Chains inside lambda bodies are resolved")
        void testLambdaBody() {
            assertEquals(new LambdaExpression(Argument.named("x"), op("+", var("x"), op("*", var("y"), var("z")))),
                    rebracket("\\x -> x + y * z"));
        }

        @Test
        @DisplayName("Chains in guards and alternatives are resolved")
        void testCaseAlternatives() {
            CaseExpression caseExpr = assertInstanceOf(CaseExpression.class,
                    rebracket("case n of x | x == 1 + 1 -> x - 1 - 1"));
            Value guard = caseExpr.alternatives().get(0).guard().orElseThrow().condition();
            assertEquals(op("==", var("x"), op("+", num(1), num(1))), guard);
            assertEquals(op("-", op("-", var("x"), num(1)), num(1)), caseExpr.alternatives().get(0).result());
        }

        @Test
        @DisplayName("No BinaryExpression survives the pass")
        void testNoUnresolvedNodes() {
            Value result = rebracket("do { x <- a + b ; pure [x * 2, { v: x <> y }] }");
            assertFalse(result.toString().contains(BinaryExpression.class.getSimpleName()));
        }

        @Test
        @DisplayName("Values without operators are unchanged")
        void testIdentity() {
            Value value = Parsers.parseValue("f x.y { a = 1 }");
            assertEquals(value, OperatorRebracketer.rebracket(value, PRELUDE));
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class ConflictTests {

        @Test
        @DisplayName("Non-associative operators cannot be chained")
        void testNonAssociative() {
            FixityException e = assertThrows(FixityException.class, () -> rebracket("a == b == c"));
            assertTrue(e.getMessage().contains("infix 4"));
        }

        @Test
        @DisplayName("Mixed associativity at equal precedence is rejected")
        void testMixedAssociativity() {
            assertThrows(FixityException.class, () -> rebracket("a + b ++ c"));
        }

        @Test
        @DisplayName("Parentheses resolve a conflict")
        void testParenthesesResolveConflict() {
            assertDoesNotThrow(() -> rebracket("(a == b) == c"));
        }
    }

    @Nested
    @DisplayName("Fixity table")
    class TableTests {

        @Test
        @DisplayName("with returns a new table")
        void testWithIsPersistent() {
            FixityTable empty = FixityTable.empty();
            FixityTable one = empty.with("+", Fixity.infixl(6));

            assertEquals(0, empty.size());
            assertEquals(1, one.size());
            assertFalse(empty.isDeclared("+"));
            assertEquals(Fixity.infixl(6), one.fixityOf("+"));
            assertEquals(FixityTable.DEFAULT_FIXITY, one.fixityOf("-"));
        }

        @Test
        @DisplayName("Precedence must be between 0 and 9")
        void testPrecedenceRange() {
            assertThrows(IllegalArgumentException.class, () -> Fixity.infixl(10));
            assertThrows(IllegalArgumentException.class, () -> Fixity.infixr(-1));
        }
    }
}
