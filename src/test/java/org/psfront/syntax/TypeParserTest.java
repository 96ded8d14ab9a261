package org.psfront.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.psfront.syntax.ast.TypedValue;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the type grammar used in ascriptions.
 */
class TypeParserTest {

    private static final Type A = new TypeVar("a");
    private static final Type B = new TypeVar("b");

    @Test
    @DisplayName("Constructors and variables")
    void testAtoms() {
        assertEquals(TypeConstructor.of("Number"), Parsers.parseType("Number"));
        assertEquals(TypeConstructor.of("Data.Maybe.Maybe"), Parsers.parseType("Data.Maybe.Maybe"));
        assertEquals(A, Parsers.parseType("a"));
    }

    @Test
    @DisplayName("Function arrows are right-associative")
    void testFunctionArrow() {
        assertEquals(new FunctionType(A, new FunctionType(B, new TypeVar("c"))), Parsers.parseType("a -> b -> c"));
        assertEquals(new FunctionType(new FunctionType(A, B), new TypeVar("c")), Parsers.parseType("(a -> b) -> c"));
    }

    @Test
    @DisplayName("Type application is left-nested and binds tighter than arrows")
    void testApplication() {
        Type either = new TypeApp(new TypeApp(TypeConstructor.of("Either"), new TypeVar("e")), A);
        assertEquals(either, Parsers.parseType("Either e a"));
        assertEquals(new FunctionType(new TypeApp(TypeConstructor.of("Maybe"), A), B),
                Parsers.parseType("Maybe a -> b"));
        assertEquals(new TypeApp(TypeConstructor.of("Maybe"), new TypeApp(TypeConstructor.of("Array"), A)),
                Parsers.parseType("Maybe (Array a)"));
    }

    @Test
    @DisplayName("Quantified type")
    void testForAll() {
        assertEquals(new ForAll(List.of("a", "b"), new FunctionType(A, B)), Parsers.parseType("forall a b. a -> b"));
    }

    @Test
    @DisplayName("Array and object types")
    void testArrayAndObject() {
        assertEquals(new ArrayType(TypeConstructor.of("String")), Parsers.parseType("[String]"));

        ObjectType object = assertInstanceOf(ObjectType.class,
                Parsers.parseType("{ name :: String, tags :: [String] | r }"));
        assertEquals(List.of(new RowField("name", TypeConstructor.of("String")),
                new RowField("tags", new ArrayType(TypeConstructor.of("String")))), object.fields());
        assertEquals(Optional.of("r"), object.rowTail());

        assertEquals(new ObjectType(List.of(), Optional.empty()), Parsers.parseType("{}"));
    }

    @Test
    @DisplayName("Missing dot after forall variables is reported")
    void testForAllWithoutDot() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> Parsers.parseType("forall a -> a"));
        assertEquals(ParseErrorKind.MALFORMED_VALUE, e.getKind());
        assertEquals("type", e.getLabel());
    }

    @Test
    @DisplayName("Ascription takes a polymorphic type")
    void testAscription() {
        TypedValue typed = assertInstanceOf(TypedValue.class,
                Parsers.parseValue("identity :: forall a. a -> a"));
        assertTrue(typed.checked());
        assertEquals(new ForAll(List.of("a"), new FunctionType(A, A)), typed.type());
    }
}
