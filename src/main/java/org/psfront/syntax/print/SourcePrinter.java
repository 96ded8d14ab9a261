package org.psfront.syntax.print;

import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.Argument;
import org.psfront.syntax.ast.ArrayBinder;
import org.psfront.syntax.ast.ArrayLiteral;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.Binder;
import org.psfront.syntax.ast.BooleanBinder;
import org.psfront.syntax.ast.BooleanLiteral;
import org.psfront.syntax.ast.CaseAlternative;
import org.psfront.syntax.ast.CaseExpression;
import org.psfront.syntax.ast.ConsBinder;
import org.psfront.syntax.ast.ConstructorBinder;
import org.psfront.syntax.ast.ConstructorExpr;
import org.psfront.syntax.ast.DoExpression;
import org.psfront.syntax.ast.DoNotationBind;
import org.psfront.syntax.ast.DoNotationElement;
import org.psfront.syntax.ast.DoNotationLet;
import org.psfront.syntax.ast.DoNotationValue;
import org.psfront.syntax.ast.IfExpression;
import org.psfront.syntax.ast.LambdaExpression;
import org.psfront.syntax.ast.LetBinding;
import org.psfront.syntax.ast.LetExpression;
import org.psfront.syntax.ast.NamedBinder;
import org.psfront.syntax.ast.NullBinder;
import org.psfront.syntax.ast.NumberBinder;
import org.psfront.syntax.ast.NumericLiteral;
import org.psfront.syntax.ast.ObjectBinder;
import org.psfront.syntax.ast.ObjectLiteral;
import org.psfront.syntax.ast.ObjectUpdate;
import org.psfront.syntax.ast.ParenthesizedExpr;
import org.psfront.syntax.ast.PropertyAccess;
import org.psfront.syntax.ast.PropertyBinder;
import org.psfront.syntax.ast.PropertyValue;
import org.psfront.syntax.ast.StringBinder;
import org.psfront.syntax.ast.StringLiteral;
import org.psfront.syntax.ast.TypedValue;
import org.psfront.syntax.ast.Value;
import org.psfront.syntax.ast.VarBinder;
import org.psfront.syntax.ast.VariableExpr;
import org.psfront.syntax.types.ArrayType;
import org.psfront.syntax.types.ForAll;
import org.psfront.syntax.types.FunctionType;
import org.psfront.syntax.types.ObjectType;
import org.psfront.syntax.types.RowField;
import org.psfront.syntax.types.Type;
import org.psfront.syntax.types.TypeApp;
import org.psfront.syntax.types.TypeConstructor;
import org.psfront.syntax.types.TypeVar;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;

/**
 * Renders trees back to source text that parses to the same tree.
 *
 * Values only get the parentheses recorded as {@link ParenthesizedExpr};
 * binders and types are parenthesized where their position needs it. Case
 * alternatives go on their own lines, indented past the enclosing block, and
 * do blocks are printed with explicit braces.
 */
public final class SourcePrinter {

    private static final int INDENT_STEP = 2;

    private final StringBuilder out = new StringBuilder();

    private SourcePrinter() {
    }

    public static String print(Value value) {
        SourcePrinter printer = new SourcePrinter();
        printer.value(value, 0);
        return printer.out.toString();
    }

    public static String print(Binder binder) {
        SourcePrinter printer = new SourcePrinter();
        printer.binder(binder);
        return printer.out.toString();
    }

    public static String print(Type type) {
        SourcePrinter printer = new SourcePrinter();
        printer.polyType(type);
        return printer.out.toString();
    }

    // ==================== Values ====================

    // indent: leading spaces of the case alternatives that enclose this value
    private void value(Value value, int indent) {
        if (value instanceof NumericLiteral numeric) {
            out.append(number(numeric.value()));
        } else if (value instanceof StringLiteral string) {
            out.append(quote(string.value()));
        } else if (value instanceof BooleanLiteral bool) {
            out.append(bool.value());
        } else if (value instanceof ArrayLiteral array) {
            out.append('[');
            separated(array.elements(), ", ", element -> value(element, indent));
            out.append(']');
        } else if (value instanceof ObjectLiteral object) {
            properties(object.properties(), ": ", indent);
        } else if (value instanceof LambdaExpression lambda) {
            out.append('\\');
            argument(lambda.argument());
            out.append(" -> ");
            value(lambda.body(), indent);
        } else if (value instanceof VariableExpr variable) {
            out.append(variable.name());
        } else if (value instanceof ConstructorExpr constructor) {
            out.append(constructor.name());
        } else if (value instanceof Application application) {
            value(application.function(), indent);
            out.append(' ');
            value(application.argument(), indent);
        } else if (value instanceof CaseExpression caseExpr) {
            caseExpression(caseExpr, indent);
        } else if (value instanceof IfExpression ifExpr) {
            out.append("if ");
            value(ifExpr.condition(), indent);
            out.append(" then ");
            value(ifExpr.thenBranch(), indent);
            out.append(" else ");
            value(ifExpr.elseBranch(), indent);
        } else if (value instanceof LetExpression let) {
            out.append("let ");
            letBinding(let.binding());
            out.append(" = ");
            value(let.value(), indent);
            out.append(" in ");
            value(let.body(), indent);
        } else if (value instanceof DoExpression doExpr) {
            out.append("do { ");
            separated(doExpr.elements(), " ; ", element -> doElement(element, indent));
            out.append(" }");
        } else if (value instanceof PropertyAccess access) {
            value(access.source(), indent);
            out.append('.').append(access.propertyName());
        } else if (value instanceof ObjectUpdate update) {
            value(update.source(), indent);
            out.append(' ');
            properties(update.updates(), " = ", indent);
        } else if (value instanceof BinaryExpression binary) {
            value(binary.left(), indent);
            out.append(' ').append(operator(binary.operator())).append(' ');
            value(binary.right(), indent);
        } else if (value instanceof TypedValue typed) {
            value(typed.value(), indent);
            out.append(" :: ");
            polyType(typed.type());
        } else if (value instanceof ParenthesizedExpr parens) {
            out.append('(');
            value(parens.value(), indent);
            out.append(')');
        } else {
            throw new IllegalArgumentException("Unknown value: " + value);
        }
    }

    private void caseExpression(CaseExpression caseExpr, int indent) {
        int alternativeIndent = indent + INDENT_STEP;
        out.append("case ");
        value(caseExpr.scrutinee(), indent);
        out.append(" of");
        for (CaseAlternative alternative : caseExpr.alternatives()) {
            out.append('\n').append(" ".repeat(alternativeIndent));
            binder(alternative.binder());
            alternative.guard().ifPresent(guard -> {
                out.append(" | ");
                value(guard.condition(), alternativeIndent);
            });
            out.append(" -> ");
            value(alternative.result(), alternativeIndent);
        }
    }

    private void doElement(DoNotationElement element, int indent) {
        if (element instanceof DoNotationBind bind) {
            binder(bind.binder());
            out.append(" <- ");
            value(bind.value(), indent);
        } else if (element instanceof DoNotationLet let) {
            out.append("let ");
            binder(let.binder());
            out.append(" = ");
            value(let.value(), indent);
        } else {
            value(((DoNotationValue) element).value(), indent);
        }
    }

    private void properties(List<PropertyValue> properties, String separator, int indent) {
        if (properties.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{ ");
        separated(properties, ", ", property -> {
            out.append(property.name()).append(separator);
            value(property.value(), indent);
        });
        out.append(" }");
    }

    private void letBinding(LetBinding binding) {
        if (binding instanceof LetBinding.Function function) {
            out.append(function.name());
            for (Argument argument : function.arguments()) {
                out.append(' ');
                argument(argument);
            }
        } else {
            binder(((LetBinding.Destructure) binding).binder());
        }
    }

    private void argument(Argument argument) {
        if (argument instanceof Argument.Named named) {
            out.append(named.name());
        } else {
            Binder binder = ((Argument.Pattern) argument).binder();
            // a bare name would read back as a plain argument
            if (binder instanceof VarBinder) {
                out.append('(');
                binder(binder);
                out.append(')');
            } else {
                binderNoParens(binder);
            }
        }
    }

    private static String operator(String name) {
        char first = name.charAt(0);
        return Character.isLetter(first) || first == '_' ? "`" + name + "`" : name;
    }

    // ==================== Binders ====================

    private void binder(Binder binder) {
        if (binder instanceof ConsBinder cons) {
            if (cons.head() instanceof ConsBinder || cons.head() instanceof NamedBinder) {
                parenthesized(cons.head());
            } else {
                binderAtom(cons.head());
            }
            out.append(" : ");
            binder(cons.tail());
        } else {
            binderAtom(binder);
        }
    }

    private void binderAtom(Binder binder) {
        if (binder instanceof NullBinder) {
            out.append('_');
        } else if (binder instanceof StringBinder string) {
            out.append(quote(string.value()));
        } else if (binder instanceof BooleanBinder bool) {
            out.append(bool.value());
        } else if (binder instanceof NumberBinder numeric) {
            out.append(number(numeric.value()));
        } else if (binder instanceof VarBinder variable) {
            out.append(variable.name());
        } else if (binder instanceof NamedBinder named) {
            out.append(named.name()).append('@');
            binder(named.binder());
        } else if (binder instanceof ConstructorBinder constructor) {
            out.append(constructor.constructor());
            for (Binder argument : constructor.arguments()) {
                out.append(' ');
                binderNoParens(argument);
            }
        } else if (binder instanceof ObjectBinder object) {
            if (object.properties().isEmpty()) {
                out.append("{}");
                return;
            }
            out.append("{ ");
            separated(object.properties(), ", ", (PropertyBinder property) -> {
                out.append(property.name()).append(" = ");
                binder(property.binder());
            });
            out.append(" }");
        } else if (binder instanceof ArrayBinder array) {
            out.append('[');
            separated(array.elements(), ", ", this::binder);
            out.append(']');
        } else if (binder instanceof ConsBinder) {
            parenthesized(binder);
        } else {
            throw new IllegalArgumentException("Unknown binder: " + binder);
        }
    }

    private void binderNoParens(Binder binder) {
        boolean bare = binder instanceof NullBinder
                || binder instanceof StringBinder
                || binder instanceof BooleanBinder
                || binder instanceof NumberBinder
                || binder instanceof VarBinder
                || binder instanceof ObjectBinder
                || binder instanceof ArrayBinder
                || (binder instanceof ConstructorBinder constructor && constructor.arguments().isEmpty());
        if (bare) {
            binderAtom(binder);
        } else {
            parenthesized(binder);
        }
    }

    private void parenthesized(Binder binder) {
        out.append('(');
        binder(binder);
        out.append(')');
    }

    // ==================== Types ====================

    private void polyType(Type type) {
        if (type instanceof ForAll forAll) {
            out.append("forall ").append(String.join(" ", forAll.variables())).append(". ");
            type(forAll.body());
        } else {
            type(type);
        }
    }

    private void type(Type type) {
        if (type instanceof FunctionType function) {
            typeOperand(function.argument(), function.argument() instanceof FunctionType);
            out.append(" -> ");
            type(function.result());
        } else if (type instanceof TypeApp application) {
            typeOperand(application.function(), application.function() instanceof FunctionType);
            out.append(' ');
            typeOperand(application.argument(),
                    application.argument() instanceof TypeApp || application.argument() instanceof FunctionType);
        } else {
            typeAtom(type);
        }
    }

    private void typeOperand(Type type, boolean needsParens) {
        if (needsParens || type instanceof ForAll) {
            out.append('(');
            polyType(type);
            out.append(')');
        } else {
            type(type);
        }
    }

    private void typeAtom(Type type) {
        if (type instanceof TypeVar variable) {
            out.append(variable.name());
        } else if (type instanceof TypeConstructor constructor) {
            out.append(constructor.name());
        } else if (type instanceof ArrayType array) {
            out.append('[');
            polyType(array.element());
            out.append(']');
        } else if (type instanceof ObjectType object) {
            out.append('{');
            if (!object.fields().isEmpty()) {
                out.append(' ');
                separated(object.fields(), ", ", (RowField field) -> {
                    out.append(field.name()).append(" :: ");
                    polyType(field.type());
                });
            }
            object.rowTail().ifPresent(tail -> out.append(" | ").append(tail));
            out.append(object.fields().isEmpty() && object.rowTail().isEmpty() ? "}" : " }");
        } else if (type instanceof ForAll) {
            typeOperand(type, true);
        } else {
            throw new IllegalArgumentException("Unknown type: " + type);
        }
    }

    // ==================== Helpers ====================

    private <T> void separated(List<T> items, String separator, Consumer<T> printer) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            printer.accept(items.get(i));
        }
    }

    private static String number(Number number) {
        return number instanceof BigDecimal decimal ? decimal.toString() : number.toString();
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
