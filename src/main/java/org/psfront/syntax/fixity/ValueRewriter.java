package org.psfront.syntax.fixity;

import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.ArrayLiteral;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.CaseAlternative;
import org.psfront.syntax.ast.CaseExpression;
import org.psfront.syntax.ast.DoExpression;
import org.psfront.syntax.ast.DoNotationBind;
import org.psfront.syntax.ast.DoNotationElement;
import org.psfront.syntax.ast.DoNotationLet;
import org.psfront.syntax.ast.DoNotationValue;
import org.psfront.syntax.ast.Guard;
import org.psfront.syntax.ast.IfExpression;
import org.psfront.syntax.ast.LambdaExpression;
import org.psfront.syntax.ast.LetExpression;
import org.psfront.syntax.ast.ObjectLiteral;
import org.psfront.syntax.ast.ObjectUpdate;
import org.psfront.syntax.ast.ParenthesizedExpr;
import org.psfront.syntax.ast.PropertyAccess;
import org.psfront.syntax.ast.PropertyValue;
import org.psfront.syntax.ast.TypedValue;
import org.psfront.syntax.ast.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bottom-up rewrite of a value tree. Children are rewritten first, then
 * {@link #rewriteNode(Value)} sees the rebuilt node. Nodes are never mutated;
 * a new tree is returned.
 */
public class ValueRewriter {

    public Value rewrite(Value value) {
        return rewriteNode(rewriteChildren(value));
    }

    /**
     * Hook applied to every node after its children. Identity by default.
     */
    protected Value rewriteNode(Value value) {
        return value;
    }

    protected Value rewriteChildren(Value value) {
        if (value instanceof ArrayLiteral array) {
            return new ArrayLiteral(rewriteAll(array.elements()));
        }
        if (value instanceof ObjectLiteral object) {
            return new ObjectLiteral(rewriteProperties(object.properties()));
        }
        if (value instanceof LambdaExpression lambda) {
            return new LambdaExpression(lambda.argument(), rewrite(lambda.body()));
        }
        if (value instanceof Application application) {
            return new Application(rewrite(application.function()), rewrite(application.argument()));
        }
        if (value instanceof CaseExpression caseExpr) {
            return new CaseExpression(rewrite(caseExpr.scrutinee()),
                    caseExpr.alternatives().stream().map(this::rewriteAlternative).collect(Collectors.toList()));
        }
        if (value instanceof IfExpression ifExpr) {
            return new IfExpression(rewrite(ifExpr.condition()), rewrite(ifExpr.thenBranch()),
                    rewrite(ifExpr.elseBranch()));
        }
        if (value instanceof LetExpression let) {
            return new LetExpression(let.binding(), rewrite(let.value()), rewrite(let.body()));
        }
        if (value instanceof DoExpression doExpr) {
            return new DoExpression(doExpr.elements().stream().map(this::rewriteElement).collect(Collectors.toList()));
        }
        if (value instanceof PropertyAccess access) {
            return new PropertyAccess(rewrite(access.source()), access.propertyName());
        }
        if (value instanceof ObjectUpdate update) {
            return new ObjectUpdate(rewrite(update.source()), rewriteProperties(update.updates()));
        }
        if (value instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.operator(), rewrite(binary.left()), rewrite(binary.right()));
        }
        if (value instanceof TypedValue typed) {
            return new TypedValue(typed.checked(), typed.type(), rewrite(typed.value()));
        }
        if (value instanceof ParenthesizedExpr parens) {
            return new ParenthesizedExpr(rewrite(parens.value()));
        }
        // literals and references have no children
        return value;
    }

    protected CaseAlternative rewriteAlternative(CaseAlternative alternative) {
        return new CaseAlternative(alternative.binder(),
                alternative.guard().map(guard -> new Guard(rewrite(guard.condition()))),
                rewrite(alternative.result()));
    }

    protected DoNotationElement rewriteElement(DoNotationElement element) {
        if (element instanceof DoNotationBind bind) {
            return new DoNotationBind(bind.binder(), rewrite(bind.value()));
        }
        if (element instanceof DoNotationLet let) {
            return new DoNotationLet(let.binder(), rewrite(let.value()));
        }
        return new DoNotationValue(rewrite(((DoNotationValue) element).value()));
    }

    private List<Value> rewriteAll(List<Value> values) {
        return values.stream().map(this::rewrite).collect(Collectors.toList());
    }

    private List<PropertyValue> rewriteProperties(List<PropertyValue> properties) {
        return properties.stream()
                .map(property -> new PropertyValue(property.name(), rewrite(property.value())))
                .collect(Collectors.toList());
    }
}
