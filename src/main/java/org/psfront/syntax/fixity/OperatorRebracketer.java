package org.psfront.syntax.fixity;

import org.psfront.syntax.ast.Application;
import org.psfront.syntax.ast.BinaryExpression;
import org.psfront.syntax.ast.Value;
import org.psfront.syntax.ast.VariableExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Re-associates unresolved operator chains once fixities are known.
 *
 * The parser leaves {@code a + b * c} as a precedence-unaware chain of
 * {@link BinaryExpression} nodes. This pass flattens each maximal chain
 * (parentheses delimit chains) and rebuilds it by precedence into plain
 * applications: {@code a + b * c} with + at 6 and * at 7 becomes
 * {@code (+) a ((*) b c)}.
 */
public final class OperatorRebracketer extends ValueRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorRebracketer.class);

    private final FixityTable fixities;

    public OperatorRebracketer(FixityTable fixities) {
        this.fixities = fixities;
    }

    public static Value rebracket(Value value, FixityTable fixities) {
        return new OperatorRebracketer(fixities).rewrite(value);
    }

    @Override
    public Value rewrite(Value value) {
        if (!(value instanceof BinaryExpression binary)) {
            return super.rewrite(value);
        }

        List<Value> operands = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        flatten(binary, operands, operators);

        List<Value> rewritten = new ArrayList<>(operands.size());
        for (Value operand : operands) {
            rewritten.add(rewrite(operand));
        }
        LOGGER.debug("Rebracketing chain of {} operators: {}", operators.size(), operators);
        return resolve(rewritten, operators);
    }

    private static void flatten(Value value, List<Value> operands, List<String> operators) {
        if (value instanceof BinaryExpression binary) {
            flatten(binary.left(), operands, operators);
            operators.add(binary.operator());
            flatten(binary.right(), operands, operators);
        } else {
            operands.add(value);
        }
    }

    // operator-precedence parse over the flattened chain
    private Value resolve(List<Value> operands, List<String> operators) {
        Deque<Value> output = new ArrayDeque<>();
        Deque<String> pending = new ArrayDeque<>();

        output.push(operands.get(0));
        for (int i = 0; i < operators.size(); i++) {
            String incoming = operators.get(i);
            while (!pending.isEmpty() && reducesBefore(pending.peek(), incoming)) {
                reduce(output, pending.pop());
            }
            pending.push(incoming);
            output.push(operands.get(i + 1));
        }
        while (!pending.isEmpty()) {
            reduce(output, pending.pop());
        }
        return output.pop();
    }

    private boolean reducesBefore(String stacked, String incoming) {
        Fixity left = fixities.fixityOf(stacked);
        Fixity right = fixities.fixityOf(incoming);
        if (left.precedence() != right.precedence()) {
            return left.precedence() > right.precedence();
        }
        if (left.associativity() != right.associativity() || left.associativity() == Associativity.NONE) {
            throw new FixityException("Cannot mix '" + stacked + "' (" + describe(left) + ") and '"
                    + incoming + "' (" + describe(right) + ") in the same infix expression");
        }
        return left.associativity() == Associativity.LEFT;
    }

    private static void reduce(Deque<Value> output, String operator) {
        Value right = output.pop();
        Value left = output.pop();
        output.push(new Application(new Application(VariableExpr.of(operator), left), right));
    }

    private static String describe(Fixity fixity) {
        String keyword = switch (fixity.associativity()) {
            case LEFT -> "infixl";
            case RIGHT -> "infixr";
            case NONE -> "infix";
        };
        return keyword + " " + fixity.precedence();
    }
}
