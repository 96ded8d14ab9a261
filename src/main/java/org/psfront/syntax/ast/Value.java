package org.psfront.syntax.ast;

/**
 * Sealed interface representing expressions in the AST.
 *
 * Type hierarchy:
 * Value
 * ├── literals (NumericLiteral, StringLiteral, BooleanLiteral, ArrayLiteral, ObjectLiteral)
 * ├── references (VariableExpr, ConstructorExpr)
 * ├── binding forms (LambdaExpression, LetExpression, CaseExpression, DoExpression)
 * ├── IfExpression, Application
 * ├── postfix forms (PropertyAccess, ObjectUpdate, TypedValue)
 * └── BinaryExpression, ParenthesizedExpr
 *
 * Nodes are immutable and built bottom-up by the parser.
 */
public sealed interface Value
        permits NumericLiteral, StringLiteral, BooleanLiteral, ArrayLiteral, ObjectLiteral,
        LambdaExpression, VariableExpr, ConstructorExpr, Application, CaseExpression,
        IfExpression, LetExpression, DoExpression, PropertyAccess, ObjectUpdate,
        BinaryExpression, TypedValue, ParenthesizedExpr {
}
