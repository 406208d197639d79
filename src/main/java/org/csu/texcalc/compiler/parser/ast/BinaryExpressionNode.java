package org.csu.texcalc.compiler.parser.ast;

import org.csu.texcalc.compiler.parser.OperatorKind;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., a + b)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        OperatorKind operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (operator.isUnary()) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
    }
}
