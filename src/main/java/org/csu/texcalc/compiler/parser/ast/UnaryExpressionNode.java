package org.csu.texcalc.compiler.parser.ast;

import org.csu.texcalc.compiler.parser.OperatorKind;

import java.util.Objects;

/**
 * AST 节点: 表示一个一元运算表达式 (e.g., -x 或 3!)
 */
public record UnaryExpressionNode(
        OperatorKind operator,
        ExpressionNode operand
) implements ExpressionNode {

    public UnaryExpressionNode {
        Objects.requireNonNull(operand, "operand");
        if (!operator.isUnary()) {
            throw new IllegalArgumentException("Not a unary operator: " + operator);
        }
    }
}
