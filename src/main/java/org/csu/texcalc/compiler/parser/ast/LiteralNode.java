package org.csu.texcalc.compiler.parser.ast;

import java.math.BigDecimal;

/**
 * AST 节点: 表示一个十进制数字面量 (如 2 或 3.14)
 * 保留原始的小数位数，"2.50" 与 "2.5" 是不同的字面量。
 */
public record LiteralNode(BigDecimal value) implements ExpressionNode {

    public LiteralNode(String lexeme) {
        this(new BigDecimal(lexeme));
    }

    @Override
    public String toString() {
        return "LiteralNode[" + value.toPlainString() + "]";
    }
}
