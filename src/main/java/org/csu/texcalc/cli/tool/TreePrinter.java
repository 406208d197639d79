package org.csu.texcalc.cli.tool;

import org.csu.texcalc.compiler.parser.ast.*;

import java.util.List;

/**
 * 一个可重用的工具类，用于把表达式树格式化为带缩进的控制台树形图，方便调试。
 *
 * <pre>
 * MULTIPLY
 * +-- Literal 2
 * `-- Variable x
 * </pre>
 */
public class TreePrinter {

    public static String print(ExpressionNode root) {
        StringBuilder sb = new StringBuilder();
        sb.append(label(root)).append("\n");
        appendChildren(sb, root, "");
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, ExpressionNode node, String indent) {
        List<ExpressionNode> children = childrenOf(node);
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            ExpressionNode child = children.get(i);
            sb.append(indent).append(last ? "`-- " : "+-- ").append(label(child)).append("\n");
            appendChildren(sb, child, indent + (last ? "    " : "|   "));
        }
    }

    private static String label(ExpressionNode node) {
        if (node instanceof LiteralNode literal) {
            return "Literal " + literal.value().toPlainString();
        }
        if (node instanceof VariableNode variable) {
            return "Variable " + variable.getName();
        }
        if (node instanceof UnaryExpressionNode unary) {
            return unary.operator().name();
        }
        if (node instanceof BinaryExpressionNode binary) {
            return binary.operator().name();
        }
        return node.getClass().getSimpleName();
    }

    private static List<ExpressionNode> childrenOf(ExpressionNode node) {
        if (node instanceof UnaryExpressionNode unary) {
            return List.of(unary.operand());
        }
        if (node instanceof BinaryExpressionNode binary) {
            return List.of(binary.left(), binary.right());
        }
        return List.of();
    }
}
