package org.csu.texcalc.cli.tool;

import org.csu.texcalc.compiler.parser.Associativity;
import org.csu.texcalc.compiler.parser.OperatorKind;
import org.csu.texcalc.compiler.parser.ast.*;

/**
 * 将表达式树重新渲染为文本。两种形式重新解析后都得到结构相同的树。
 */
public class ExpressionFormatter {

    // 字面量和变量不需要任何括号
    private static final int ATOM_PRECEDENCE = Integer.MAX_VALUE;

    /**
     * 规范形式：每个运算都显式写出运算符并加上括号，例如 ((2 * x) + 1)。
     */
    public static String format(ExpressionNode node) {
        if (node instanceof LiteralNode literal) {
            return literal.value().toPlainString();
        }
        if (node instanceof VariableNode variable) {
            return variable.getName();
        }
        if (node instanceof UnaryExpressionNode unary) {
            return switch (unary.operator()) {
                case NEGATE -> "(-" + format(unary.operand()) + ")";
                case FACTORIAL -> "(" + format(unary.operand()) + "!)";
                default -> throw new IllegalStateException("Unexpected unary operator: " + unary.operator());
            };
        }
        if (node instanceof BinaryExpressionNode binary) {
            return "(" + format(binary.left()) + " " + binary.operator().getSymbol() + " "
                    + format(binary.right()) + ")";
        }
        throw new UnsupportedOperationException("Unsupported expression type: " + node.getClass().getSimpleName());
    }

    /**
     * LaTeX 形式：乘法写作 \cdot，数字后面的变量或括号直接并列 (2x, 2(x + 1))，
     * 只在优先级或结合性需要时才加括号。
     */
    public static String toLatex(ExpressionNode node) {
        if (node instanceof LiteralNode || node instanceof VariableNode) {
            return format(node);
        }
        if (node instanceof UnaryExpressionNode unary) {
            OperatorKind operator = unary.operator();
            String operand = wrap(unary.operand(), precedenceOf(unary.operand()) < operator.getPrecedence());
            return operator == OperatorKind.NEGATE ? "-" + operand : operand + "!";
        }
        if (node instanceof BinaryExpressionNode binary) {
            OperatorKind operator = binary.operator();
            int leftPrecedence = precedenceOf(binary.left());
            int rightPrecedence = precedenceOf(binary.right());
            boolean rightAssociative = operator.getAssociativity() == Associativity.RIGHT;

            boolean leftParens = leftPrecedence < operator.getPrecedence()
                    || (leftPrecedence == operator.getPrecedence() && rightAssociative);
            boolean rightParens = rightPrecedence < operator.getPrecedence()
                    || (rightPrecedence == operator.getPrecedence() && !rightAssociative);

            String left = wrap(binary.left(), leftParens);
            String right = wrap(binary.right(), rightParens);

            return switch (operator) {
                case MULTIPLY -> {
                    // 和原始输入一样，数字紧跟变量或括号时省略乘号
                    if (binary.left() instanceof LiteralNode
                            && (binary.right() instanceof VariableNode || rightParens)) {
                        yield left + right;
                    }
                    yield left + " \\cdot " + right;
                }
                case POWER -> left + "^" + right;
                default -> left + " " + operator.getSymbol() + " " + right;
            };
        }
        throw new UnsupportedOperationException("Unsupported expression type: " + node.getClass().getSimpleName());
    }

    private static String wrap(ExpressionNode node, boolean parens) {
        String text = toLatex(node);
        return parens ? "(" + text + ")" : text;
    }

    private static int precedenceOf(ExpressionNode node) {
        if (node instanceof UnaryExpressionNode unary) {
            return unary.operator().getPrecedence();
        }
        if (node instanceof BinaryExpressionNode binary) {
            return binary.operator().getPrecedence();
        }
        return ATOM_PRECEDENCE;
    }
}
