package org.csu.texcalc.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个变量，由一个字母和可选的单字符下标组成，如 "x" 或 "x_1"。
 * 有下标与无下标的变量是不同的标识，x 与 x_1 永远不会被视为同一个变量。
 */
public record VariableNode(char letter, Character subscript) implements ExpressionNode {

    // 构造函数 for simple variable (e.g., "x")
    public VariableNode(char letter) {
        this(letter, null);
    }

    /**
     * 从词素构造，例如 "x" 或 "x_1"。
     */
    public static VariableNode fromLexeme(String lexeme) {
        Objects.requireNonNull(lexeme, "lexeme");
        if (lexeme.length() == 3 && lexeme.charAt(1) == '_') {
            return new VariableNode(lexeme.charAt(0), lexeme.charAt(2));
        }
        return new VariableNode(lexeme.charAt(0));
    }

    public boolean hasSubscript() {
        return subscript != null;
    }

    public String getName() {
        return hasSubscript() ? letter + "_" + subscript : String.valueOf(letter);
    }

    @Override
    public String toString() {
        return "VariableNode[" + getName() + "]";
    }
}
