package org.csu.texcalc.compiler.parser;

import lombok.Getter;

/**
 * @description: 运算符种类。
 *
 * 每种运算符的元数、位置、优先级和结合性都是固定的，属于种类本身而不是某个实例。
 * 优先级数值越大结合越紧：阶乘 > 乘方 > 取负 > 乘除 > 加减。
 * 新增运算符时需要同时修改这里和 {@link OperatorClassifier} 的映射表。
 */
@Getter
public enum OperatorKind {
    ADD(Fixity.INFIX, 1, Associativity.LEFT, "+"),
    SUBTRACT(Fixity.INFIX, 1, Associativity.LEFT, "-"),
    MULTIPLY(Fixity.INFIX, 2, Associativity.LEFT, "*"),
    DIVIDE(Fixity.INFIX, 2, Associativity.LEFT, "/"),
    NEGATE(Fixity.PREFIX, 3, Associativity.RIGHT, "-"),
    POWER(Fixity.INFIX, 4, Associativity.RIGHT, "^"),
    FACTORIAL(Fixity.POSTFIX, 5, Associativity.LEFT, "!");

    private final Fixity fixity;
    private final int precedence;
    private final Associativity associativity;
    private final String symbol; // 规范文本形式中使用的写法

    OperatorKind(Fixity fixity, int precedence, Associativity associativity, String symbol) {
        this.fixity = fixity;
        this.precedence = precedence;
        this.associativity = associativity;
        this.symbol = symbol;
    }

    public boolean isUnary() {
        return fixity != Fixity.INFIX;
    }

    /**
     * 右操作数递归解析时使用的最低优先级阈值：右结合保持不变，左结合加一。
     */
    public int rightOperandThreshold() {
        return associativity == Associativity.RIGHT ? precedence : precedence + 1;
    }
}
