package org.csu.texcalc.compiler.parser;

/**
 * 运算符相对于操作数的位置。由语法分析器的调用点给出，而不是从文本推断，
 * 因为 '-' 既可以是前缀也可以是中缀。
 */
public enum Fixity {
    PREFIX,
    INFIX,
    POSTFIX
}
