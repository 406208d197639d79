package org.csu.texcalc.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 这是我们支持的 LaTeX 算术子集中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 常量与变量 ----
    NUMBER,     // 十进制数, e.g., 12 或 3.14
    VARIABLE,   // 单个字母, 可带一个下标, e.g., x 或 x_1

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    MINUS,      // - (前缀取负或中缀减法，由语法分析器根据位置决定)
    ASTERISK,   // *
    CDOT,       // \cdot
    SLASH,      // /
    CARET,      // ^
    BANG,       // ! 阶乘

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF,        // End-Of-File，表示输入流结束
    ILLEGAL     // 非法字符，用于错误处理
}
