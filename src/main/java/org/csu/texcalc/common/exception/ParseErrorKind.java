package org.csu.texcalc.common.exception;

/**
 * 语法错误的分类。所有错误都在解析时同步产生，不可重试：调用方需要修正输入后重新提交。
 */
public enum ParseErrorKind {
    EXPECTED_ATOM,              // 运算符或作用域起点之后缺少操作数
    UNMATCHED_PAREN,            // 左括号或右括号缺少与之配对的另一半
    UNEXPECTED_TOKEN,           // 完整表达式之后仍有剩余输入，或出现了语法不允许的Token
    INVALID_FACTORIAL_POSITION, // '!' 前面没有紧挨着一个完整的基本单元
    NESTING_TOO_DEEP            // 嵌套深度超过上限
}
