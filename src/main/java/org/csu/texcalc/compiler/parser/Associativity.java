package org.csu.texcalc.compiler.parser;

/**
 * 同一优先级运算符连用时的结合方向。
 */
public enum Associativity {
    LEFT,
    RIGHT
}
