package org.csu.texcalc.compiler.parser.ast;

/**
 * 表达式树节点的公共接口。
 * 节点在构造后不可变，子节点只被父节点独占持有，整棵树无环且只有一个根。
 */
public interface ExpressionNode {
}
