package org.csu.texcalc.compiler.parser;

import org.csu.texcalc.compiler.lexer.Token;
import org.csu.texcalc.compiler.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * @description: 运算符分类器
 *
 * 把运算符 Token 映射为 {@link OperatorKind}。位置 (前缀/中缀/后缀) 由调用方传入。
 * '*'、'\cdot' 以及隐式乘法都归为同一个 MULTIPLY，它们只在写法上不同。
 */
public final class OperatorClassifier {

    private static final Map<Fixity, Map<TokenType, OperatorKind>> operators = new EnumMap<>(Fixity.class);

    static {
        Map<TokenType, OperatorKind> prefix = new EnumMap<>(TokenType.class);
        prefix.put(TokenType.MINUS, OperatorKind.NEGATE);

        Map<TokenType, OperatorKind> infix = new EnumMap<>(TokenType.class);
        infix.put(TokenType.PLUS, OperatorKind.ADD);
        infix.put(TokenType.MINUS, OperatorKind.SUBTRACT);
        infix.put(TokenType.ASTERISK, OperatorKind.MULTIPLY);
        infix.put(TokenType.CDOT, OperatorKind.MULTIPLY);
        infix.put(TokenType.SLASH, OperatorKind.DIVIDE);
        infix.put(TokenType.CARET, OperatorKind.POWER);

        Map<TokenType, OperatorKind> postfix = new EnumMap<>(TokenType.class);
        postfix.put(TokenType.BANG, OperatorKind.FACTORIAL);

        operators.put(Fixity.PREFIX, prefix);
        operators.put(Fixity.INFIX, infix);
        operators.put(Fixity.POSTFIX, postfix);
    }

    private OperatorClassifier() {
    }

    /**
     * @param token 当前 Token
     * @param fixity 调用点所处的位置
     * @return 对应的运算符种类；该位置上这个 Token 不是运算符时返回 null
     */
    public static OperatorKind classify(Token token, Fixity fixity) {
        return operators.get(fixity).get(token.type());
    }

    public static boolean isOperator(Token token) {
        for (Map<TokenType, OperatorKind> table : operators.values()) {
            if (table.containsKey(token.type())) {
                return true;
            }
        }
        return false;
    }
}
