package org.csu.texcalc.compiler.parser;

import org.csu.texcalc.common.exception.ParseErrorKind;
import org.csu.texcalc.common.exception.ParseException;
import org.csu.texcalc.compiler.lexer.Token;
import org.csu.texcalc.compiler.lexer.TokenType;
import org.csu.texcalc.compiler.parser.ast.*;

import java.util.List;

/**
 * @description: 语法分析器
 * 基本单元 (数字、变量、括号、隐式乘法) 用递归下降识别，
 * 运算符之间的优先级与结合性用优先级爬升法 (precedence climbing) 决定，
 * 最终将Token流转换为一棵单根的表达式树。
 *
 * 解析是全有或全无的：出错时抛出 {@link ParseException}，不会返回部分结果。
 * 一个 Parser 实例只解析一次，不在线程之间共享。
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final List<Token> tokens;
    private final int maxDepth;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * 解析整个输入。表达式之后不允许有剩余的Token。
     * @return 表达式树的根节点
     */
    public ExpressionNode parse() {
        ExpressionNode expression = parseExpression(0);
        if (!isAtEnd()) {
            Token token = peek();
            if (token.type() == TokenType.RPAREN) {
                throw new ParseException(ParseErrorKind.UNMATCHED_PAREN, token.position(),
                        "')' has no matching '('");
            }
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token, "an operator or end of input");
        }
        return expression;
    }

    /**
     * 优先级爬升：先解析一个带前缀的基本单元，然后只要下一个中缀运算符的优先级不低于阈值就继续吸收。
     * @param minPrecedence 本层允许吸收的最低优先级
     */
    private ExpressionNode parseExpression(int minPrecedence) {
        enter();
        try {
            ExpressionNode left = parseUnary();
            while (true) {
                OperatorKind operator = OperatorClassifier.classify(peek(), Fixity.INFIX);
                if (operator == null || operator.getPrecedence() < minPrecedence) {
                    break;
                }
                advance();
                ExpressionNode right = parseExpression(operator.rightOperandThreshold());
                left = new BinaryExpressionNode(left, operator, right);
            }
            return left;
        } finally {
            leave();
        }
    }

    private ExpressionNode parseUnary() {
        // 处在前缀位置的 '-' 左边没有可以结合的操作数，只能是取负
        if (OperatorClassifier.classify(peek(), Fixity.PREFIX) == OperatorKind.NEGATE) {
            advance();
            // 取负的操作数可以包含乘方和阶乘，但不包含乘除和加减: -a^2 = -(a^2)
            ExpressionNode operand = parseExpression(OperatorKind.NEGATE.getPrecedence());
            return new UnaryExpressionNode(OperatorKind.NEGATE, operand);
        }
        return parsePostfix();
    }

    private ExpressionNode parsePostfix() {
        ExpressionNode node = parseAtom();
        // '!' 只作用于紧挨着的基本单元，先于任何中缀运算符: 3!^2 = (3!)^2
        while (OperatorClassifier.classify(peek(), Fixity.POSTFIX) == OperatorKind.FACTORIAL) {
            advance();
            node = new UnaryExpressionNode(OperatorKind.FACTORIAL, node);
        }
        return node;
    }

    private ExpressionNode parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
            case VARIABLE:
                return parseImplicitMultiplication();
            case LPAREN:
                return parseParenExpression();
            case BANG:
                throw new ParseException(ParseErrorKind.INVALID_FACTORIAL_POSITION, token.position(),
                        "'!' must directly follow a number, variable or parenthesized group");
            case ILLEGAL:
                throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token, "a number, a variable or '('");
            default:
                throw new ParseException(ParseErrorKind.EXPECTED_ATOM, token, "a number, a variable or '('");
        }
    }

    /**
     * 数字或变量之后紧跟的变量和括号都视为隐式乘法的因子，贪婪地吸收并立即左结合折叠:
     * 2xy = (2 * x) * y。两个裸数字之间不构成隐式乘法。
     */
    private ExpressionNode parseImplicitMultiplication() {
        ExpressionNode product = parseSimpleAtom();
        while (check(TokenType.VARIABLE) || check(TokenType.LPAREN)) {
            ExpressionNode factor = check(TokenType.LPAREN)
                    ? parseParenExpression()
                    : parseSimpleAtom();
            product = new BinaryExpressionNode(product, OperatorKind.MULTIPLY, factor);
        }
        return product;
    }

    private ExpressionNode parseSimpleAtom() {
        Token token = advance();
        if (token.type() == TokenType.NUMBER) {
            return new LiteralNode(token.lexeme());
        }
        return VariableNode.fromLexeme(token.lexeme());
    }

    private ExpressionNode parseParenExpression() {
        Token open = consume(TokenType.LPAREN, "'('");
        if (isAtEnd()) {
            throw new ParseException(ParseErrorKind.UNMATCHED_PAREN, peek().position(),
                    "'(' at position " + open.position() + " is never closed");
        }
        ExpressionNode inner = parseExpression(0);
        if (check(TokenType.RPAREN)) {
            advance();
            return inner;
        }
        Token token = peek();
        if (token.type() == TokenType.ILLEGAL) {
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token, "an operator or ')'");
        }
        throw new ParseException(ParseErrorKind.UNMATCHED_PAREN, token,
                "')' to close '(' at position " + open.position());
    }

    // --- 嵌套深度保护 ---

    private void enter() {
        if (++depth > maxDepth) {
            throw new ParseException(ParseErrorKind.NESTING_TOO_DEEP, peek().position(),
                    "Expression nesting exceeds the maximum depth of " + maxDepth);
        }
    }

    private void leave() {
        depth--;
    }

    // --- 辅助方法 ---

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
