package org.csu.texcalc.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 LaTeX 算术表达式分解为一系列的Token。
 * 词法分析器本身从不抛出异常：无法识别的字符统一产出 ILLEGAL Token，由语法分析器报告。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    // 紧跟在带下标变量之后的位置；该位置上若仍是字母或数字，说明下标超过了一个字符
    private int subscriptEnd = -1;

    // 反斜杠命令映射表，目前只支持 \cdot
    private static final Map<String, TokenType> commands = Map.of("cdot", TokenType.CDOT);

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，总是以 EOF 结尾
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        // x_ab 这类多字符下标不合法，第二个字符单独作为非法Token
        if (position == subscriptEnd && isLetterOrDigit(peek())) {
            return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(peek()));
        }

        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", position);
        }

        char currentChar = peek();

        // 识别变量
        if (isLetter(currentChar)) {
            return readVariable();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别反斜杠命令
        if (currentChar == '\\') {
            return readCommand();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '^':
                return consumeAndReturn(TokenType.CARET, "^");
            case '!':
                return consumeAndReturn(TokenType.BANG, "!");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            default:
                return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(currentChar));
        }
    }

    private Token readVariable() {
        int startPos = position;
        advance(); // 变量名只有一个字母
        if (peek() == '_' && isLetterOrDigit(peekNext())) {
            advance(); // 消耗掉 '_'
            advance(); // 消耗掉下标字符
            subscriptEnd = position;
        }
        // 单独的 '_' 留在原处，下一次会被识别为 ILLEGAL
        return new Token(TokenType.VARIABLE, input.substring(startPos, position), startPos);
    }

    private Token readNumber() {
        int startPos = position;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 小数点后面必须还有数字，否则 '.' 不属于这个数字
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, startPos);
    }

    private Token readCommand() {
        int startPos = position;
        advance(); // 跳过反斜杠
        while (position < input.length() && isLetter(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = commands.getOrDefault(text.substring(1), TokenType.ILLEGAL);
        return new Token(type, text, startPos);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        // 只有 ASCII 空格是空白字符
        while (position < input.length() && peek() == ' ') {
            advance();
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, position);
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
