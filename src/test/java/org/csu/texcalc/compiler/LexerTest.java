package org.csu.texcalc.compiler;

import org.csu.texcalc.compiler.lexer.Lexer;
import org.csu.texcalc.compiler.lexer.Token;
import org.csu.texcalc.compiler.lexer.TokenType;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * @description: Lexer 类的单元测试 (使用 JUnit 4)
 */
public class LexerTest {

    private List<Token> tokenize(String input) {
        List<Token> tokens = new Lexer(input).tokenize();
        System.out.println("Input: " + input); // [日志] 打印输入
        System.out.println("Generated Tokens: " + tokens); // [日志] 打印生成的Token流
        return tokens;
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        // 断言：检查Token数量是否正确 (包括EOF)
        assertEquals("Token数量不匹配", expectedTypes.length, tokens.size());
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals("Token类型不匹配 at index " + i, expectedTypes[i], tokens.get(i).type());
        }
    }

    @Test
    public void testMixedExpression() {
        System.out.println("--- Running test: testMixedExpression ---");
        List<Token> tokens = tokenize("2x + 3.5 \\cdot y_1");

        assertTypes(tokens,
                TokenType.NUMBER, TokenType.VARIABLE, TokenType.PLUS, TokenType.NUMBER,
                TokenType.CDOT, TokenType.VARIABLE, TokenType.EOF);

        assertEquals("2", tokens.get(0).lexeme());
        assertEquals("x", tokens.get(1).lexeme());
        assertEquals("3.5", tokens.get(3).lexeme());
        assertEquals("\\cdot", tokens.get(4).lexeme());
        assertEquals(9, tokens.get(4).position());
        assertEquals("y_1", tokens.get(5).lexeme());
        assertEquals(15, tokens.get(5).position());
        // EOF 的位置就是输入长度
        assertEquals(18, tokens.get(6).position());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testOperatorsAndDelimiters() {
        System.out.println("--- Running test: testOperatorsAndDelimiters ---");
        List<Token> tokens = tokenize("-+*/^!()");
        assertTypes(tokens,
                TokenType.MINUS, TokenType.PLUS, TokenType.ASTERISK, TokenType.SLASH,
                TokenType.CARET, TokenType.BANG, TokenType.LPAREN, TokenType.RPAREN, TokenType.EOF);
        for (int i = 0; i < 8; i++) {
            assertEquals(i, tokens.get(i).position());
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testAdjacentLettersAreSeparateVariables() {
        List<Token> tokens = tokenize("xy");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.VARIABLE, TokenType.EOF);
        assertEquals("x", tokens.get(0).lexeme());
        assertEquals("y", tokens.get(1).lexeme());
    }

    @Test
    public void testSubscriptIsOneCharacter() {
        List<Token> tokens = tokenize("x_ab");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.ILLEGAL, TokenType.EOF);
        assertEquals("x_a", tokens.get(0).lexeme());
        assertEquals("b", tokens.get(1).lexeme());
        assertEquals(3, tokens.get(1).position());

        // 中间有空格时是两个独立的变量
        tokens = tokenize("x_a b");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.VARIABLE, TokenType.EOF);
    }

    @Test
    public void testDanglingUnderscore() {
        List<Token> tokens = tokenize("x_");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.ILLEGAL, TokenType.EOF);
        assertEquals("x", tokens.get(0).lexeme());
        assertEquals("_", tokens.get(1).lexeme());
    }

    @Test
    public void testTrailingDecimalPoint() {
        List<Token> tokens = tokenize("1.");
        assertTypes(tokens, TokenType.NUMBER, TokenType.ILLEGAL, TokenType.EOF);
        assertEquals("1", tokens.get(0).lexeme());
        assertEquals(".", tokens.get(1).lexeme());
    }

    @Test
    public void testIllegalCharacters() {
        System.out.println("--- Running test: testIllegalCharacters ---");
        // 只认识 \cdot 一个命令
        List<Token> tokens = tokenize("\\alpha + x");
        assertTypes(tokens, TokenType.ILLEGAL, TokenType.PLUS, TokenType.VARIABLE, TokenType.EOF);
        assertEquals("\\alpha", tokens.get(0).lexeme());

        // \cdot 后面直接跟字母会变成另一个命令
        tokens = tokenize("a\\cdotb");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.ILLEGAL, TokenType.EOF);

        // 只有 ASCII 空格是空白字符
        tokens = tokenize("x\ty");
        assertTypes(tokens, TokenType.VARIABLE, TokenType.ILLEGAL, TokenType.VARIABLE, TokenType.EOF);
        assertEquals("\t", tokens.get(1).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testEmptyAndBlankInput() {
        List<Token> tokens = tokenize("");
        assertTypes(tokens, TokenType.EOF);
        assertEquals(0, tokens.get(0).position());

        tokens = tokenize("   ");
        assertTypes(tokens, TokenType.EOF);
        assertEquals(3, tokens.get(0).position());
    }
}
