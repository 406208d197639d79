package org.csu.texcalc.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param position 词法单元首字符在输入中的偏移量 (从0开始)
 */
public record Token(TokenType type, String lexeme, int position) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-8s, Lexeme='%s', Position=%d]",
                type, lexeme, position);
    }
}
