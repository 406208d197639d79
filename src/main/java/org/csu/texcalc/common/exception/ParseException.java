package org.csu.texcalc.common.exception;

import lombok.Getter;
import org.csu.texcalc.compiler.lexer.Token;
import org.csu.texcalc.compiler.lexer.TokenType;

/**
 * 语法分析阶段的异常。携带错误类别以及检测到错误时的字符偏移量。
 */
@Getter
public class ParseException extends RuntimeException {

    private final ParseErrorKind kind;
    private final int position;

    public ParseException(ParseErrorKind kind, int position, String message) {
        super(String.format("Syntax Error at position %d: %s", position, message));
        this.kind = kind;
        this.position = position;
    }

    public ParseException(ParseErrorKind kind, Token token, String expected) {
        this(kind, token.position(), String.format("Expected %s, but found %s",
                expected, describe(token)));
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of input";
        }
        return String.format("'%s' (%s)", token.lexeme(), token.type());
    }
}
