package org.csu.texcalc.engine;

import lombok.Getter;
import org.csu.texcalc.cli.tool.ExpressionFormatter;
import org.csu.texcalc.cli.tool.TreePrinter;
import org.csu.texcalc.common.exception.ParseException;
import org.csu.texcalc.compiler.lexer.Lexer;
import org.csu.texcalc.compiler.lexer.Token;
import org.csu.texcalc.compiler.parser.Parser;
import org.csu.texcalc.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * 表达式处理入口：文本 -> Token流 -> 表达式树。
 * 不持有任何可变状态，多个线程可以同时使用同一个实例。
 */
public class ExpressionProcessor {

    @Getter
    private final int maxDepth;

    public ExpressionProcessor() {
        this(Parser.DEFAULT_MAX_DEPTH);
    }

    public ExpressionProcessor(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public List<Token> tokenize(String input) {
        return new Lexer(input).tokenize();
    }

    /**
     * 解析一个完整的表达式。
     * @throws ParseException 输入不合法时抛出，携带错误类别和位置
     */
    public ExpressionNode parse(String input) {
        Parser parser = new Parser(tokenize(input), maxDepth);
        return parser.parse();
    }

    /**
     * 解析表达式并生成给控制台看的结果文本；语法错误也转成文本返回。
     */
    public String executeAndGetResult(String input, boolean showTree) {
        try {
            ExpressionNode ast = parse(input);
            StringBuilder sb = new StringBuilder();
            sb.append("Canonical: ").append(ExpressionFormatter.format(ast)).append("\n");
            sb.append("LaTeX:     ").append(ExpressionFormatter.toLatex(ast));
            if (showTree) {
                sb.append("\n").append(TreePrinter.print(ast).stripTrailing());
            }
            return sb.toString();
        } catch (ParseException e) {
            return formatError(input, e);
        }
    }

    public String executeAndGetResult(String input) {
        return executeAndGetResult(input, true);
    }

    /**
     * 把语法错误格式化为两行：错误信息，以及指向出错位置的插入符。
     */
    public static String formatError(String input, ParseException e) {
        return "ERROR [" + e.getKind() + "] " + e.getMessage() + "\n"
                + "  " + input + "\n"
                + "  " + " ".repeat(e.getPosition()) + "^";
    }
}
