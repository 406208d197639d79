package org.csu.texcalc.cli;

import org.csu.texcalc.engine.ExpressionProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.stream.Collectors;

/**
 * 控制台入口。
 * 带参数启动时逐个解析命令行上的表达式；不带参数时进入交互模式，每行一个表达式，输入 exit 退出。
 */
@Component
public class ShellRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellRunner.class);

    private final ExpressionProcessor processor;
    private final boolean showTree;
    private final InputStream in;
    private final PrintStream out;

    @Autowired
    public ShellRunner(ExpressionProcessor processor,
                       @Value("${texcalc.shell.show-tree:true}") boolean showTree) {
        this(processor, showTree, System.in, System.out);
    }

    ShellRunner(ExpressionProcessor processor, boolean showTree, InputStream in, PrintStream out) {
        this.processor = processor;
        this.showTree = showTree;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        // Spring 自己的 --key=value 参数不是表达式
        List<String> expressions = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());

        if (!expressions.isEmpty()) {
            log.debug("Parsing {} expression(s) from the command line", expressions.size());
            for (String expression : expressions) {
                evaluate(expression);
            }
            return;
        }
        runInteractive();
    }

    private void runInteractive() {
        log.info("Interactive shell started (max nesting depth {})", processor.getMaxDepth());
        out.println("Enter a LaTeX expression. Type 'exit' to quit.");
        Scanner scanner = new Scanner(in);
        while (true) {
            out.print("texcalc> ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String line = scanner.nextLine().trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                break;
            }
            evaluate(line);
        }
        out.println("Bye!");
    }

    private void evaluate(String expression) {
        String result = processor.executeAndGetResult(expression, showTree);
        if (result.startsWith("ERROR")) {
            log.debug("Rejected expression '{}'", expression);
        }
        out.println(result);
        out.println();
    }
}
