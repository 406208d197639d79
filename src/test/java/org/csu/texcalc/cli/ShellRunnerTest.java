package org.csu.texcalc.cli;

import org.csu.texcalc.engine.ExpressionProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ShellRunnerTest {

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private static InputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testCommandLineArguments() {
        ExpressionProcessor processor = Mockito.mock(ExpressionProcessor.class);
        when(processor.executeAndGetResult("2x", false)).thenReturn("Canonical: (2 * x)");
        when(processor.executeAndGetResult("2 2", false)).thenReturn("ERROR [UNEXPECTED_TOKEN]");

        ShellRunner runner = new ShellRunner(processor, false, input(""), out);
        runner.run("--spring.main.banner-mode=off", "2x", "2 2");

        verify(processor).executeAndGetResult("2x", false);
        verify(processor).executeAndGetResult("2 2", false);
        verify(processor, never()).executeAndGetResult(startsWith("--"), anyBoolean());
        assertTrue(output().contains("Canonical: (2 * x)"));
        assertTrue(output().contains("ERROR [UNEXPECTED_TOKEN]"));
        assertFalse(output().contains("texcalc>"));
    }

    @Test
    void testInteractiveSession() {
        ShellRunner runner = new ShellRunner(new ExpressionProcessor(), true,
                input("2x\n\n(1\nexit\n3!\n"), out);
        runner.run();

        String text = output();
        System.out.println(text);
        assertTrue(text.contains("texcalc> "));
        assertTrue(text.contains("Canonical: (2 * x)"));
        assertTrue(text.contains("`-- Variable x"));
        assertTrue(text.contains("ERROR [UNMATCHED_PAREN]"));
        // exit 之后的输入不再处理
        assertFalse(text.contains("(3!)"));
        assertTrue(text.trim().endsWith("Bye!"));
    }

    @Test
    void testInteractiveSessionEndsAtEndOfInput() {
        ShellRunner runner = new ShellRunner(new ExpressionProcessor(), false, input("a^b^c"), out);
        runner.run();
        assertTrue(output().contains("Canonical: (a ^ (b ^ c))"));
        assertTrue(output().trim().endsWith("Bye!"));
    }
}
