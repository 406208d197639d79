package org.csu.texcalc.cli;

import org.csu.texcalc.engine.ExpressionProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class TexCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(TexCalcApplication.class, args);
    }

    @Bean
    public ExpressionProcessor expressionProcessor(@Value("${texcalc.parser.max-depth:256}") int maxDepth) {
        return new ExpressionProcessor(maxDepth);
    }
}
