package com.workflow;

import com.workflow.command.CommandConditionBuilder;
import com.workflow.command.CommandTrigger;
import com.workflow.command.CommandTriggerFactory;
import com.workflow.condition.ConditionNode;
import com.workflow.config.ConditionExpressionParser;
import com.workflow.render.ExpressionLineBreaker;
import com.workflow.render.ExpressionWrapper;
import com.workflow.spring.EnableConditionCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating condition compilation.
 * Each argument is parsed as a condition expression; without arguments a sample
 * slash command trigger is compiled.
 */
@SpringBootApplication
@EnableConditionCompiler
public class ConditionCompilerApplication {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompilerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ConditionCompilerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(CommandConditionBuilder commandConditionBuilder,
                                  ExpressionLineBreaker lineBreaker) {
        return args -> {
            if (args.length == 0) {
                CommandTrigger trigger = CommandTriggerFactory.fromFrontmatter(Map.of(
                        "slash_command", Map.of("name", "bot", "events", List.of("issues", "issue_comment")),
                        "schedule", List.of(Map.of("cron", "0 9 * * 1"))));
                print("/bot", trigger.toCondition(commandConditionBuilder), lineBreaker);
                return;
            }

            for (String arg : args) {
                ConditionNode node = ConditionExpressionParser.parse(ExpressionWrapper.strip(arg));
                print(arg, node, lineBreaker);
            }
        };
    }

    private static void print(String source, ConditionNode node, ExpressionLineBreaker lineBreaker) {
        log.info("=== {} ===", source);
        for (String line : lineBreaker.breakLongExpression(node.render())) {
            log.info("  {}", line);
        }
    }
}
