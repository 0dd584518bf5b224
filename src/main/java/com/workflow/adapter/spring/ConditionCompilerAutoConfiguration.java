package com.workflow.adapter.spring;

import com.workflow.command.CommandConditionBuilder;
import com.workflow.command.CommentEventTable;
import com.workflow.config.ConfigLoader;
import com.workflow.exception.ConfigurationException;
import com.workflow.render.ExpressionLineBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the condition compiler.
 */
@Configuration
@ConditionalOnProperty(prefix = "condition-compiler", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ConditionCompilerProperties.class)
public class ConditionCompilerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompilerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CommentEventTable commentEventTable(ConditionCompilerProperties properties) {
        return ConfigLoader.loadCommentEvents(properties.getEventTablePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandConditionBuilder commandConditionBuilder(CommentEventTable eventTable) {
        log.info("Creating CommandConditionBuilder over {}", eventTable);
        return new CommandConditionBuilder(eventTable);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionLineBreaker expressionLineBreaker(ConditionCompilerProperties properties) {
        try {
            return new ExpressionLineBreaker(properties.getMaxLineLength(), properties.getBreakThreshold());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid condition-compiler line lengths: " + e.getMessage(), e);
        }
    }
}
