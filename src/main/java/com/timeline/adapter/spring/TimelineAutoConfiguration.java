package com.timeline.adapter.spring;

import com.timeline.assignment.DefaultRoleAssignmentEngine;
import com.timeline.assignment.RoleAssignmentEngine;
import com.timeline.config.ConfigLoader;
import com.timeline.config.SchedulingConfig;
import com.timeline.rule.DateRuleResolver;
import com.timeline.rule.DefaultDateRuleResolver;
import com.timeline.scheduler.ProjectScheduler;
import com.timeline.segment.TimelineSegmentBuilder;
import com.timeline.task.TaskDueDateCalculator;
import com.timeline.task.TaskGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the timeline engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "timeline", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TimelineProperties.class)
public class TimelineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TimelineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SchedulingConfig schedulingConfig(TimelineProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DateRuleResolver dateRuleResolver(SchedulingConfig config) {
        log.info("Creating DateRuleResolver from {} v{}", config.name(), config.version());
        return new DefaultDateRuleResolver(config.dateRules());
    }

    @Bean
    @ConditionalOnMissingBean
    public TimelineSegmentBuilder timelineSegmentBuilder(DateRuleResolver resolver) {
        return new TimelineSegmentBuilder(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleAssignmentEngine roleAssignmentEngine() {
        return new DefaultRoleAssignmentEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskGenerator taskGenerator(SchedulingConfig config, DateRuleResolver resolver) {
        return new TaskGenerator(config.taskTemplates(), resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskDueDateCalculator taskDueDateCalculator(DateRuleResolver resolver) {
        return new TaskDueDateCalculator(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectScheduler projectScheduler(TimelineSegmentBuilder segmentBuilder,
                                             RoleAssignmentEngine assignmentEngine,
                                             TaskGenerator taskGenerator) {
        return new ProjectScheduler(segmentBuilder, assignmentEngine, taskGenerator);
    }
}
