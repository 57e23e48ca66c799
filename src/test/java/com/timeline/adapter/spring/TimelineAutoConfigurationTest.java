package com.timeline.adapter.spring;

import com.timeline.assignment.RoleAssignmentEngine;
import com.timeline.config.SchedulingConfig;
import com.timeline.rule.DateRuleResolver;
import com.timeline.scheduler.ProjectScheduler;
import com.timeline.segment.TimelineSegmentBuilder;
import com.timeline.task.TaskDueDateCalculator;
import com.timeline.task.TaskGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.annotation.UserConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(UserConfigurations.of(TimelineAutoConfiguration.class));

    @Test
    @DisplayName("Engine beans are created from the bundled configuration")
    void createsEngineBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SchedulingConfig.class);
            assertThat(context).hasSingleBean(DateRuleResolver.class);
            assertThat(context).hasSingleBean(TimelineSegmentBuilder.class);
            assertThat(context).hasSingleBean(RoleAssignmentEngine.class);
            assertThat(context).hasSingleBean(TaskGenerator.class);
            assertThat(context).hasSingleBean(TaskDueDateCalculator.class);
            assertThat(context).hasSingleBean(ProjectScheduler.class);
            assertThat(context.getBean(TaskGenerator.class).getCatalog()).hasSize(16);
        });
    }

    @Test
    @DisplayName("Disabled engine registers nothing")
    void disabled() {
        contextRunner.withPropertyValues("timeline.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ProjectScheduler.class));
    }

    @Test
    @DisplayName("Unknown config path fails startup")
    void badConfigPath() {
        contextRunner.withPropertyValues("timeline.config-path=classpath:missing.yaml")
                .run(context -> assertThat(context).hasFailed());
    }
}
