package com.timeline.spring;

import com.timeline.adapter.spring.TimelineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the scheduling beans ({@code DateRuleResolver}, {@code TimelineSegmentBuilder},
 * {@code RoleAssignmentEngine}, {@code TaskGenerator} and {@code ProjectScheduler}) in the
 * annotated application. The rule vocabulary and task catalog come from {@code timeline.config-path}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TimelineAutoConfiguration.class)
public @interface EnableTimeline {
}
