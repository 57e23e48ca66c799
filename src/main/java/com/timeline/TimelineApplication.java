package com.timeline;

import com.timeline.json.TimelineJson;
import com.timeline.model.AnchorDates;
import com.timeline.model.Task;
import com.timeline.model.TeamMember;
import com.timeline.scheduler.ProjectScheduler;
import com.timeline.scheduler.ScheduleResult;
import com.timeline.spring.EnableTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.LocalDate;
import java.util.List;

/**
 * Example Spring Boot application demonstrating the timeline engine.
 */
@SpringBootApplication
@EnableTimeline
public class TimelineApplication {

    private static final Logger log = LoggerFactory.getLogger(TimelineApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TimelineApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ProjectScheduler scheduler) {
        return args -> {
            log.info("=== Timeline Demo Started ===");

            AnchorDates anchors = AnchorDates.of("2025-01-06", "2025-01-20", "2025-02-14", "2025-03-03");
            List<TeamMember> team = List.of(
                    new TeamMember("u-1", "Project lead", List.of("Project Manager", "AE Manager")),
                    new TeamMember("u-2", "Field coordinator", List.of("Logistics", "Recruit Coordinator")));

            ScheduleResult created = scheduler.createProject(
                    anchors, "qualitative", false, team, LocalDate.of(2025, 1, 6));
            if (!created.isSuccess()) {
                log.error("Project setup failed: {}", created.getError());
                return;
            }
            created.getTimeline().segments().forEach(segment ->
                    log.info("{}: {} .. {}", segment.phase(), segment.startDate(), segment.endDate()));

            // A second recruiter joins after setup
            List<TeamMember> grown = List.of(team.get(0), team.get(1),
                    new TeamMember("u-3", "Recruiter", List.of("Recruit Coordinator")));
            List<Task> tasks = scheduler.onRoleChanged(
                    "u-3", "Recruit Coordinator", true, grown, created.getTasks());

            log.info("Tasks: {}", TimelineJson.writeTasks(tasks));
            log.info("=== Timeline Demo Completed ===");
        };
    }
}
