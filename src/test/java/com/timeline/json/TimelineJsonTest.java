package com.timeline.json;

import com.timeline.model.AnchorDates;
import com.timeline.model.PhaseSegment;
import com.timeline.model.ProjectTimeline;
import com.timeline.model.Task;
import com.timeline.model.TaskStatus;
import com.timeline.model.TeamMember;
import com.timeline.rule.DefaultDateRuleResolver;
import com.timeline.segment.TimelineSegmentBuilder;
import com.timeline.task.TaskDateRequest;
import com.timeline.task.TaskDueDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineJsonTest {

    @Test
    @DisplayName("Host task payload is read with rule alias, status and ongoing flag")
    void readTasks() {
        String json = """
                [
                  {"id": "task-008", "description": "Send field updates", "phase": "Fielding",
                   "role": "AE Manager", "dateNotes": "Ongoing", "isOngoing": true,
                   "assignedTo": ["u-1"], "status": "in-progress", "color": "#7C3AED"},
                  {"id": "task-016", "description": "Deliver report", "phase": "Reporting",
                   "dateRule": "report due date, final", "dueDate": "2025-03-03"}
                ]
                """;

        List<Task> tasks = TimelineJson.readTasks(json);

        assertEquals(2, tasks.size());
        Task updates = tasks.get(0);
        assertEquals("Ongoing", updates.dateRule());
        assertTrue(updates.ongoing());
        assertEquals(TaskStatus.IN_PROGRESS, updates.status());
        assertEquals(List.of("u-1"), updates.assignedTo());

        Task report = tasks.get(1);
        assertEquals(LocalDate.of(2025, 3, 3), report.dueDate());
        assertEquals(TaskStatus.PENDING, report.status());
        assertTrue(report.assignedTo().isEmpty());
    }

    @Test
    @DisplayName("Tasks are written with ISO dates and read back unchanged")
    void writeTasks() {
        List<Task> tasks = List.of(
                Task.of("t-1", "Brief recruiter", "Pre-Field", "Recruit Coordinator", "1 week prior to fieldwork start")
                        .withDueDate(LocalDate.of(2025, 1, 13))
                        .withAssignedTo(List.of("rec")),
                Task.of("t-2", "Updates", "Fielding", null, "Ongoing").withOngoing(true).withStatus(TaskStatus.COMPLETED));

        String json = TimelineJson.writeTasks(tasks);

        assertTrue(json.contains("\"dueDate\":\"2025-01-13\""), json);
        assertTrue(json.contains("\"isOngoing\":true"), json);
        assertTrue(json.contains("\"status\":\"completed\""), json);
        assertEquals(tasks, TimelineJson.readTasks(json));
    }

    @Test
    @DisplayName("Timeline, roster and date requests")
    void readOtherShapes() {
        ProjectTimeline timeline = TimelineJson.readTimeline("""
                {"koDate": "2025-01-06", "fieldworkStart": "2025-01-20",
                 "fieldworkEnd": "2025-02-14", "reportDue": "2025-03-03"}
                """);
        List<TeamMember> roster = TimelineJson.readRoster("""
                [{"id": "u-1", "name": "Lead", "role": "", "roles": ["Project Manager"]},
                 {"id": "u-2", "name": "New hire"}]
                """);
        List<TaskDateRequest> requests = TimelineJson.readDateRequests("""
                [{"id": "task-1", "dateNotes": "1 day before KO date", "task": "Agenda", "phase": "Kickoff"}]
                """);

        assertEquals(AnchorDates.of("2025-01-06", "2025-01-20", "2025-02-14", "2025-03-03"), timeline.toAnchorDates());
        assertTrue(roster.get(0).holds("Project Manager"));
        assertTrue(roster.get(1).roles().isEmpty());
        assertEquals("1 day before KO date", requests.get(0).dateNotes());
    }

    @Test
    @DisplayName("Segments and due dates are written as plain JSON")
    void writeSegmentsAndDueDates() {
        List<PhaseSegment> segments = new TimelineSegmentBuilder(new DefaultDateRuleResolver())
                .buildSegments(AnchorDates.of("2025-01-06", "2025-01-20", "2025-02-14", "2025-03-03"))
                .segments();

        String segmentJson = TimelineJson.writeSegments(segments);
        String dueJson = TimelineJson.writeDueDates(List.of(new TaskDueDate("a", "2025-01-13"), new TaskDueDate("b", null)));

        assertTrue(segmentJson.contains("{\"phase\":\"Kickoff\",\"startDate\":\"2025-01-06\",\"endDate\":\"2025-01-06\"}"),
                segmentJson);
        assertTrue(segmentJson.contains("\"phase\":\"Post-Field Analysis\""), segmentJson);
        assertEquals("[{\"taskId\":\"a\",\"dueDate\":\"2025-01-13\"},{\"taskId\":\"b\",\"dueDate\":null}]", dueJson);
    }

    @Test
    @DisplayName("Malformed JSON is reported as an illegal argument")
    void malformedJson() {
        assertThrows(IllegalArgumentException.class, () -> TimelineJson.readTasks("[{\"id\": "));
    }
}
