package com.timeline.assignment;

import com.timeline.model.Task;
import com.timeline.model.TaskStatus;
import com.timeline.model.TeamMember;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultRoleAssignmentEngine.
 */
class DefaultRoleAssignmentEngineTest {

    private RoleAssignmentEngine engine;
    private List<TeamMember> roster;
    private List<Task> tasks;

    @BeforeEach
    void setUp() {
        engine = new DefaultRoleAssignmentEngine();
        roster = List.of(
                new TeamMember("m1", "Avery", List.of("Project Manager", "AE Manager")),
                new TeamMember("m2", "Blake", List.of("Logistics")),
                new TeamMember("m3", "Casey", List.of("Logistics", "Recruit Coordinator")));
        tasks = List.of(
                Task.of("t1", "Book facility", "Pre-Field", "Logistics", "1 week prior to fieldwork start")
                        .withAssignedTo(List.of("m2")),
                Task.of("t2", "Client check-in", "Fielding", "AE Manager", "first day of fieldwork")
                        .withAssignedTo(List.of("m1"))
                        .withStatus(TaskStatus.COMPLETED)
                        .withDueDate(LocalDate.of(2025, 1, 20))
                        .withNotes("call client"),
                Task.of("t3", "Ad hoc follow-up", "Fielding", null, null)
                        .withAssignedTo(List.of("manual-pick")),
                Task.of("t4", "Ship incentives", "Fielding", "Logistics", "Ongoing").withOngoing(true));
    }

    // =====================================================================
    // Scoped updates
    // =====================================================================

    @Test
    @DisplayName("Adding a role appends the member to that role's tasks")
    void addRole() {
        List<Task> updated = engine.onRoleChanged("m3", "Logistics", true, roster, tasks);

        assertEquals(List.of("m2", "m3"), updated.get(0).assignedTo());
        assertEquals(List.of("m3"), updated.get(3).assignedTo());
    }

    @Test
    @DisplayName("Applying the same change twice equals applying it once")
    void addIsIdempotent() {
        List<Task> once = engine.onRoleChanged("m3", "Logistics", true, roster, tasks);
        List<Task> twice = engine.onRoleChanged("m3", "Logistics", true, roster, once);

        assertEquals(once, twice);
        assertEquals(List.of("m2", "m3"), twice.get(0).assignedTo());
    }

    @Test
    @DisplayName("Removing a role drops the member from that role's tasks")
    void removeRole() {
        List<Task> withBoth = engine.onRoleChanged("m3", "Logistics", true, roster, tasks);
        List<TeamMember> after = List.of(roster.get(0),
                new TeamMember("m2", "Blake", List.of()),
                roster.get(2));

        List<Task> updated = engine.onRoleChanged("m2", "Logistics", false, after, withBoth);

        assertEquals(List.of("m3"), updated.get(0).assignedTo());
        assertEquals(List.of("m3"), updated.get(3).assignedTo());
        assertEquals(updated, engine.onRoleChanged("m2", "Logistics", false, after, updated));
    }

    @Test
    @DisplayName("A role nobody holds leaves its tasks unassigned")
    void lastHolderRemoved() {
        List<Task> assigned = List.of(tasks.get(0).withAssignedTo(List.of("m2", "former-member")));
        List<TeamMember> nobody = List.of(roster.get(0));

        List<Task> updated = engine.onRoleChanged("m2", "Logistics", false, nobody, assigned);

        assertTrue(updated.get(0).assignedTo().isEmpty());
    }

    @Test
    @DisplayName("An add for a member the roster does not list follows the roster's holders")
    void addForUnlistedMember() {
        List<Task> staffed = engine.onRoleChanged("m9", "Logistics", true, roster, tasks);
        List<Task> unstaffed = engine.onRoleChanged("m9", "Logistics", true, List.of(roster.get(0)), tasks);

        assertEquals(List.of("m2", "m9"), staffed.get(0).assignedTo());
        assertTrue(unstaffed.get(0).assignedTo().isEmpty());
        assertTrue(unstaffed.get(3).assignedTo().isEmpty());
    }

    @Test
    @DisplayName("Tasks tagged with other roles are returned untouched")
    void otherRolesUntouched() {
        List<TeamMember> grown = List.of(roster.get(0), roster.get(1), roster.get(2),
                new TeamMember("m4", "Devon", List.of("AE Manager")));

        List<Task> updated = engine.onRoleChanged("m4", "AE Manager", true, grown, tasks);

        for (int i = 0; i < tasks.size(); i++) {
            if (!"AE Manager".equals(tasks.get(i).role())) {
                assertSame(tasks.get(i), updated.get(i));
            }
        }
        Task checkIn = updated.get(1);
        assertEquals(List.of("m1", "m4"), checkIn.assignedTo());
        assertEquals(TaskStatus.COMPLETED, checkIn.status());
        assertEquals(LocalDate.of(2025, 1, 20), checkIn.dueDate());
        assertEquals("call client", checkIn.notes());
    }

    @Test
    @DisplayName("Inputs are not modified")
    void inputsNotModified() {
        List<Task> before = List.copyOf(tasks);

        engine.onRoleChanged("m3", "Logistics", true, roster, tasks);

        assertEquals(before, tasks);
    }

    // =====================================================================
    // Bulk reassignment
    // =====================================================================

    @Test
    @DisplayName("Bulk reassignment sets assignees to exactly the role holders")
    void reassignAll() {
        List<Task> withStranger = List.of(tasks.get(0).withAssignedTo(List.of("stranger")),
                tasks.get(1), tasks.get(2), tasks.get(3),
                Task.of("t5", "Unstaffed", "Reporting", "Statistician", null).withAssignedTo(List.of("m1")));

        List<Task> updated = engine.reassignAll(roster, withStranger);

        assertEquals(List.of("m2", "m3"), updated.get(0).assignedTo());
        assertEquals(List.of("m1"), updated.get(1).assignedTo());
        assertSame(withStranger.get(2), updated.get(2));
        assertEquals(List.of("m2", "m3"), updated.get(3).assignedTo());
        assertTrue(updated.get(4).assignedTo().isEmpty());
    }

    @Test
    @DisplayName("Roster index keeps roster order and ignores duplicate roles")
    void rosterIndex() {
        RosterIndex index = RosterIndex.of(List.of(
                new TeamMember("b", "B", List.of("Logistics", "Logistics")),
                new TeamMember("a", "A", List.of("Logistics"))));

        assertEquals(List.of("b", "a"), index.membersWith("Logistics"));
        assertFalse(index.isStaffed("AE Manager"));
    }
}
