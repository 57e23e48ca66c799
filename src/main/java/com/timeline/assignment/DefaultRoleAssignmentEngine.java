package com.timeline.assignment;

import com.timeline.model.Task;
import com.timeline.model.TeamMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of RoleAssignmentEngine.
 */
public class DefaultRoleAssignmentEngine implements RoleAssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultRoleAssignmentEngine.class);

    @Override
    public List<Task> onRoleChanged(String memberId, String role, boolean added,
                                    List<TeamMember> roster, List<Task> tasks) {
        Objects.requireNonNull(memberId, "memberId");
        Objects.requireNonNull(role, "role");
        RosterIndex index = RosterIndex.of(roster);
        List<String> holders = index.membersWith(role);
        if (added && !holders.contains(memberId)) {
            log.warn("Member {} was added to role {} but the roster does not list them under it", memberId, role);
        }

        List<Task> result = new ArrayList<>(tasks.size());
        int touched = 0;
        for (Task task : tasks) {
            if (!role.equals(task.role())) {
                result.add(task);
                continue;
            }
            List<String> assignees = updatedAssignees(task.assignedTo(), memberId, added, holders);
            if (assignees.equals(task.assignedTo())) {
                result.add(task);
            } else {
                result.add(task.withAssignedTo(assignees));
                touched++;
            }
        }

        log.debug("Role {} {} member {}: {} tasks updated", role, added ? "gained" : "lost", memberId, touched);
        return result;
    }

    private static List<String> updatedAssignees(List<String> current, String memberId, boolean added,
                                                 List<String> holders) {
        if (holders.isEmpty()) {
            return List.of();
        }
        List<String> assignees = new ArrayList<>(current);
        if (added) {
            if (!assignees.contains(memberId)) {
                assignees.add(memberId);
            }
        } else {
            assignees.remove(memberId);
        }
        return assignees;
    }

    @Override
    public List<Task> reassignAll(List<TeamMember> roster, List<Task> tasks) {
        RosterIndex index = RosterIndex.of(roster);
        log.info("Reassigning all role-tagged tasks across roles {}", index.asMap().keySet());

        List<Task> result = new ArrayList<>(tasks.size());
        int unstaffed = 0;
        for (Task task : tasks) {
            if (!task.isRoleTagged()) {
                result.add(task);
                continue;
            }
            List<String> holders = index.membersWith(task.role());
            if (holders.isEmpty()) {
                unstaffed++;
                log.debug("No members have role {}, task {} left unassigned", task.role(), task.id());
            }
            result.add(task.withAssignedTo(holders));
        }

        if (unstaffed > 0) {
            log.warn("{} role-tagged tasks have no member holding their role", unstaffed);
        }
        return result;
    }
}
