package com.timeline.assignment;

import com.timeline.model.Task;
import com.timeline.model.TeamMember;

import java.util.List;

/**
 * Keeps the assignees of role-tagged tasks in step with the team roster.
 * Both operations are pure: the inputs are not modified and no state is kept between calls.
 */
public interface RoleAssignmentEngine {

    /**
     * Apply one member's role change to the tasks tagged with that role.
     * Tasks tagged with any other role, or with none, are returned unchanged.
     *
     * @param memberId Member whose role changed
     * @param role     Role that was added or removed
     * @param added    true if the member gained the role, false if they lost it
     * @param roster   Roster after the change
     * @param tasks    Current tasks
     * @return Updated tasks, in input order
     */
    List<Task> onRoleChanged(String memberId, String role, boolean added, List<TeamMember> roster, List<Task> tasks);

    /**
     * Overwrite the assignees of every role-tagged task with the current role holders.
     * Meant for first-time team formation only; it discards manual assignment edits.
     *
     * @param roster Team roster
     * @param tasks  Current tasks
     * @return Updated tasks, in input order
     */
    List<Task> reassignAll(List<TeamMember> roster, List<Task> tasks);
}
