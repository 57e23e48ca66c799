package com.timeline.assignment;

import com.timeline.model.TeamMember;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role to member-id lookup built from a roster snapshot, in roster order.
 */
public final class RosterIndex {

    private final Map<String, List<String>> membersByRole;

    private RosterIndex(Map<String, List<String>> membersByRole) {
        this.membersByRole = membersByRole;
    }

    public static RosterIndex of(List<TeamMember> roster) {
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (TeamMember member : roster) {
            for (String role : member.roles()) {
                List<String> members = index.computeIfAbsent(role, r -> new ArrayList<>());
                if (!members.contains(member.id())) {
                    members.add(member.id());
                }
            }
        }
        index.replaceAll((role, members) -> Collections.unmodifiableList(members));
        return new RosterIndex(Collections.unmodifiableMap(index));
    }

    /**
     * Ids of the members holding {@code role}; empty if nobody does.
     */
    public List<String> membersWith(String role) {
        return membersByRole.getOrDefault(role, List.of());
    }

    public boolean isStaffed(String role) {
        return !membersWith(role).isEmpty();
    }

    public Map<String, List<String>> asMap() {
        return membersByRole;
    }
}
