package com.timeline.model;

import java.util.List;

/**
 * A project team member and the roles they currently hold.
 */
public record TeamMember(String id, String name, List<String> roles) {

    public TeamMember {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean holds(String role) {
        return role != null && roles.contains(role);
    }
}
