package com.timeline.model;

/**
 * Catalog entry a project's tasks are generated from.
 *
 * @param id          Stable template id, reused as the task id
 * @param quantQual   "quant", "qual", or null when the task applies to both
 * @param phase       Display name of the owning phase
 * @param description Task text
 * @param dateRule    Free-text date rule, may be null
 * @param role        Role whose holders are assigned automatically, may be null
 * @param notes       Free-text notes carried onto the task
 */
public record TaskTemplate(
        String id,
        String quantQual,
        String phase,
        String description,
        String dateRule,
        String role,
        String notes
) {
}
