package com.timeline.model;

/**
 * The four project milestones every computed date is expressed relative to.
 */
public enum AnchorKind {
    KO_DATE("koDate"),
    FIELDWORK_START("fieldworkStart"),
    FIELDWORK_END("fieldworkEnd"),
    REPORT_DUE("reportDue");

    private final String fieldName;

    AnchorKind(String fieldName) {
        this.fieldName = fieldName;
    }

    /**
     * Name of the matching field in host payloads.
     */
    public String fieldName() {
        return fieldName;
    }
}
