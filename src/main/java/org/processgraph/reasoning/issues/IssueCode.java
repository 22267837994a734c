package org.processgraph.reasoning.issues;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Codes of every finding the reasoning core can report.
 * Lane codes marked actionable are the ones a redistribution can fix.
 */
public enum IssueCode {
    // reachability diagnostics
    UNBALANCED_SPLIT("unbalanced-split", false),
    DIVERGENT_JOINS("branches-converge-at-different-joins", false),
    IMPLICIT_MERGE("implicit-merge", false),
    DANGLING_BOUNDARY_EVENT("dangling-boundary-event", false),
    UNPAIRED_LINK_EVENT("unpaired-link-event", false),

    // lane coherence
    ZIGZAG_FLOW("zigzag-flow", true),
    LOW_COHERENCE("low-coherence", true),
    ELEMENTS_NOT_IN_LANE("elements-not-in-lane", true),
    SINGLE_ELEMENT_LANE("single-element-lane", false);

    private final String code;
    private final boolean actionable;

    IssueCode(String code, boolean actionable) {
        this.code = code;
        this.actionable = actionable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isActionable() {
        return actionable;
    }
}
