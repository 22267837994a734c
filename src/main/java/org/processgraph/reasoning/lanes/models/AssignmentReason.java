package org.processgraph.reasoning.lanes.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a node was placed in a lane. Carried into redistribution move records.
 */
public enum AssignmentReason {
    ROLE_MATCH("role matches lane name"),
    HUMAN_TASK("human task routed to the human lane"),
    AUTOMATED_TASK("automated task routed to the automated lane"),
    ORDERING_HINT("split across the first two lanes by ordering hint"),
    NEIGHBOR_MAJORITY("majority of connected neighbors are in this lane"),
    MINIMIZES_CROSSINGS("minimizes cross-lane flows"),
    BALANCE("balancing lane element count"),
    DEFAULT_LANE("no better match, placed in the first lane"),
    MANUAL("explicitly assigned");

    private final String description;

    AssignmentReason(String description) {
        this.description = description;
    }

    @JsonValue
    public String description() {
        return description;
    }
}
