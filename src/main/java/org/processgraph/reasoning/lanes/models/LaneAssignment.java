package org.processgraph.reasoning.lanes.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A proposed node -> lane mapping together with the reason for every placement.
 * Iteration order follows the order in which nodes were classified.
 */
public record LaneAssignment(
        Map<String, String> laneByNode,
        Map<String, AssignmentReason> reasons
) {
    public LaneAssignment {
        laneByNode = Collections.unmodifiableMap(new LinkedHashMap<>(laneByNode));
        reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public String laneOf(String nodeId) {
        return laneByNode.get(nodeId);
    }

    public AssignmentReason reasonFor(String nodeId) {
        return reasons.get(nodeId);
    }

    public int size() {
        return laneByNode.size();
    }
}
