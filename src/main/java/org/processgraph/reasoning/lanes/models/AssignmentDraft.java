package org.processgraph.reasoning.lanes.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable working state of a classification run. Assignments are visible to later
 * steps immediately, which is what lets a propagation pass build on an earlier one.
 */
public class AssignmentDraft {
    private final Map<String, String> laneByNode = new LinkedHashMap<>();
    private final Map<String, AssignmentReason> reasons = new LinkedHashMap<>();

    public AssignmentDraft() {
    }

    /**
     * Starts from an existing membership. Seeded entries carry no reason until reassigned.
     */
    public AssignmentDraft(Map<String, String> seed) {
        laneByNode.putAll(seed);
    }

    public void assign(String nodeId, String laneId, AssignmentReason reason) {
        laneByNode.put(nodeId, laneId);
        reasons.put(nodeId, reason);
    }

    public String laneOf(String nodeId) {
        return laneByNode.get(nodeId);
    }

    public boolean isAssigned(String nodeId) {
        return laneByNode.containsKey(nodeId);
    }

    public int countIn(String laneId) {
        return (int) laneByNode.values().stream().filter(laneId::equals).count();
    }

    public LaneAssignment toAssignment() {
        return new LaneAssignment(laneByNode, reasons);
    }
}
