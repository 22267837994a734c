package org.processgraph.reasoning.snapshot.models;

/**
 * A directed edge between two nodes.
 *
 * @param id           the unique identifier of the edge
 * @param kind         sequence, message or association
 * @param sourceNodeId id of the source node
 * @param targetNodeId id of the target node
 * @param hasCondition true when the flow carries a condition expression
 */
public record GraphEdge(
        String id,
        EdgeKind kind,
        String sourceNodeId,
        String targetNodeId,
        boolean hasCondition
) {
    // Unconditional sequence flow
    public GraphEdge(String id, String sourceNodeId, String targetNodeId) {
        this(id, EdgeKind.SEQUENCE, sourceNodeId, targetNodeId, false);
    }

    public boolean isSequence() {
        return kind == EdgeKind.SEQUENCE;
    }
}
