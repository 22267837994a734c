package org.processgraph.reasoning.snapshot.models;

import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * A flow node of the process graph.
 *
 * @param id              stable id, e.g. {@code Activity_1ktuyru}
 * @param kind            closed node kind
 * @param name            display name, may be null
 * @param role            declared role (assignee / candidate group), may be null
 * @param triggers        event definitions, empty for non-events and none-events
 * @param linkName        link name of a Link event, null otherwise
 * @param outgoingEdgeIds ids of edges leaving this node, in declared order
 * @param incomingEdgeIds ids of edges entering this node, in declared order
 * @param containerId     lane the node sits in, or its pool when it is in no lane, may be null
 * @param parentNodeId    enclosing sub-process node, null for nodes at process level
 */
@Builder(toBuilder = true)
public record GraphNode(
        String id,
        NodeKind kind,
        String name,
        String role,
        Set<EventTrigger> triggers,
        String linkName,
        List<String> outgoingEdgeIds,
        List<String> incomingEdgeIds,
        String containerId,
        String parentNodeId
) {
    public GraphNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (kind == null) {
            kind = NodeKind.OTHER;
        }
        triggers = triggers == null ? Set.of() : Set.copyOf(triggers);
        outgoingEdgeIds = outgoingEdgeIds == null ? List.of() : List.copyOf(outgoingEdgeIds);
        incomingEdgeIds = incomingEdgeIds == null ? List.of() : List.copyOf(incomingEdgeIds);
    }

    /**
     * Name if present, id otherwise. Used when naming nodes in messages.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean hasTrigger(EventTrigger trigger) {
        return triggers.contains(trigger);
    }
}
