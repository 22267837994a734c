package org.processgraph.reasoning.redistribution.models;

import org.processgraph.reasoning.lanes.models.AssignmentReason;
import org.processgraph.reasoning.snapshot.models.NodeKind;

/**
 * One node changing lanes. {@code fromLaneId} is null when the node was in no lane.
 */
public record Move(
        String nodeId,
        String nodeName,
        NodeKind nodeKind,
        String fromLaneId,
        String fromLaneName,
        String toLaneId,
        String toLaneName,
        AssignmentReason reason
) {
}
