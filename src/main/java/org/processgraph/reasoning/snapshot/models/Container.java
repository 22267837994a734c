package org.processgraph.reasoning.snapshot.models;

import java.util.List;

/**
 * A pool or a lane.
 * A pool lists every node of its process; a lane lists only the nodes referenced by it
 * (exactly like {@code <flowNodeRef>}).
 */
public record Container(
        String id,
        String name,
        ContainerKind kind,
        String parentContainerId,
        List<String> memberNodeIds
) {
    public Container {
        memberNodeIds = memberNodeIds == null ? List.of() : List.copyOf(memberNodeIds);
    }

    public boolean isLane() {
        return kind == ContainerKind.LANE;
    }

    public boolean isPool() {
        return kind == ContainerKind.POOL;
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
