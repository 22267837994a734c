package org.processgraph.reasoning.snapshot;

import org.processgraph.reasoning.snapshot.models.Container;
import org.processgraph.reasoning.snapshot.models.ContainerKind;
import org.processgraph.reasoning.snapshot.models.EdgeKind;
import org.processgraph.reasoning.snapshot.models.EventTrigger;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;
import org.processgraph.reasoning.snapshot.models.NodeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects nodes, edges and containers and turns them into a validated {@link GraphSnapshot}.
 * <p>
 * Edge id lists on the nodes are derived from the added edges, and every node's
 * {@code containerId} is derived from lane / pool membership, so callers only describe
 * the graph once.
 */
public class GraphSnapshotBuilder {
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, ContainerDraft> containers = new LinkedHashMap<>();

    public GraphSnapshotBuilder node(GraphNode node) {
        if (nodes.containsKey(node.id()) || edges.containsKey(node.id()) || containers.containsKey(node.id())) {
            throw new IllegalStateException("Duplicate element id in snapshot: " + node.id());
        }
        nodes.put(node.id(), node);
        return this;
    }

    public GraphSnapshotBuilder task(String id, NodeKind kind, String name, String role) {
        return node(GraphNode.builder().id(id).kind(kind).name(name).role(role).build());
    }

    public GraphSnapshotBuilder gateway(String id, NodeKind kind) {
        return node(GraphNode.builder().id(id).kind(kind).build());
    }

    public GraphSnapshotBuilder event(String id, NodeKind kind, EventTrigger... triggers) {
        return node(GraphNode.builder().id(id).kind(kind).triggers(Set.of(triggers)).build());
    }

    public GraphSnapshotBuilder linkEvent(String id, NodeKind kind, String linkName) {
        return node(GraphNode.builder()
                .id(id)
                .kind(kind)
                .triggers(Set.of(EventTrigger.LINK))
                .linkName(linkName)
                .build());
    }

    public GraphSnapshotBuilder edge(GraphEdge edge) {
        if (edges.containsKey(edge.id()) || nodes.containsKey(edge.id()) || containers.containsKey(edge.id())) {
            throw new IllegalStateException("Duplicate element id in snapshot: " + edge.id());
        }
        edges.put(edge.id(), edge);
        return this;
    }

    public GraphSnapshotBuilder sequence(String id, String sourceNodeId, String targetNodeId) {
        return edge(new GraphEdge(id, sourceNodeId, targetNodeId));
    }

    public GraphSnapshotBuilder conditionalSequence(String id, String sourceNodeId, String targetNodeId) {
        return edge(new GraphEdge(id, EdgeKind.SEQUENCE, sourceNodeId, targetNodeId, true));
    }

    public GraphSnapshotBuilder pool(String id, String name) {
        return container(new ContainerDraft(id, name, ContainerKind.POOL, null));
    }

    public GraphSnapshotBuilder lane(String id, String name, String parentContainerId) {
        return container(new ContainerDraft(id, name, ContainerKind.LANE, parentContainerId));
    }

    /**
     * Places nodes into a container. Placing a node into a lane also makes it a member of
     * the lane's pool.
     */
    public GraphSnapshotBuilder place(String containerId, String... nodeIds) {
        ContainerDraft container = containers.get(containerId);
        if (container == null) {
            throw new IllegalStateException("Unknown container: " + containerId);
        }
        for (String nodeId : nodeIds) {
            container.members.add(nodeId);
            if (container.kind == ContainerKind.LANE && container.parentId != null) {
                ContainerDraft parent = containers.get(container.parentId);
                if (parent != null) {
                    parent.members.add(nodeId);
                }
            }
        }
        return this;
    }

    public GraphSnapshot build() {
        validateEdges();
        validateParents();
        validateContainers();

        Map<String, List<String>> outgoing = new HashMap<>();
        Map<String, List<String>> incoming = new HashMap<>();
        for (GraphEdge edge : edges.values()) {
            outgoing.computeIfAbsent(edge.sourceNodeId(), k -> new ArrayList<>()).add(edge.id());
            incoming.computeIfAbsent(edge.targetNodeId(), k -> new ArrayList<>()).add(edge.id());
        }

        Map<String, String> containerByNode = new HashMap<>();
        for (ContainerDraft container : containers.values()) {
            for (String nodeId : container.members) {
                if (container.kind == ContainerKind.LANE || !containerByNode.containsKey(nodeId)) {
                    containerByNode.put(nodeId, container.id);
                }
            }
        }

        Map<String, GraphNode> builtNodes = new LinkedHashMap<>();
        for (GraphNode node : nodes.values()) {
            builtNodes.put(node.id(), node.toBuilder()
                    .outgoingEdgeIds(outgoing.getOrDefault(node.id(), List.of()))
                    .incomingEdgeIds(incoming.getOrDefault(node.id(), List.of()))
                    .containerId(containerByNode.get(node.id()))
                    .build());
        }

        Map<String, Container> builtContainers = new LinkedHashMap<>();
        for (ContainerDraft draft : containers.values()) {
            builtContainers.put(draft.id,
                    new Container(draft.id, draft.name, draft.kind, draft.parentId, new ArrayList<>(draft.members)));
        }

        return new GraphSnapshot(builtNodes, edges, builtContainers);
    }

    private GraphSnapshotBuilder container(ContainerDraft draft) {
        if (containers.containsKey(draft.id) || nodes.containsKey(draft.id) || edges.containsKey(draft.id)) {
            throw new IllegalStateException("Duplicate element id in snapshot: " + draft.id);
        }
        containers.put(draft.id, draft);
        return this;
    }

    private void validateParents() {
        for (GraphNode node : nodes.values()) {
            if (node.parentNodeId() == null) {
                continue;
            }
            GraphNode parent = nodes.get(node.parentNodeId());
            if (parent == null) {
                throw new IllegalStateException(String.format(
                        "Node '%s' references unknown parent node '%s'", node.id(), node.parentNodeId()));
            }
            if (parent.kind() != NodeKind.SUB_PROCESS) {
                throw new IllegalStateException(String.format(
                        "Node '%s' is nested in '%s', which is not a sub-process", node.id(), parent.id()));
            }
        }
    }

    private void validateEdges() {
        for (GraphEdge edge : edges.values()) {
            if (!nodes.containsKey(edge.sourceNodeId())) {
                throw new IllegalStateException(String.format(
                        "Edge '%s' references unknown source node '%s'", edge.id(), edge.sourceNodeId()));
            }
            if (!nodes.containsKey(edge.targetNodeId())) {
                throw new IllegalStateException(String.format(
                        "Edge '%s' references unknown target node '%s'", edge.id(), edge.targetNodeId()));
            }
        }
    }

    private void validateContainers() {
        Map<String, String> laneByNode = new HashMap<>();
        for (ContainerDraft container : containers.values()) {
            if (container.kind == ContainerKind.POOL && container.parentId != null) {
                throw new IllegalStateException("Pool '" + container.id + "' must not have a parent container");
            }
            if (container.kind == ContainerKind.LANE) {
                ContainerDraft parent = containers.get(container.parentId);
                if (parent == null) {
                    throw new IllegalStateException(String.format(
                            "Lane '%s' references unknown parent '%s'", container.id, container.parentId));
                }
                if (parent.kind != ContainerKind.POOL) {
                    throw new IllegalStateException(String.format(
                            "Lane '%s' is nested in lane '%s'; only pool -> lane nesting is supported",
                            container.id, parent.id));
                }
            }
            for (String nodeId : container.members) {
                if (!nodes.containsKey(nodeId)) {
                    throw new IllegalStateException(String.format(
                            "Container '%s' references unknown node '%s'", container.id, nodeId));
                }
                if (container.kind == ContainerKind.LANE) {
                    String previous = laneByNode.putIfAbsent(nodeId, container.id);
                    if (previous != null) {
                        throw new IllegalStateException(String.format(
                                "Node '%s' is a member of both lane '%s' and lane '%s'",
                                nodeId, previous, container.id));
                    }
                }
            }
        }
    }

    private static final class ContainerDraft {
        private final String id;
        private final String name;
        private final ContainerKind kind;
        private final String parentId;
        private final Set<String> members = new LinkedHashSet<>();

        private ContainerDraft(String id, String name, ContainerKind kind, String parentId) {
            this.id = id;
            this.name = name;
            this.kind = kind;
            this.parentId = parentId;
        }
    }
}
