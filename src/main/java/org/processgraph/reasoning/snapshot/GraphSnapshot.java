package org.processgraph.reasoning.snapshot;

import org.processgraph.reasoning.snapshot.models.Container;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, in-memory view of one process diagram: nodes, edges and the pool / lane
 * hierarchy, all addressed by stable id.
 * <p>
 * A snapshot is built fresh for every invocation (see {@link GraphSnapshotBuilder} and
 * {@link BpmnSnapshotBuilder}) and is never shared between calls. Redistribution does not
 * modify it; it derives a new snapshot via {@link #withLaneMembership(String, Map)}.
 */
public final class GraphSnapshot {
    private final Map<String, GraphNode> nodesById;
    private final Map<String, GraphEdge> edgesById;
    private final Map<String, Container> containersById;

    private final Map<String, String> laneByNode = new HashMap<>();
    private final Map<String, String> poolByNode = new HashMap<>();

    GraphSnapshot(Map<String, GraphNode> nodesById,
                  Map<String, GraphEdge> edgesById,
                  Map<String, Container> containersById) {
        this.nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
        this.edgesById = Collections.unmodifiableMap(new LinkedHashMap<>(edgesById));
        this.containersById = Collections.unmodifiableMap(new LinkedHashMap<>(containersById));

        for (Container container : containersById.values()) {
            Map<String, String> index = container.isLane() ? laneByNode : poolByNode;
            for (String nodeId : container.memberNodeIds()) {
                index.put(nodeId, container.id());
            }
        }
    }

    public Collection<GraphNode> nodes() {
        return nodesById.values();
    }

    public Collection<GraphEdge> edges() {
        return edgesById.values();
    }

    public Collection<Container> containers() {
        return containersById.values();
    }

    /**
     * @return the node, or null if the snapshot has no node with that id
     */
    public GraphNode node(String nodeId) {
        return nodesById.get(nodeId);
    }

    public GraphEdge edge(String edgeId) {
        return edgesById.get(edgeId);
    }

    public Container container(String containerId) {
        return containersById.get(containerId);
    }

    public List<Container> pools() {
        List<Container> pools = new ArrayList<>();
        for (Container container : containersById.values()) {
            if (container.isPool()) {
                pools.add(container);
            }
        }
        return pools;
    }

    /**
     * Lanes directly owned by the given pool, in declared order.
     */
    public List<Container> lanesOf(String poolId) {
        List<Container> lanes = new ArrayList<>();
        for (Container container : containersById.values()) {
            if (container.isLane() && poolId.equals(container.parentContainerId())) {
                lanes.add(container);
            }
        }
        return lanes;
    }

    /**
     * Nodes of the given pool in the pool's declared member order.
     */
    public List<GraphNode> nodesInPool(String poolId) {
        Container pool = containersById.get(poolId);
        if (pool == null) {
            return List.of();
        }
        List<GraphNode> nodes = new ArrayList<>();
        for (String nodeId : pool.memberNodeIds()) {
            GraphNode node = nodesById.get(nodeId);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * @return the id of the lane the node is in, or null when it is in no lane
     */
    public String laneOf(String nodeId) {
        return laneByNode.get(nodeId);
    }

    /**
     * Pool of the node. Nodes inside a sub-process belong to the pool of the sub-process.
     */
    public String poolOf(String nodeId) {
        String current = nodeId;
        while (current != null) {
            String poolId = poolByNode.get(current);
            if (poolId != null) {
                return poolId;
            }
            GraphNode node = nodesById.get(current);
            current = node == null ? null : node.parentNodeId();
        }
        return null;
    }

    /**
     * Current lane of every node of the pool that sits in a lane.
     */
    public Map<String, String> laneMembership(String poolId) {
        Map<String, String> membership = new LinkedHashMap<>();
        for (GraphNode node : nodesInPool(poolId)) {
            String laneId = laneByNode.get(node.id());
            if (laneId != null) {
                membership.put(node.id(), laneId);
            }
        }
        return membership;
    }

    public List<GraphEdge> outgoingSequence(String nodeId) {
        GraphNode node = nodesById.get(nodeId);
        return node == null ? List.of() : sequenceEdges(node.outgoingEdgeIds());
    }

    public List<GraphEdge> incomingSequence(String nodeId) {
        GraphNode node = nodesById.get(nodeId);
        return node == null ? List.of() : sequenceEdges(node.incomingEdgeIds());
    }

    public List<GraphEdge> sequenceEdges() {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edgesById.values()) {
            if (edge.isSequence()) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Derives a snapshot in which the lanes of {@code poolId} hold the given membership.
     * Nodes of the pool missing from {@code laneByNodeId} keep their current lane.
     *
     * @param poolId       the pool whose lanes are rewritten
     * @param laneByNodeId target lane per node id
     * @return a new snapshot; this one is left untouched
     */
    public GraphSnapshot withLaneMembership(String poolId, Map<String, String> laneByNodeId) {
        List<Container> lanes = lanesOf(poolId);
        Map<String, List<String>> members = new LinkedHashMap<>();
        for (Container lane : lanes) {
            members.put(lane.id(), new ArrayList<>());
        }

        Map<String, GraphNode> updatedNodes = new LinkedHashMap<>(nodesById);
        for (GraphNode node : nodesInPool(poolId)) {
            String laneId = laneByNodeId.getOrDefault(node.id(), laneByNode.get(node.id()));
            if (laneId != null && members.containsKey(laneId)) {
                members.get(laneId).add(node.id());
                updatedNodes.put(node.id(), node.toBuilder().containerId(laneId).build());
            }
        }

        Map<String, Container> updatedContainers = new LinkedHashMap<>(containersById);
        for (Container lane : lanes) {
            updatedContainers.put(lane.id(), new Container(
                    lane.id(), lane.name(), lane.kind(), lane.parentContainerId(), members.get(lane.id())));
        }

        return new GraphSnapshot(updatedNodes, edgesById, updatedContainers);
    }

    private List<GraphEdge> sequenceEdges(List<String> edgeIds) {
        List<GraphEdge> result = new ArrayList<>(edgeIds.size());
        for (String edgeId : edgeIds) {
            GraphEdge edge = edgesById.get(edgeId);
            if (edge != null && edge.isSequence()) {
                result.add(edge);
            }
        }
        return result;
    }
}
