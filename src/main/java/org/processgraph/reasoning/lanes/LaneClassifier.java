package org.processgraph.reasoning.lanes;

import lombok.extern.slf4j.Slf4j;
import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.lanes.models.AssignmentDraft;
import org.processgraph.reasoning.lanes.models.AssignmentReason;
import org.processgraph.reasoning.lanes.models.LaneAssignment;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.models.Container;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;
import org.processgraph.reasoning.snapshot.models.NodeFamily;
import org.processgraph.reasoning.snapshot.models.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assigns the nodes of a pool to its lanes.
 * <ol>
 *     <li>role match: a node's declared role against lane names</li>
 *     <li>type fallback: human / automated task kinds, or an ordering-hint split</li>
 *     <li>flow-control propagation: gateways and events follow their neighbors</li>
 * </ol>
 * Whatever is left lands in the first lane. The result is deterministic for a given input.
 */
@Slf4j
public class LaneClassifier {
    public static final int PROPAGATION_PASSES = 3;
    public static final int INCOMING_WEIGHT = 2;
    public static final int OUTGOING_WEIGHT = 1;

    /**
     * Classifies every node of the pool against the pool's lanes.
     *
     * @param orderingHint opaque per-node rank used by the type fallback; may be empty
     */
    public static LaneAssignment classify(GraphSnapshot snapshot, String poolId,
                                          Map<String, Double> orderingHint, AnalysisConfig config) {
        return classify(snapshot, snapshot.nodesInPool(poolId), snapshot.lanesOf(poolId), orderingHint, config);
    }

    public static LaneAssignment classify(GraphSnapshot snapshot, List<GraphNode> nodes, List<Container> lanes,
                                          Map<String, Double> orderingHint, AnalysisConfig config) {
        AssignmentDraft draft = new AssignmentDraft();
        if (lanes.isEmpty()) {
            return draft.toAssignment();
        }
        assignByRole(nodes, lanes, draft);
        assignByType(nodes, lanes, draft, orderingHint, config);
        propagateToFlowControl(snapshot, nodes, lanes, draft);
        assignRemainingToFirstLane(nodes, lanes, draft);
        return draft.toAssignment();
    }

    /**
     * Phase 1. Non flow-control nodes whose role matches a lane name go to the first such lane.
     */
    public static void assignByRole(List<GraphNode> nodes, List<Container> lanes, AssignmentDraft draft) {
        for (GraphNode node : nodes) {
            if (draft.isAssigned(node.id()) || node.kind().isFlowControl() || node.role() == null) {
                continue;
            }
            for (Container lane : lanes) {
                if (RoleMatcher.roleMatchesLane(node.role(), lane.name())) {
                    draft.assign(node.id(), lane.id(), AssignmentReason.ROLE_MATCH);
                    log.debug("'{}' -> '{}' (role '{}')", node.id(), lane.displayName(), node.role());
                    break;
                }
            }
        }
    }

    /**
     * Phase 2. Remaining tasks are routed by kind when the pool has exactly two lanes that
     * read as a human lane and an automated lane. Everything this cannot place is split in
     * ordering-hint order: the first half to the first lane, the rest to the second.
     */
    public static void assignByType(List<GraphNode> nodes, List<Container> lanes, AssignmentDraft draft,
                                    Map<String, Double> orderingHint, AnalysisConfig config) {
        if (lanes.size() < 2) {
            return;
        }
        List<GraphNode> remaining = nodes.stream()
                .filter(n -> !draft.isAssigned(n.id()))
                .filter(n -> n.kind().family() == NodeFamily.TASK)
                .collect(Collectors.toList());
        if (remaining.isEmpty()) {
            return;
        }

        List<GraphNode> unrouted = new ArrayList<>();
        Container humanLane = null;
        Container automatedLane = null;
        if (lanes.size() == 2) {
            humanLane = findHintedLane(lanes, config.humanLaneHints);
            automatedLane = findHintedLane(lanes, config.automatedLaneHints);
        }
        boolean routeByKind = humanLane != null && automatedLane != null && !humanLane.id().equals(automatedLane.id());

        for (GraphNode node : remaining) {
            if (routeByKind && node.kind().isHumanTask()) {
                draft.assign(node.id(), humanLane.id(), AssignmentReason.HUMAN_TASK);
            } else if (routeByKind && node.kind().isAutomatedTask()) {
                draft.assign(node.id(), automatedLane.id(), AssignmentReason.AUTOMATED_TASK);
            } else {
                unrouted.add(node);
            }
        }

        Map<String, Double> hints = orderingHint == null ? Map.of() : orderingHint;
        // stable sort: unhinted nodes keep declared order behind the hinted ones
        List<GraphNode> ordered = new ArrayList<>(unrouted);
        ordered.sort(Comparator.comparing((GraphNode n) -> hints.get(n.id()),
                Comparator.nullsLast(Comparator.naturalOrder())));
        int firstHalf = (ordered.size() + 1) / 2;
        for (int i = 0; i < ordered.size(); i++) {
            Container lane = i < firstHalf ? lanes.get(0) : lanes.get(1);
            draft.assign(ordered.get(i).id(), lane.id(), AssignmentReason.ORDERING_HINT);
        }
    }

    /**
     * Phase 3. Unassigned gateways and events take the lane their neighbors vote for.
     * Repeated {@link #PROPAGATION_PASSES} times so chains of control nodes resolve.
     */
    public static void propagateToFlowControl(GraphSnapshot snapshot, List<GraphNode> nodes, List<Container> lanes,
                                              AssignmentDraft draft) {
        for (int pass = 0; pass < PROPAGATION_PASSES; pass++) {
            int assigned = 0;
            for (GraphNode node : nodes) {
                if (draft.isAssigned(node.id()) || !node.kind().isFlowControl()) {
                    continue;
                }
                String laneId = voteForLane(snapshot, node.id(), draft, lanes, null);
                if (laneId != null) {
                    draft.assign(node.id(), laneId, AssignmentReason.NEIGHBOR_MAJORITY);
                    assigned++;
                }
            }
            if (assigned == 0) {
                break;
            }
        }
    }

    public static void assignRemainingToFirstLane(List<GraphNode> nodes, List<Container> lanes, AssignmentDraft draft) {
        if (lanes.isEmpty()) {
            return;
        }
        for (GraphNode node : nodes) {
            if (!draft.isAssigned(node.id())) {
                draft.assign(node.id(), lanes.get(0).id(), AssignmentReason.DEFAULT_LANE);
            }
        }
    }

    /**
     * Tallies the lanes of a node's assigned sequence-flow neighbors. A predecessor weighs
     * {@value #INCOMING_WEIGHT}, a successor {@value #OUTGOING_WEIGHT}. Neighbors of kind
     * {@link NodeKind#OTHER} and neighbors outside the candidate lanes do not vote.
     *
     * @param preferredLaneId lane that wins a tie it is part of, may be null
     * @return the winning lane id, or null when no neighbor voted
     */
    public static String voteForLane(GraphSnapshot snapshot, String nodeId, AssignmentDraft draft,
                                     List<Container> lanes, String preferredLaneId) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (Container lane : lanes) {
            votes.put(lane.id(), 0);
        }
        boolean anyVote = false;
        for (GraphEdge flow : snapshot.incomingSequence(nodeId)) {
            anyVote |= addVote(snapshot, flow.sourceNodeId(), draft, votes, INCOMING_WEIGHT);
        }
        for (GraphEdge flow : snapshot.outgoingSequence(nodeId)) {
            anyVote |= addVote(snapshot, flow.targetNodeId(), draft, votes, OUTGOING_WEIGHT);
        }
        if (!anyVote) {
            return null;
        }

        int best = votes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (preferredLaneId != null && votes.getOrDefault(preferredLaneId, -1) == best) {
            return preferredLaneId;
        }
        // LinkedHashMap keeps declared lane order for the tie-break
        for (Map.Entry<String, Integer> entry : votes.entrySet()) {
            if (entry.getValue() == best) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static boolean addVote(GraphSnapshot snapshot, String neighborId, AssignmentDraft draft,
                                   Map<String, Integer> votes, int weight) {
        GraphNode neighbor = snapshot.node(neighborId);
        if (neighbor == null || neighbor.kind() == NodeKind.OTHER) {
            return false;
        }
        String laneId = draft.laneOf(neighborId);
        if (laneId == null || !votes.containsKey(laneId)) {
            return false;
        }
        votes.merge(laneId, weight, Integer::sum);
        return true;
    }

    private static Container findHintedLane(List<Container> lanes, List<String> hints) {
        for (Container lane : lanes) {
            if (RoleMatcher.nameMatchesAnyHint(lane.name(), hints)) {
                return lane;
            }
        }
        return null;
    }
}
