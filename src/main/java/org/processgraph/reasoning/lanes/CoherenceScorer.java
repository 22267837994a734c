package org.processgraph.reasoning.lanes;

import lombok.extern.slf4j.Slf4j;
import org.processgraph.reasoning.issues.Issue;
import org.processgraph.reasoning.issues.IssueCode;
import org.processgraph.reasoning.lanes.models.CoherenceReport;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.models.Container;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores how well lane membership follows the sequence flow of a pool.
 */
@Slf4j
public class CoherenceScorer {

    /**
     * Scores the pool's current lane membership.
     */
    public static CoherenceReport score(GraphSnapshot snapshot, String poolId, int lowCoherenceThreshold) {
        return score(snapshot, poolId, snapshot.laneMembership(poolId), lowCoherenceThreshold);
    }

    /**
     * Scores a proposed assignment without touching the snapshot.
     *
     * @param laneByNode node id -> lane id; nodes missing from the map count as outside any lane
     */
    public static CoherenceReport score(GraphSnapshot snapshot, String poolId, Map<String, String> laneByNode,
                                        int lowCoherenceThreshold) {
        List<GraphNode> poolNodes = snapshot.nodesInPool(poolId);
        Set<String> inPool = poolNodes.stream().map(GraphNode::id).collect(Collectors.toCollection(HashSet::new));
        List<Container> lanes = snapshot.lanesOf(poolId);

        int intra = 0;
        List<String> crossIds = new ArrayList<>();
        for (GraphEdge flow : snapshot.sequenceEdges()) {
            if (!inPool.contains(flow.sourceNodeId()) || !inPool.contains(flow.targetNodeId())) {
                continue;
            }
            String sourceLane = laneByNode.get(flow.sourceNodeId());
            String targetLane = laneByNode.get(flow.targetNodeId());
            if (sourceLane != null && sourceLane.equals(targetLane)) {
                intra++;
            } else {
                crossIds.add(flow.id());
            }
        }
        int total = intra + crossIds.size();
        int coherenceScore = total == 0 ? 100 : (int) Math.round(100.0 * intra / total);

        List<Issue> issues = new ArrayList<>(findZigzags(snapshot, poolNodes, laneByNode));
        if (coherenceScore < lowCoherenceThreshold) {
            issues.add(new Issue(IssueCode.LOW_COHERENCE, String.format(
                    "Lane coherence is %d%% (threshold %d%%): %d of %d sequence flows cross lanes.",
                    coherenceScore, lowCoherenceThreshold, crossIds.size(), total), List.of(), crossIds));
        }
        if (!lanes.isEmpty()) {
            List<String> outside = poolNodes.stream()
                    .map(GraphNode::id)
                    .filter(id -> !laneByNode.containsKey(id))
                    .collect(Collectors.toList());
            if (!outside.isEmpty()) {
                issues.add(new Issue(IssueCode.ELEMENTS_NOT_IN_LANE, String.format(
                        "%d element(s) are not assigned to any lane: %s", outside.size(), String.join(", ", outside)),
                        outside));
            }
        }
        for (Container lane : lanes) {
            List<String> members = poolNodes.stream()
                    .map(GraphNode::id)
                    .filter(id -> lane.id().equals(laneByNode.get(id)))
                    .collect(Collectors.toList());
            if (members.size() == 1) {
                issues.add(new Issue(IssueCode.SINGLE_ELEMENT_LANE, String.format(
                        "Lane '%s' contains a single element.", lane.displayName()), members));
            }
        }

        log.debug("Pool '{}' coherence {}% ({} intra, {} cross, {} issue(s))",
                poolId, coherenceScore, intra, crossIds.size(), issues.size());
        return new CoherenceReport(coherenceScore, intra, crossIds.size(), crossIds, issues);
    }

    /**
     * A zigzag is a flow run A -> B -> C where A and C share a lane and B sits in another one.
     */
    private static List<Issue> findZigzags(GraphSnapshot snapshot, List<GraphNode> poolNodes,
                                           Map<String, String> laneByNode) {
        List<Issue> issues = new ArrayList<>();
        for (GraphNode middle : poolNodes) {
            String middleLane = laneByNode.get(middle.id());
            if (middleLane == null) {
                continue;
            }
            for (GraphEdge in : snapshot.incomingSequence(middle.id())) {
                String outerLane = laneByNode.get(in.sourceNodeId());
                if (outerLane == null || outerLane.equals(middleLane)) {
                    continue;
                }
                for (GraphEdge out : snapshot.outgoingSequence(middle.id())) {
                    if (!Objects.equals(outerLane, laneByNode.get(out.targetNodeId()))) {
                        continue;
                    }
                    issues.add(new Issue(IssueCode.ZIGZAG_FLOW, String.format(
                            "Flow %s -> %s -> %s leaves lane '%s' for '%s' and comes straight back.",
                            snapshot.node(in.sourceNodeId()).displayName(), middle.displayName(),
                            snapshot.node(out.targetNodeId()).displayName(),
                            laneName(snapshot, outerLane), laneName(snapshot, middleLane)),
                            List.of(in.sourceNodeId(), middle.id(), out.targetNodeId()),
                            List.of(in.id(), out.id())));
                }
            }
        }
        return issues;
    }

    private static String laneName(GraphSnapshot snapshot, String laneId) {
        Container lane = snapshot.container(laneId);
        return lane == null ? laneId : lane.displayName();
    }
}
