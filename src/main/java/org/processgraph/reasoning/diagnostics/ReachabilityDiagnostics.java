package org.processgraph.reasoning.diagnostics;

import lombok.extern.slf4j.Slf4j;
import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.issues.Issue;
import org.processgraph.reasoning.issues.IssueCode;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.models.EventTrigger;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;
import org.processgraph.reasoning.snapshot.models.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Forward-traversal checks for graph shapes that deadlock or are ambiguous at runtime.
 * <p>
 * All checks are pure: they read the snapshot, never modify it, keep no state between
 * calls and return their findings as {@link Issue}s instead of throwing.
 */
@Slf4j
public class ReachabilityDiagnostics {

    /**
     * Runs every check over the whole snapshot.
     * Gateway balance is checked for splits whose kind is listed in
     * {@link AnalysisConfig#balanceCheckedGatewayKinds}.
     */
    public static List<Issue> runAll(GraphSnapshot snapshot, AnalysisConfig config) {
        List<Issue> issues = new ArrayList<>();
        for (GraphNode node : snapshot.nodes()) {
            if (config.balanceCheckedGatewayKinds.contains(node.kind()) && isSplit(snapshot, node)) {
                issues.addAll(checkGatewayBalance(snapshot, node.id(), config.gatewayDepthLimit));
            }
        }
        issues.addAll(checkImplicitMerge(snapshot));
        issues.addAll(checkDanglingBoundary(snapshot));
        issues.addAll(checkUnpairedLink(snapshot));
        log.debug("Reachability diagnostics found {} issue(s)", issues.size());
        return issues;
    }

    public static List<Issue> checkGatewayBalance(GraphSnapshot snapshot, String splitId) {
        return checkGatewayBalance(snapshot, splitId, AnalysisConfig.DEFAULT_GATEWAY_DEPTH_LIMIT);
    }

    /**
     * Checks that every branch of a split gateway reaches one and the same join.
     * <p>
     * A join is recognised by shape: a gateway of the split's kind with at most one outgoing
     * sequence flow. Incoming counts are ignored on purpose, since in the broken case the
     * join is missing exactly the branch that was never connected. A branch is lost when it
     * ends (end event or no outgoing flow) or exceeds {@code depthLimit} before a join.
     * Nested splits of the same kind are tracked along each path so that an inner join
     * closes the inner split instead of satisfying the outer one. A nested split whose
     * branches run straight into a join that another branch reaches directly is joined
     * there.
     *
     * @param snapshot   the graph
     * @param splitId    id of the gateway to check
     * @param depthLimit maximum walk depth per branch
     * @return at most one issue; empty when the node is not a split or is balanced
     * @throws IllegalArgumentException if the snapshot has no node {@code splitId}
     */
    public static List<Issue> checkGatewayBalance(GraphSnapshot snapshot, String splitId, int depthLimit) {
        GraphNode split = snapshot.node(splitId);
        if (split == null) {
            throw new IllegalArgumentException("Unknown node: " + splitId);
        }
        if (!split.kind().isGateway() || !isSplit(snapshot, split)) {
            return List.of();
        }

        List<GraphEdge> outgoing = snapshot.outgoingSequence(splitId);
        List<String> branchJoins = new ArrayList<>();
        List<List<String>> branchClosedJoins = new ArrayList<>();
        for (GraphEdge flow : outgoing) {
            Set<String> visited = new HashSet<>();
            visited.add(splitId);
            List<String> closedJoins = new ArrayList<>();
            branchJoins.add(findForwardJoin(
                    snapshot, flow.targetNodeId(), split.kind(), visited, 1, 0, depthLimit, closedJoins));
            branchClosedJoins.add(closedJoins);
        }

        // a nested split may close at the outer join itself; that join counts when a sibling branch reaches it
        Set<String> directJoins = branchJoins.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        List<BranchOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < outgoing.size(); i++) {
            GraphEdge flow = outgoing.get(i);
            String joinId = branchJoins.get(i);
            if (joinId == null) {
                joinId = branchClosedJoins.get(i).stream().filter(directJoins::contains).findFirst().orElse(null);
            }
            outcomes.add(new BranchOutcome(flow, snapshot.node(flow.targetNodeId()), joinId));
        }

        List<BranchOutcome> joined = outcomes.stream().filter(BranchOutcome::reachedJoin).collect(Collectors.toList());
        List<BranchOutcome> lost = outcomes.stream().filter(o -> !o.reachedJoin()).collect(Collectors.toList());
        String label = kindLabel(split.kind());

        if (!lost.isEmpty() && !joined.isEmpty()) {
            String missing = lost.stream().map(o -> o.branchTarget().displayName()).collect(Collectors.joining(", "));
            List<String> nodeIds = new ArrayList<>();
            nodeIds.add(splitId);
            lost.forEach(o -> nodeIds.add(o.branchTarget().id()));
            List<String> edgeIds = lost.stream().map(o -> o.flow().id()).collect(Collectors.toList());

            return List.of(new Issue(IssueCode.UNBALANCED_SPLIT, String.format(
                    "%s split gateway '%s' has %d outgoing branches, but branch(es) via %s do not reach the join gateway. "
                            + "The join will deadlock waiting for tokens that never arrive. "
                            + "Connect all branches to the join, or use an exclusive path if branches are optional.",
                    label, split.displayName(), outgoing.size(), missing), nodeIds, edgeIds));
        }

        if (lost.isEmpty() && joined.size() >= 2) {
            Set<String> joinIds = new LinkedHashSet<>();
            joined.forEach(o -> joinIds.add(o.joinId()));
            if (joinIds.size() > 1) {
                List<String> nodeIds = new ArrayList<>();
                nodeIds.add(splitId);
                nodeIds.addAll(joinIds);
                return List.of(new Issue(IssueCode.DIVERGENT_JOINS, String.format(
                        "%s split gateway '%s' has branches converging at different join gateways (%s). "
                                + "All branches of a split should converge at a single join gateway.",
                        label, split.displayName(), String.join(", ", joinIds)), nodeIds));
            }
        }

        // no branch reaching any join is a legal set of independent paths
        return List.of();
    }

    /**
     * Reports every task or event that merges two or more sequence flows without a gateway.
     */
    public static List<Issue> checkImplicitMerge(GraphSnapshot snapshot) {
        List<Issue> issues = new ArrayList<>();
        for (GraphNode node : snapshot.nodes()) {
            switch (node.kind().family()) {
                case TASK:
                case EVENT:
                    List<GraphEdge> incoming = snapshot.incomingSequence(node.id());
                    if (incoming.size() >= 2) {
                        issues.add(new Issue(IssueCode.IMPLICIT_MERGE, String.format(
                                "'%s' has %d incoming sequence flows. Merge them with an explicit gateway.",
                                node.displayName(), incoming.size()),
                                List.of(node.id()),
                                incoming.stream().map(GraphEdge::id).collect(Collectors.toList())));
                    }
                    break;
                case GATEWAY:
                case OTHER:
                    break;
            }
        }
        return issues;
    }

    /**
     * Reports boundary events with no outgoing sequence flow. Compensation boundary events
     * are exempt: their handler is attached by association.
     */
    public static List<Issue> checkDanglingBoundary(GraphSnapshot snapshot) {
        List<Issue> issues = new ArrayList<>();
        for (GraphNode node : snapshot.nodes()) {
            if (node.kind() != NodeKind.BOUNDARY_EVENT) {
                continue;
            }
            if (node.triggers().equals(Set.of(EventTrigger.COMPENSATE))) {
                continue;
            }
            if (snapshot.outgoingSequence(node.id()).isEmpty()) {
                issues.add(new Issue(IssueCode.DANGLING_BOUNDARY_EVENT, String.format(
                        "Boundary event '%s' has no outgoing sequence flow, so the exception path it starts goes nowhere.",
                        node.displayName()), List.of(node.id())));
            }
        }
        return issues;
    }

    /**
     * Reports link throw events that have no link catch event with the same name in the
     * same pool.
     */
    public static List<Issue> checkUnpairedLink(GraphSnapshot snapshot) {
        Set<String> catchKeys = new HashSet<>();
        for (GraphNode node : snapshot.nodes()) {
            if (node.kind() == NodeKind.INTERMEDIATE_CATCH_EVENT && node.hasTrigger(EventTrigger.LINK)
                    && !isBlank(node.linkName())) {
                catchKeys.add(linkKey(snapshot, node));
            }
        }

        List<Issue> issues = new ArrayList<>();
        for (GraphNode node : snapshot.nodes()) {
            if (node.kind() != NodeKind.INTERMEDIATE_THROW_EVENT || !node.hasTrigger(EventTrigger.LINK)) {
                continue;
            }
            if (isBlank(node.linkName())) {
                issues.add(new Issue(IssueCode.UNPAIRED_LINK_EVENT, String.format(
                        "Link throw event '%s' has no link name and cannot be paired with a link catch event.",
                        node.displayName()), List.of(node.id())));
            } else if (!catchKeys.contains(linkKey(snapshot, node))) {
                issues.add(new Issue(IssueCode.UNPAIRED_LINK_EVENT, String.format(
                        "Link throw event '%s' has no matching link catch event named '%s'.",
                        node.displayName(), node.linkName()), List.of(node.id())));
            }
        }
        return issues;
    }

    static boolean isSplit(GraphSnapshot snapshot, GraphNode node) {
        return snapshot.incomingSequence(node.id()).size() <= 1 && snapshot.outgoingSequence(node.id()).size() >= 2;
    }

    private static String findForwardJoin(GraphSnapshot snapshot, String nodeId, NodeKind splitKind,
                                          Set<String> visited, int depth, int nesting, int depthLimit,
                                          List<String> closedJoins) {
        if (depth > depthLimit) {
            log.debug("Branch walk stopped at '{}': depth limit {} exceeded", nodeId, depthLimit);
            return null;
        }
        if (!visited.add(nodeId)) {
            return null;
        }
        GraphNode node = snapshot.node(nodeId);
        List<GraphEdge> outgoing = snapshot.outgoingSequence(nodeId);

        int level = nesting;
        if (node.kind() == splitKind) {
            if (outgoing.size() <= 1) {
                if (level == 0) {
                    return node.id();
                }
                closedJoins.add(node.id());
                level--;
            } else if (snapshot.incomingSequence(nodeId).size() <= 1) {
                level++;
            }
        }

        if (node.kind() == NodeKind.END_EVENT || outgoing.isEmpty()) {
            return null;
        }
        for (GraphEdge flow : outgoing) {
            String joinId = findForwardJoin(
                    snapshot, flow.targetNodeId(), splitKind, visited, depth + 1, level, depthLimit, closedJoins);
            if (joinId != null) {
                return joinId;
            }
        }
        return null;
    }

    private static String kindLabel(NodeKind kind) {
        switch (kind) {
            case PARALLEL_GATEWAY:
                return "Parallel";
            case INCLUSIVE_GATEWAY:
                return "Inclusive";
            case EXCLUSIVE_GATEWAY:
                return "Exclusive";
            case EVENT_BASED_GATEWAY:
                return "Event-based";
            default:
                return "Gateway";
        }
    }

    private static String linkKey(GraphSnapshot snapshot, GraphNode node) {
        return snapshot.poolOf(node.id()) + "|" + node.linkName().trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private record BranchOutcome(GraphEdge flow, GraphNode branchTarget, String joinId) {
        boolean reachedJoin() {
            return joinId != null;
        }
    }
}
