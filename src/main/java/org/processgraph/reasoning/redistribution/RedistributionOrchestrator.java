package org.processgraph.reasoning.redistribution;

import lombok.extern.slf4j.Slf4j;
import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.lanes.CoherenceScorer;
import org.processgraph.reasoning.lanes.LaneClassifier;
import org.processgraph.reasoning.lanes.models.AssignmentDraft;
import org.processgraph.reasoning.lanes.models.AssignmentReason;
import org.processgraph.reasoning.lanes.models.CoherenceReport;
import org.processgraph.reasoning.lanes.models.LaneAssignment;
import org.processgraph.reasoning.redistribution.models.Move;
import org.processgraph.reasoning.redistribution.models.RedistributionRequest;
import org.processgraph.reasoning.redistribution.models.RedistributionResult;
import org.processgraph.reasoning.redistribution.models.RedistributionStrategy;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.models.Container;
import org.processgraph.reasoning.snapshot.models.GraphNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moves the nodes of a pool between its lanes.
 * <p>
 * Dry-run and apply share every step up to producing the updated snapshot, so a dry-run
 * result lists exactly the moves an apply on the same snapshot performs. Requests that
 * cannot be served raise {@link RedistributionValidationException} before anything changes.
 */
@Slf4j
public class RedistributionOrchestrator {
    private static final String UNASSIGNED = "(unassigned)";

    private final AnalysisConfig config;
    private final RepositionListener repositionListener;

    public RedistributionOrchestrator(AnalysisConfig config) {
        this(config, RepositionListener.NONE);
    }

    public RedistributionOrchestrator(AnalysisConfig config, RepositionListener repositionListener) {
        this.config = config;
        this.repositionListener = repositionListener;
    }

    public RedistributionResult redistribute(GraphSnapshot snapshot, RedistributionRequest request) {
        if (request.strategy() == RedistributionStrategy.MANUAL) {
            return redistributeManually(snapshot, request);
        }

        Container pool = resolvePool(snapshot, request.poolId());
        List<Container> lanes = snapshot.lanesOf(pool.id());
        List<GraphNode> nodes = snapshot.nodesInPool(pool.id());
        Map<String, String> current = snapshot.laneMembership(pool.id());
        int threshold = config.lowCoherenceThreshold;

        RedistributionStrategy strategy = request.strategy();
        CoherenceReport before = null;
        if (request.validate()) {
            before = CoherenceScorer.score(snapshot, pool.id(), current, threshold);
            if (before.isAlreadyGood(threshold)) {
                log.info("Pool '{}' is already coherent ({}%), nothing to redistribute",
                        pool.displayName(), before.coherenceScore());
                return RedistributionResult.builder()
                        .strategy(strategy)
                        .poolId(pool.id())
                        .dryRun(request.dryRun())
                        .alreadyGood(true)
                        .message(String.format("Lane organization is already good (coherence %d%%, threshold %d%%). "
                                + "No changes made.", before.coherenceScore(), threshold))
                        .totalNodes(nodes.size())
                        .emptyLaneIds(emptyLanes(lanes, current))
                        .before(before)
                        .after(before)
                        .improvement(0)
                        .snapshot(snapshot)
                        .build();
            }
            strategy = RedistributionStrategy.MINIMIZE_CROSSINGS;
        }

        LaneAssignment proposed = switch (strategy) {
            case ROLE_BASED -> LaneClassifier.classify(snapshot, nodes, lanes, request.orderingHint(), config);
            case BALANCE -> assignBalanced(nodes, lanes);
            case MINIMIZE_CROSSINGS -> assignMinimizingCrossings(snapshot, nodes, lanes, current);
            case MANUAL -> throw new IllegalStateException("Manual strategy is handled separately");
        };

        List<Move> moves = toMoves(snapshot, nodes, current, proposed);
        Map<String, String> projected = new LinkedHashMap<>(current);
        moves.forEach(move -> projected.put(move.nodeId(), move.toLaneId()));

        CoherenceReport after = null;
        Integer improvement = null;
        if (request.validate()) {
            after = CoherenceScorer.score(snapshot, pool.id(), projected, threshold);
            improvement = after.coherenceScore() - before.coherenceScore();
        }

        String message = describe(request, strategy, moves.size(), nodes.size(), before, after);
        return finish(snapshot, request, pool, strategy, moves, nodes.size(), emptyLanes(lanes, projected),
                message, before, after, improvement);
    }

    private RedistributionResult redistributeManually(GraphSnapshot snapshot, RedistributionRequest request) {
        if (request.nodeIds() == null) {
            throw new RedistributionValidationException("Manual strategy requires a list of node ids to move");
        }
        if (request.targetLaneId() == null) {
            throw new RedistributionValidationException("Manual strategy requires a target lane id");
        }
        Container target = snapshot.container(request.targetLaneId());
        if (target == null) {
            throw new RedistributionValidationException("Target lane not found: " + request.targetLaneId());
        }
        if (!target.isLane()) {
            throw new RedistributionValidationException(String.format(
                    "Target '%s' is a pool, not a lane. Choose one of its lanes.", target.displayName()));
        }
        Container pool = snapshot.container(target.parentContainerId());
        if (request.poolId() != null && !request.poolId().equals(pool.id())) {
            throw new RedistributionValidationException(String.format(
                    "Target lane '%s' does not belong to pool '%s'", target.displayName(), request.poolId()));
        }
        List<Container> lanes = snapshot.lanesOf(pool.id());
        requireTwoLanes(pool, lanes);

        Set<String> poolNodeIds = snapshot.nodesInPool(pool.id()).stream()
                .map(GraphNode::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> unknown = request.nodeIds().stream()
                .filter(id -> !poolNodeIds.contains(id))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new RedistributionValidationException(String.format(
                    "Node(s) not found in pool '%s': %s", pool.displayName(), String.join(", ", unknown)));
        }

        List<GraphNode> nodes = new ArrayList<>();
        AssignmentDraft draft = new AssignmentDraft();
        for (String nodeId : new LinkedHashSet<>(request.nodeIds())) {
            nodes.add(snapshot.node(nodeId));
            draft.assign(nodeId, target.id(), AssignmentReason.MANUAL);
        }
        Map<String, String> current = snapshot.laneMembership(pool.id());
        List<Move> moves = toMoves(snapshot, nodes, current, draft.toAssignment());
        Map<String, String> projected = new LinkedHashMap<>(current);
        moves.forEach(move -> projected.put(move.nodeId(), move.toLaneId()));

        String message = describe(request, RedistributionStrategy.MANUAL, moves.size(), nodes.size(), null, null);
        return finish(snapshot, request, pool, RedistributionStrategy.MANUAL, moves, nodes.size(),
                emptyLanes(lanes, projected), message, null, null, null);
    }

    /**
     * Role matches first, then every remaining node in declared order to the lane with the
     * fewest members so far. Counts start from the role-matched nodes.
     */
    private static LaneAssignment assignBalanced(List<GraphNode> nodes, List<Container> lanes) {
        AssignmentDraft draft = new AssignmentDraft();
        LaneClassifier.assignByRole(nodes, lanes, draft);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Container lane : lanes) {
            counts.put(lane.id(), draft.countIn(lane.id()));
        }
        for (GraphNode node : nodes) {
            if (draft.isAssigned(node.id())) {
                continue;
            }
            String leastPopulated = findLeastPopulated(counts);
            draft.assign(node.id(), leastPopulated, AssignmentReason.BALANCE);
            counts.merge(leastPopulated, 1, Integer::sum);
        }
        return draft.toAssignment();
    }

    /**
     * Neighbor voting over every node, starting from the current membership. A node stays
     * where it is unless another lane strictly outvotes it.
     */
    private static LaneAssignment assignMinimizingCrossings(GraphSnapshot snapshot, List<GraphNode> nodes,
                                                           List<Container> lanes, Map<String, String> current) {
        AssignmentDraft draft = new AssignmentDraft(current);
        for (int pass = 0; pass < LaneClassifier.PROPAGATION_PASSES; pass++) {
            int changed = 0;
            for (GraphNode node : nodes) {
                String laneId = draft.laneOf(node.id());
                String best = LaneClassifier.voteForLane(snapshot, node.id(), draft, lanes, laneId);
                if (best != null && !best.equals(laneId)) {
                    draft.assign(node.id(), best, AssignmentReason.MINIMIZES_CROSSINGS);
                    changed++;
                }
            }
            if (changed == 0) {
                break;
            }
        }
        LaneClassifier.assignRemainingToFirstLane(nodes, lanes, draft);
        return draft.toAssignment();
    }

    private static String findLeastPopulated(Map<String, Integer> counts) {
        String best = null;
        int bestCount = Integer.MAX_VALUE;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() < bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static List<Move> toMoves(GraphSnapshot snapshot, List<GraphNode> nodes, Map<String, String> current,
                                      LaneAssignment proposed) {
        List<Move> moves = new ArrayList<>();
        for (GraphNode node : nodes) {
            String toLaneId = proposed.laneOf(node.id());
            String fromLaneId = current.get(node.id());
            if (toLaneId == null || toLaneId.equals(fromLaneId)) {
                continue;
            }
            moves.add(new Move(node.id(), node.displayName(), node.kind(),
                    fromLaneId, fromLaneId == null ? UNASSIGNED : snapshot.container(fromLaneId).displayName(),
                    toLaneId, snapshot.container(toLaneId).displayName(),
                    proposed.reasonFor(node.id())));
        }
        return moves;
    }

    private RedistributionResult finish(GraphSnapshot snapshot, RedistributionRequest request, Container pool,
                                        RedistributionStrategy strategy, List<Move> moves, int totalNodes,
                                        List<String> emptyLaneIds, String message,
                                        CoherenceReport before, CoherenceReport after, Integer improvement) {
        GraphSnapshot resulting = snapshot;
        boolean applied = false;
        if (!request.dryRun() && !moves.isEmpty()) {
            Map<String, String> changes = new LinkedHashMap<>();
            moves.forEach(move -> changes.put(move.nodeId(), move.toLaneId()));
            resulting = snapshot.withLaneMembership(pool.id(), changes);
            applied = true;
            if (request.reposition()) {
                repositionListener.repositionRequested(pool.id(), moves);
            }
        }
        log.info("{} ({} strategy, pool '{}')", message, strategy.code(), pool.displayName());
        if (!emptyLaneIds.isEmpty()) {
            log.info("Lanes left empty in pool '{}': {}", pool.displayName(), emptyLaneIds);
        }
        return RedistributionResult.builder()
                .strategy(strategy)
                .poolId(pool.id())
                .dryRun(request.dryRun())
                .applied(applied)
                .message(message)
                .moves(moves)
                .totalNodes(totalNodes)
                .emptyLaneIds(emptyLaneIds)
                .before(before)
                .after(after)
                .improvement(improvement)
                .snapshot(resulting)
                .build();
    }

    private static String describe(RedistributionRequest request, RedistributionStrategy strategy, int moved,
                                   int total, CoherenceReport before, CoherenceReport after) {
        String text;
        if (total == 0) {
            text = "No elements to redistribute.";
        } else if (moved == 0) {
            text = String.format("No elements could be moved using \"%s\" strategy.", strategy.code());
        } else if (request.dryRun()) {
            text = String.format("Dry run: would move %d of %d element(s) using \"%s\" strategy.",
                    moved, total, strategy.code());
        } else {
            text = String.format("Moved %d of %d element(s) using \"%s\" strategy.", moved, total, strategy.code());
        }
        if (before != null && after != null) {
            text += String.format(" Coherence: %d%% -> %d%%.", before.coherenceScore(), after.coherenceScore());
        }
        return text;
    }

    private static Container resolvePool(GraphSnapshot snapshot, String poolId) {
        if (poolId == null) {
            for (Container pool : snapshot.pools()) {
                if (snapshot.lanesOf(pool.id()).size() >= 2) {
                    return pool;
                }
            }
            throw new RedistributionValidationException(
                    "No pool with at least 2 lanes found. Need at least 2 lanes to redistribute elements.");
        }
        Container pool = snapshot.container(poolId);
        if (pool == null) {
            throw new RedistributionValidationException("Pool not found: " + poolId);
        }
        if (!pool.isPool()) {
            throw new RedistributionValidationException(String.format(
                    "'%s' is a lane, not a pool", pool.displayName()));
        }
        requireTwoLanes(pool, snapshot.lanesOf(pool.id()));
        return pool;
    }

    private static void requireTwoLanes(Container pool, List<Container> lanes) {
        if (lanes.size() < 2) {
            throw new RedistributionValidationException(String.format(
                    "Need at least 2 lanes to redistribute elements; pool '%s' has %d.",
                    pool.displayName(), lanes.size()));
        }
    }

    private static List<String> emptyLanes(List<Container> lanes, Map<String, String> membership) {
        Set<String> occupied = new LinkedHashSet<>(membership.values());
        return lanes.stream()
                .map(Container::id)
                .filter(id -> !occupied.contains(id))
                .collect(Collectors.toList());
    }
}
