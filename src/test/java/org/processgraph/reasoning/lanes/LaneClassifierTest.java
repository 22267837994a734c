package org.processgraph.reasoning.lanes;

import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.lanes.models.AssignmentDraft;
import org.processgraph.reasoning.lanes.models.AssignmentReason;
import org.processgraph.reasoning.lanes.models.LaneAssignment;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.GraphSnapshotBuilder;
import org.processgraph.reasoning.snapshot.models.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LaneClassifierTest {
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private static GraphSnapshotBuilder pool(String... laneNames) {
        GraphSnapshotBuilder builder = new GraphSnapshotBuilder().pool("pool", "Process");
        for (int i = 0; i < laneNames.length; i++) {
            builder.lane("lane" + i, laneNames[i], "pool");
        }
        return builder;
    }

    @Test
    void shouldAssignTasksByDeclaredRole() {
        GraphSnapshot snapshot = pool("Support", "Manager")
                .task("t1", NodeKind.USER_TASK, "Answer ticket", "support-agent")
                .task("t2", NodeKind.USER_TASK, "Approve refund", "manager")
                .task("t3", NodeKind.USER_TASK, "Close ticket", "support-agent")
                .sequence("f1", "t1", "t2")
                .sequence("f2", "t2", "t3")
                .place("pool", "t1", "t2", "t3")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals("lane0", assignment.laneOf("t1"));
        assertEquals("lane1", assignment.laneOf("t2"));
        assertEquals("lane0", assignment.laneOf("t3"));
        assertEquals(AssignmentReason.ROLE_MATCH, assignment.reasonFor("t2"));
    }

    @Test
    void shouldBeDeterministic() {
        GraphSnapshot snapshot = pool("Clerks", "Automation")
                .event("start", NodeKind.START_EVENT)
                .task("a", NodeKind.USER_TASK, "Enter order", null)
                .gateway("xor", NodeKind.EXCLUSIVE_GATEWAY)
                .task("b", NodeKind.SERVICE_TASK, "Book order", null)
                .task("c", NodeKind.TASK, "Archive", null)
                .event("end", NodeKind.END_EVENT)
                .sequence("f1", "start", "a")
                .sequence("f2", "a", "xor")
                .sequence("f3", "xor", "b")
                .sequence("f4", "xor", "c")
                .sequence("f5", "b", "end")
                .place("pool", "start", "a", "xor", "b", "c", "end")
                .build();
        Map<String, Double> hints = Map.of("a", 10.0, "b", 20.0, "c", 30.0);

        LaneAssignment first = LaneClassifier.classify(snapshot, "pool", hints, config);
        LaneAssignment second = LaneClassifier.classify(snapshot, "pool", hints, config);

        assertEquals(first, second);
        assertEquals(6, first.size());
    }

    @Test
    void shouldRouteHumanAndAutomatedTasksToMatchingLanes() {
        GraphSnapshot snapshot = pool("Human Review", "System")
                .task("review", NodeKind.USER_TASK, "Review claim", null)
                .task("score", NodeKind.SERVICE_TASK, "Score claim", null)
                .task("call", NodeKind.MANUAL_TASK, "Call customer", null)
                .task("run", NodeKind.SCRIPT_TASK, "Run rules", null)
                .place("pool", "review", "score", "call", "run")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals("lane0", assignment.laneOf("review"));
        assertEquals("lane0", assignment.laneOf("call"));
        assertEquals("lane1", assignment.laneOf("score"));
        assertEquals("lane1", assignment.laneOf("run"));
        assertEquals(AssignmentReason.HUMAN_TASK, assignment.reasonFor("review"));
        assertEquals(AssignmentReason.AUTOMATED_TASK, assignment.reasonFor("score"));
    }

    @Test
    void shouldSplitRemainingTasksByOrderingHint() {
        GraphSnapshot snapshot = pool("Alpha", "Beta", "Gamma")
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .task("c", NodeKind.TASK, "C", null)
                .place("pool", "a", "b", "c")
                .build();
        Map<String, Double> hints = Map.of("c", 1.0, "a", 2.0);

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", hints, config);

        assertEquals("lane0", assignment.laneOf("c"));
        assertEquals("lane0", assignment.laneOf("a"));
        assertEquals("lane1", assignment.laneOf("b"));
        assertEquals(AssignmentReason.ORDERING_HINT, assignment.reasonFor("b"));
        assertFalse(assignment.laneByNode().containsValue("lane2"));
    }

    @Test
    void shouldWeightIncomingNeighborsOverOutgoing() {
        GraphSnapshot snapshot = pool("Sales", "Billing")
                .task("quote", NodeKind.TASK, "Quote", "sales")
                .gateway("xor", NodeKind.EXCLUSIVE_GATEWAY)
                .task("invoice", NodeKind.TASK, "Invoice", "billing")
                .sequence("f1", "quote", "xor")
                .sequence("f2", "xor", "invoice")
                .place("pool", "quote", "xor", "invoice")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals("lane0", assignment.laneOf("xor"));
        assertEquals(AssignmentReason.NEIGHBOR_MAJORITY, assignment.reasonFor("xor"));
    }

    @Test
    void shouldPropagateAcrossChainsOfControlNodes() {
        GraphSnapshot snapshot = pool("Sales", "Billing")
                .event("start", NodeKind.START_EVENT)
                .gateway("g1", NodeKind.EXCLUSIVE_GATEWAY)
                .gateway("g2", NodeKind.PARALLEL_GATEWAY)
                .task("invoice", NodeKind.TASK, "Invoice", "billing")
                .sequence("f1", "start", "g1")
                .sequence("f2", "g1", "g2")
                .sequence("f3", "g2", "invoice")
                .place("pool", "start", "g1", "g2", "invoice")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals("lane1", assignment.laneOf("g2"));
        assertEquals("lane1", assignment.laneOf("g1"));
        assertEquals("lane1", assignment.laneOf("start"));
        assertEquals(AssignmentReason.NEIGHBOR_MAJORITY, assignment.reasonFor("start"));
    }

    @Test
    void shouldBreakVoteTiesByDeclaredLaneOrder() {
        GraphSnapshot snapshot = pool("Sales", "Billing")
                .task("invoice", NodeKind.TASK, "Invoice", "billing")
                .task("quote", NodeKind.TASK, "Quote", "sales")
                .gateway("merge", NodeKind.EXCLUSIVE_GATEWAY)
                .sequence("f1", "invoice", "merge")
                .sequence("f2", "quote", "merge")
                .place("pool", "invoice", "quote", "merge")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals("lane0", assignment.laneOf("merge"));
    }

    @Test
    void shouldIgnoreVotesFromUnsupportedNodeKinds() {
        GraphSnapshot snapshot = pool("Sales", "Billing")
                .task("odd", NodeKind.OTHER, "Unsupported", null)
                .gateway("xor", NodeKind.EXCLUSIVE_GATEWAY)
                .sequence("f1", "odd", "xor")
                .place("pool", "odd", "xor")
                .build();
        AssignmentDraft draft = new AssignmentDraft(Map.of("odd", "lane1"));

        assertNull(LaneClassifier.voteForLane(snapshot, "xor", draft, snapshot.lanesOf("pool"), null));
    }

    @Test
    void shouldDefaultEverythingLeftToFirstLane() {
        GraphSnapshot snapshot = pool("Only")
                .task("a", NodeKind.USER_TASK, "A", null)
                .gateway("xor", NodeKind.EXCLUSIVE_GATEWAY)
                .task("odd", NodeKind.OTHER, "Unsupported", null)
                .sequence("f1", "a", "xor")
                .place("pool", "a", "xor", "odd")
                .build();

        LaneAssignment assignment = LaneClassifier.classify(snapshot, "pool", Map.of(), config);

        assertEquals(3, assignment.size());
        assertTrue(assignment.laneByNode().values().stream().allMatch("lane0"::equals));
        assertEquals(AssignmentReason.DEFAULT_LANE, assignment.reasonFor("a"));
    }

    @Test
    void shouldAssignNothingWithoutLanes() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .pool("pool", "Process")
                .task("a", NodeKind.TASK, "A", null)
                .place("pool", "a")
                .build();

        assertEquals(0, LaneClassifier.classify(snapshot, "pool", Map.of(), config).size());
    }
}
