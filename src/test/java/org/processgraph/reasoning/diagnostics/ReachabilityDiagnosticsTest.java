package org.processgraph.reasoning.diagnostics;

import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.issues.Issue;
import org.processgraph.reasoning.issues.IssueCode;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.GraphSnapshotBuilder;
import org.processgraph.reasoning.snapshot.models.EventTrigger;
import org.processgraph.reasoning.snapshot.models.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityDiagnosticsTest {

    /**
     * start -> split -> a, b, c; a and b reach the join, c ends.
     */
    private static GraphSnapshotBuilder splitWithDeadEnd(boolean reversedBranches) {
        GraphSnapshotBuilder builder = new GraphSnapshotBuilder()
                .event("start", NodeKind.START_EVENT)
                .gateway("split", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "Check stock", null)
                .task("b", NodeKind.TASK, "Check credit", null)
                .task("c", NodeKind.TASK, "Notify customer", null)
                .gateway("join", NodeKind.PARALLEL_GATEWAY)
                .event("endC", NodeKind.END_EVENT)
                .event("end", NodeKind.END_EVENT)
                .sequence("f0", "start", "split");
        if (reversedBranches) {
            builder.sequence("fc", "split", "c").sequence("fb", "split", "b").sequence("fa", "split", "a");
        } else {
            builder.sequence("fa", "split", "a").sequence("fb", "split", "b").sequence("fc", "split", "c");
        }
        return builder
                .sequence("fa2", "a", "join")
                .sequence("fb2", "b", "join")
                .sequence("fc2", "c", "endC")
                .sequence("fj", "join", "end");
    }

    @Test
    void shouldReportSplitWithDeadEndBranch() {
        GraphSnapshot snapshot = splitWithDeadEnd(false).build();

        List<Issue> issues = ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split");

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(IssueCode.UNBALANCED_SPLIT, issue.code());
        assertEquals(List.of("split", "c"), issue.nodeIds());
        assertEquals(List.of("fc"), issue.edgeIds());
        assertTrue(issue.message().contains("Notify customer"));
        assertFalse(issue.message().contains("Check stock"));
    }

    @Test
    void shouldGiveSameVerdictForPermutedBranches() {
        Issue forward = ReachabilityDiagnostics.checkGatewayBalance(splitWithDeadEnd(false).build(), "split").get(0);
        Issue reversed = ReachabilityDiagnostics.checkGatewayBalance(splitWithDeadEnd(true).build(), "split").get(0);

        assertEquals(forward.code(), reversed.code());
        assertEquals(new HashSet<>(forward.nodeIds()), new HashSet<>(reversed.nodeIds()));
    }

    @Test
    void shouldAcceptBalancedSplit() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .gateway("join", NodeKind.PARALLEL_GATEWAY)
                .sequence("f1", "split", "a")
                .sequence("f2", "split", "b")
                .sequence("f3", "a", "join")
                .sequence("f4", "b", "join")
                .build();

        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split").isEmpty());
    }

    @Test
    void shouldAcceptBranchesThatAllTerminate() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .event("endA", NodeKind.END_EVENT)
                .sequence("f1", "split", "a")
                .sequence("f2", "split", "b")
                .sequence("f3", "a", "endA")
                .build();

        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split").isEmpty());
    }

    @Test
    void shouldReportBranchesConvergingAtDifferentJoins() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.INCLUSIVE_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .gateway("joinA", NodeKind.INCLUSIVE_GATEWAY)
                .gateway("joinB", NodeKind.INCLUSIVE_GATEWAY)
                .sequence("f1", "split", "a")
                .sequence("f2", "split", "b")
                .sequence("f3", "a", "joinA")
                .sequence("f4", "b", "joinB")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split");

        assertEquals(1, issues.size());
        assertEquals(IssueCode.DIVERGENT_JOINS, issues.get(0).code());
        assertEquals(List.of("split", "joinA", "joinB"), issues.get(0).nodeIds());
    }

    /**
     * outer -> [inner -> (x -> innerJoin, y -> end)], [z -> outerJoin]; innerJoin -> outerJoin
     */
    private static GraphSnapshot nestedSplits() {
        return new GraphSnapshotBuilder()
                .gateway("outer", NodeKind.PARALLEL_GATEWAY)
                .gateway("inner", NodeKind.PARALLEL_GATEWAY)
                .task("x", NodeKind.TASK, "X", null)
                .task("y", NodeKind.TASK, "Y", null)
                .task("z", NodeKind.TASK, "Z", null)
                .gateway("innerJoin", NodeKind.PARALLEL_GATEWAY)
                .gateway("outerJoin", NodeKind.PARALLEL_GATEWAY)
                .event("end", NodeKind.END_EVENT)
                .sequence("f1", "outer", "inner")
                .sequence("f2", "outer", "z")
                .sequence("f3", "inner", "x")
                .sequence("f4", "inner", "y")
                .sequence("f5", "x", "innerJoin")
                .sequence("f6", "y", "end")
                .sequence("f7", "innerJoin", "outerJoin")
                .sequence("f8", "z", "outerJoin")
                .build();
    }

    @Test
    void shouldNotLetInnerJoinSatisfyOuterSplit() {
        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(nestedSplits(), "outer").isEmpty());
    }

    @Test
    void shouldStillCheckInnerSplitOnItsOwn() {
        List<Issue> issues = ReachabilityDiagnostics.checkGatewayBalance(nestedSplits(), "inner");

        assertEquals(1, issues.size());
        assertEquals(IssueCode.UNBALANCED_SPLIT, issues.get(0).code());
        assertEquals(List.of("inner", "y"), issues.get(0).nodeIds());
    }

    /**
     * outer -> [inner -> (a, b)], [c]; a, b and c all reach join
     */
    private static GraphSnapshot innerSplitIntoSharedJoin() {
        return new GraphSnapshotBuilder()
                .gateway("outer", NodeKind.PARALLEL_GATEWAY)
                .gateway("inner", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .task("c", NodeKind.TASK, "C", null)
                .gateway("join", NodeKind.PARALLEL_GATEWAY)
                .event("end", NodeKind.END_EVENT)
                .sequence("f1", "outer", "inner")
                .sequence("f2", "outer", "c")
                .sequence("f3", "inner", "a")
                .sequence("f4", "inner", "b")
                .sequence("f5", "a", "join")
                .sequence("f6", "b", "join")
                .sequence("f7", "c", "join")
                .sequence("f8", "join", "end")
                .build();
    }

    @Test
    void shouldAcceptInnerSplitClosingAtOuterJoin() {
        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(innerSplitIntoSharedJoin(), "outer").isEmpty());
        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(innerSplitIntoSharedJoin(), "inner").isEmpty());
    }

    @Test
    void shouldReportInnerSplitWhoseJoinNeverReachesOuterJoin() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("outer", NodeKind.PARALLEL_GATEWAY)
                .gateway("inner", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .task("c", NodeKind.TASK, "C", null)
                .gateway("innerJoin", NodeKind.PARALLEL_GATEWAY)
                .gateway("outerJoin", NodeKind.PARALLEL_GATEWAY)
                .event("endInner", NodeKind.END_EVENT)
                .event("end", NodeKind.END_EVENT)
                .sequence("f1", "outer", "inner")
                .sequence("f2", "outer", "c")
                .sequence("f3", "inner", "a")
                .sequence("f4", "inner", "b")
                .sequence("f5", "a", "innerJoin")
                .sequence("f6", "b", "innerJoin")
                .sequence("f7", "innerJoin", "endInner")
                .sequence("f8", "c", "outerJoin")
                .sequence("f9", "outerJoin", "end")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkGatewayBalance(snapshot, "outer");

        assertEquals(1, issues.size());
        assertEquals(IssueCode.UNBALANCED_SPLIT, issues.get(0).code());
        assertEquals(List.of("outer", "inner"), issues.get(0).nodeIds());
        assertEquals(List.of("f1"), issues.get(0).edgeIds());
    }

    @Test
    void shouldTreatBranchBeyondDepthLimitAsLost() {
        GraphSnapshotBuilder builder = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.PARALLEL_GATEWAY)
                .gateway("join", NodeKind.PARALLEL_GATEWAY)
                .sequence("short", "split", "join");
        String previous = "split";
        for (int i = 0; i < 30; i++) {
            builder.task("t" + i, NodeKind.TASK, null, null);
            builder.sequence("s" + i, previous, "t" + i);
            previous = "t" + i;
        }
        GraphSnapshot snapshot = builder.sequence("last", previous, "join").build();

        assertEquals(IssueCode.UNBALANCED_SPLIT,
                ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split").get(0).code());
        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split", 40).isEmpty());
    }

    @Test
    void shouldTerminateOnCycles() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.PARALLEL_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .task("loop", NodeKind.TASK, "Loop", null)
                .gateway("join", NodeKind.PARALLEL_GATEWAY)
                .sequence("f1", "split", "a")
                .sequence("f2", "split", "loop")
                .sequence("f3", "a", "join")
                .sequence("f4", "loop", "b")
                .sequence("f5", "b", "loop")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split");

        assertEquals(1, issues.size());
        assertEquals(List.of("split", "loop"), issues.get(0).nodeIds());
    }

    @Test
    void shouldIgnoreNonSplitsAndRejectUnknownIds() {
        GraphSnapshot snapshot = splitWithDeadEnd(false).build();

        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(snapshot, "join").isEmpty());
        assertTrue(ReachabilityDiagnostics.checkGatewayBalance(snapshot, "a").isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> ReachabilityDiagnostics.checkGatewayBalance(snapshot, "nope"));
    }

    @Test
    void shouldReportImplicitMergesOnTasksAndEvents() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .task("merge", NodeKind.TASK, "Merge here", null)
                .event("end", NodeKind.END_EVENT)
                .gateway("xor", NodeKind.EXCLUSIVE_GATEWAY)
                .sequence("f1", "a", "merge")
                .sequence("f2", "b", "merge")
                .sequence("f3", "merge", "end")
                .sequence("f4", "a", "end")
                .sequence("f5", "b", "xor")
                .sequence("f6", "merge", "xor")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkImplicitMerge(snapshot);

        assertEquals(2, issues.size());
        assertEquals(List.of("merge"), issues.get(0).nodeIds());
        assertEquals(List.of("f1", "f2"), issues.get(0).edgeIds());
        assertEquals(List.of("end"), issues.get(1).nodeIds());
        assertTrue(issues.stream().allMatch(i -> i.code() == IssueCode.IMPLICIT_MERGE));
    }

    @Test
    void shouldReportDanglingBoundaryEventsExceptCompensation() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .event("timeout", NodeKind.BOUNDARY_EVENT, EventTrigger.TIMER)
                .event("compensate", NodeKind.BOUNDARY_EVENT, EventTrigger.COMPENSATE)
                .event("error", NodeKind.BOUNDARY_EVENT, EventTrigger.ERROR)
                .task("handle", NodeKind.TASK, "Handle error", null)
                .sequence("f1", "error", "handle")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkDanglingBoundary(snapshot);

        assertEquals(1, issues.size());
        assertEquals(IssueCode.DANGLING_BOUNDARY_EVENT, issues.get(0).code());
        assertEquals(List.of("timeout"), issues.get(0).nodeIds());
    }

    @Test
    void shouldReportLinkThrowWithoutCatchInSamePool() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .linkEvent("throwA", NodeKind.INTERMEDIATE_THROW_EVENT, "A")
                .linkEvent("catchA", NodeKind.INTERMEDIATE_CATCH_EVENT, "A")
                .linkEvent("throwB", NodeKind.INTERMEDIATE_THROW_EVENT, "B")
                .linkEvent("throwC", NodeKind.INTERMEDIATE_THROW_EVENT, "C")
                .linkEvent("catchC", NodeKind.INTERMEDIATE_CATCH_EVENT, "C")
                .linkEvent("throwBlank", NodeKind.INTERMEDIATE_THROW_EVENT, " ")
                .pool("p1", "First")
                .pool("p2", "Second")
                .place("p1", "throwA", "catchA", "throwB", "throwC", "throwBlank")
                .place("p2", "catchC")
                .build();

        List<Issue> issues = ReachabilityDiagnostics.checkUnpairedLink(snapshot);

        Set<String> reported = new HashSet<>();
        issues.forEach(i -> reported.addAll(i.nodeIds()));
        assertEquals(Set.of("throwB", "throwC", "throwBlank"), reported);
        assertTrue(issues.stream().allMatch(i -> i.code() == IssueCode.UNPAIRED_LINK_EVENT));
    }

    @Test
    void shouldSweepOnlyConfiguredGatewayKinds() {
        GraphSnapshot snapshot = new GraphSnapshotBuilder()
                .gateway("split", NodeKind.EXCLUSIVE_GATEWAY)
                .task("a", NodeKind.TASK, "A", null)
                .task("b", NodeKind.TASK, "B", null)
                .gateway("join", NodeKind.EXCLUSIVE_GATEWAY)
                .event("end", NodeKind.END_EVENT)
                .sequence("f1", "split", "a")
                .sequence("f2", "split", "b")
                .sequence("f3", "a", "join")
                .sequence("f4", "b", "end")
                .build();
        AnalysisConfig config = AnalysisConfig.defaults();

        assertTrue(ReachabilityDiagnostics.runAll(snapshot, config).isEmpty());
        assertEquals(1, ReachabilityDiagnostics.checkGatewayBalance(snapshot, "split").size());

        config.balanceCheckedGatewayKinds = List.of(NodeKind.EXCLUSIVE_GATEWAY);
        assertEquals(IssueCode.UNBALANCED_SPLIT, ReachabilityDiagnostics.runAll(snapshot, config).get(0).code());
    }

    @Test
    void shouldAggregateAllChecksWithoutMutatingSnapshot() {
        GraphSnapshot snapshot = splitWithDeadEnd(false).build();
        int edgesBefore = snapshot.edges().size();

        List<Issue> issues = ReachabilityDiagnostics.runAll(snapshot, AnalysisConfig.defaults());

        assertEquals(1, issues.size());
        assertEquals(IssueCode.UNBALANCED_SPLIT, issues.get(0).code());
        assertEquals(edgesBefore, snapshot.edges().size());
    }
}
