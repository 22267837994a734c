package org.processgraph.reasoning.lanes.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.processgraph.reasoning.issues.Issue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * How well a lane assignment matches the pool's connectivity.
 *
 * @param coherenceScore   percentage (0-100) of sequence flows staying inside one lane
 * @param intraLaneFlows   sequence flows whose endpoints share a lane
 * @param crossLaneFlows   all other sequence flows of the pool
 * @param crossLaneFlowIds ids of the cross-lane flows
 * @param issues           lane organization findings
 */
public record CoherenceReport(
        int coherenceScore,
        int intraLaneFlows,
        int crossLaneFlows,
        List<String> crossLaneFlowIds,
        List<Issue> issues
) {
    public CoherenceReport {
        crossLaneFlowIds = List.copyOf(crossLaneFlowIds);
        issues = List.copyOf(issues);
    }

    /**
     * Issues a redistribution can fix.
     */
    @JsonIgnore
    public List<Issue> actionableIssues() {
        return issues.stream().filter(Issue::isActionable).collect(Collectors.toList());
    }

    /**
     * True when the score reaches the threshold and nothing actionable is reported.
     */
    public boolean isAlreadyGood(int threshold) {
        return coherenceScore >= threshold && actionableIssues().isEmpty();
    }
}
