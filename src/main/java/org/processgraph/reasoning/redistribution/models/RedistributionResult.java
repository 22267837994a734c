package org.processgraph.reasoning.redistribution.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.processgraph.reasoning.lanes.models.CoherenceReport;
import org.processgraph.reasoning.snapshot.GraphSnapshot;

import java.util.List;

/**
 * Outcome of a redistribution.
 *
 * @param applied      true when the moves were applied to {@code snapshot}
 * @param alreadyGood  validate mode found nothing to fix
 * @param totalNodes   nodes of the pool considered
 * @param emptyLaneIds lanes left without members after the moves
 * @param before       coherence before, validate mode only
 * @param after        coherence of the projected assignment, validate mode only
 * @param improvement  {@code after - before} in percentage points, validate mode only
 * @param snapshot     the updated snapshot when applied, the input snapshot otherwise
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RedistributionResult(
        RedistributionStrategy strategy,
        String poolId,
        boolean dryRun,
        boolean applied,
        boolean alreadyGood,
        String message,
        List<Move> moves,
        int totalNodes,
        List<String> emptyLaneIds,
        CoherenceReport before,
        CoherenceReport after,
        Integer improvement,
        @JsonIgnore GraphSnapshot snapshot
) {
    public RedistributionResult {
        moves = moves == null ? List.of() : List.copyOf(moves);
        emptyLaneIds = emptyLaneIds == null ? List.of() : List.copyOf(emptyLaneIds);
    }

    public int movedCount() {
        return moves.size();
    }
}
