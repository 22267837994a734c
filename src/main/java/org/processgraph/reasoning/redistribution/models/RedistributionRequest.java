package org.processgraph.reasoning.redistribution.models;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Parameters of one redistribution call.
 *
 * @param poolId       pool to redistribute; null picks the first pool with at least two lanes
 * @param strategy     defaults to {@link RedistributionStrategy#ROLE_BASED}
 * @param dryRun       compute the moves without producing an updated snapshot
 * @param validate     score first, skip when already coherent, otherwise minimize crossings
 * @param reposition   signal the reposition listener after applying; defaults to true
 * @param nodeIds      nodes to move, manual strategy only
 * @param targetLaneId destination lane, manual strategy only
 * @param orderingHint opaque per-node rank for the type fallback of the classifier
 */
@Builder
public record RedistributionRequest(
        String poolId,
        RedistributionStrategy strategy,
        boolean dryRun,
        boolean validate,
        Boolean reposition,
        List<String> nodeIds,
        String targetLaneId,
        Map<String, Double> orderingHint
) {
    public RedistributionRequest {
        if (strategy == null) {
            strategy = RedistributionStrategy.ROLE_BASED;
        }
        if (reposition == null) {
            reposition = Boolean.TRUE;
        }
        if (nodeIds != null) {
            nodeIds = List.copyOf(nodeIds);
        }
        orderingHint = orderingHint == null ? Map.of() : Map.copyOf(orderingHint);
    }
}
