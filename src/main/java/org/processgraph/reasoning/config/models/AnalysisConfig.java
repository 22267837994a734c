package org.processgraph.reasoning.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.processgraph.reasoning.snapshot.models.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the reasoning core.
 * <p>
 * Example (config/analysis-config.json):
 * {
 * "lowCoherenceThreshold": 70,
 * "gatewayDepthLimit": 25,
 * "humanLaneHints": ["human", "manual", "user", "review", "support"],
 * "automatedLaneHints": ["auto", "system", "service", "script", "external"],
 * "balanceCheckedGatewayKinds": ["PARALLEL_GATEWAY", "INCLUSIVE_GATEWAY"]
 * }
 * Fields missing from a document keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisConfig {
    public static final int DEFAULT_LOW_COHERENCE_THRESHOLD = 70;
    public static final int DEFAULT_GATEWAY_DEPTH_LIMIT = 25;

    /**
     * Coherence score (0-100) below which a lane organization is reported as low-coherence.
     * <p>
     * Validate-mode redistribution uses the same value as its pass mark: a pool scoring at
     * least this much with no actionable issue is left untouched. With the default of 70
     * that is the fixed 70% pass mark; raising or lowering it moves both together.
     */
    public int lowCoherenceThreshold = DEFAULT_LOW_COHERENCE_THRESHOLD;

    /**
     * Maximum number of nodes a gateway-balance branch walk visits in depth.
     */
    public int gatewayDepthLimit = DEFAULT_GATEWAY_DEPTH_LIMIT;

    /**
     * Lane-name fragments identifying the lane for human work.
     */
    public List<String> humanLaneHints = new ArrayList<>(List.of("human", "manual", "user", "review", "support"));

    /**
     * Lane-name fragments identifying the lane for automated work.
     */
    public List<String> automatedLaneHints = new ArrayList<>(List.of("auto", "system", "service", "script", "external"));

    /**
     * Gateway kinds whose splits are checked for balance when all diagnostics run.
     */
    public List<NodeKind> balanceCheckedGatewayKinds =
            new ArrayList<>(List.of(NodeKind.PARALLEL_GATEWAY, NodeKind.INCLUSIVE_GATEWAY));

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }
}
