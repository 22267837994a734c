package org.processgraph.reasoning.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.FlowNode;
import org.camunda.bpm.model.bpmn.instance.Lane;
import org.camunda.bpm.model.bpmn.instance.LaneSet;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persists lane membership changes back into a Camunda model by rewriting the lanes'
 * {@code <flowNodeRef>} lists. Applying the same membership twice is a no-op.
 */
@Slf4j
public class BpmnLaneMembershipWriter {

    /**
     * Moves every listed node into its target lane.
     *
     * @param modelInstance  the model the snapshot was built from
     * @param laneByNodeId   target lane id per flow node id
     * @return number of nodes whose lane reference changed
     * @throws IllegalArgumentException if a node or lane id does not resolve in the model
     */
    public static int apply(BpmnModelInstance modelInstance, Map<String, String> laneByNodeId) {
        int changed = 0;
        for (Map.Entry<String, String> entry : laneByNodeId.entrySet()) {
            FlowNode node = resolve(modelInstance, entry.getKey(), FlowNode.class);
            Lane target = resolve(modelInstance, entry.getValue(), Lane.class);

            if (target.getFlowNodeRefs().contains(node) && countLaneRefs(modelInstance, node) == 1) {
                continue;
            }
            removeFromAllLanes(modelInstance, node);
            target.getFlowNodeRefs().add(node);
            changed++;
            log.debug("Moved flow node '{}' to lane '{}'", node.getId(), target.getId());
        }
        return changed;
    }

    private static void removeFromAllLanes(BpmnModelInstance modelInstance, FlowNode node) {
        for (Lane lane : topLevelLanes(modelInstance)) {
            Collection<FlowNode> refs = lane.getFlowNodeRefs();
            refs.remove(node);
        }
    }

    private static int countLaneRefs(BpmnModelInstance modelInstance, FlowNode node) {
        int count = 0;
        for (Lane lane : topLevelLanes(modelInstance)) {
            if (lane.getFlowNodeRefs().contains(node)) {
                count++;
            }
        }
        return count;
    }

    // child lane sets are not represented in snapshots, so they are left as they are
    private static List<Lane> topLevelLanes(BpmnModelInstance modelInstance) {
        List<Lane> lanes = new ArrayList<>();
        for (Process process : modelInstance.getModelElementsByType(Process.class)) {
            for (LaneSet laneSet : process.getLaneSets()) {
                lanes.addAll(laneSet.getLanes());
            }
        }
        return lanes;
    }

    private static <T extends ModelElementInstance> T resolve(BpmnModelInstance modelInstance, String id,
                                                              Class<T> type) {
        ModelElementInstance element = modelInstance.getModelElementById(id);
        if (!type.isInstance(element)) {
            throw new IllegalArgumentException(String.format(
                    "Element '%s' is not a %s in the BPMN model", id, type.getSimpleName()));
        }
        return type.cast(element);
    }
}
