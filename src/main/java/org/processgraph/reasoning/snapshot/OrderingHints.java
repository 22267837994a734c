package org.processgraph.reasoning.snapshot;

import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.BaseElement;
import org.camunda.bpm.model.bpmn.instance.FlowNode;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnShape;
import org.camunda.bpm.model.bpmn.instance.dc.Bounds;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the opaque per-node ordering hint used by the lane classifier's type fallback.
 * The classifier only compares hint values; it never knows what they were derived from.
 */
public class OrderingHints {

    /**
     * Ranks flow nodes by the vertical centre of their diagram shape.
     * Nodes without a shape get no hint.
     */
    public static Map<String, Double> fromDiagram(BpmnModelInstance modelInstance) {
        Map<String, Double> hints = new HashMap<>();
        for (BpmnShape shape : modelInstance.getModelElementsByType(BpmnShape.class)) {
            BaseElement element = shape.getBpmnElement();
            Bounds bounds = shape.getBounds();
            if (!(element instanceof FlowNode) || bounds == null || bounds.getY() == null) {
                continue;
            }
            double height = bounds.getHeight() != null ? bounds.getHeight() : 0d;
            hints.put(element.getId(), bounds.getY() + height / 2);
        }
        return hints;
    }
}
