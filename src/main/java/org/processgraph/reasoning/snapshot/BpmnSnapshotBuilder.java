package org.processgraph.reasoning.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.impl.BpmnModelConstants;
import org.camunda.bpm.model.bpmn.instance.Artifact;
import org.camunda.bpm.model.bpmn.instance.Association;
import org.camunda.bpm.model.bpmn.instance.BaseElement;
import org.camunda.bpm.model.bpmn.instance.BoundaryEvent;
import org.camunda.bpm.model.bpmn.instance.BusinessRuleTask;
import org.camunda.bpm.model.bpmn.instance.CallActivity;
import org.camunda.bpm.model.bpmn.instance.CancelEventDefinition;
import org.camunda.bpm.model.bpmn.instance.CatchEvent;
import org.camunda.bpm.model.bpmn.instance.CompensateEventDefinition;
import org.camunda.bpm.model.bpmn.instance.ConditionalEventDefinition;
import org.camunda.bpm.model.bpmn.instance.EndEvent;
import org.camunda.bpm.model.bpmn.instance.ErrorEventDefinition;
import org.camunda.bpm.model.bpmn.instance.EscalationEventDefinition;
import org.camunda.bpm.model.bpmn.instance.EventBasedGateway;
import org.camunda.bpm.model.bpmn.instance.EventDefinition;
import org.camunda.bpm.model.bpmn.instance.ExclusiveGateway;
import org.camunda.bpm.model.bpmn.instance.FlowElement;
import org.camunda.bpm.model.bpmn.instance.FlowNode;
import org.camunda.bpm.model.bpmn.instance.InclusiveGateway;
import org.camunda.bpm.model.bpmn.instance.IntermediateCatchEvent;
import org.camunda.bpm.model.bpmn.instance.IntermediateThrowEvent;
import org.camunda.bpm.model.bpmn.instance.InteractionNode;
import org.camunda.bpm.model.bpmn.instance.Lane;
import org.camunda.bpm.model.bpmn.instance.LaneSet;
import org.camunda.bpm.model.bpmn.instance.LinkEventDefinition;
import org.camunda.bpm.model.bpmn.instance.ManualTask;
import org.camunda.bpm.model.bpmn.instance.MessageEventDefinition;
import org.camunda.bpm.model.bpmn.instance.MessageFlow;
import org.camunda.bpm.model.bpmn.instance.ParallelGateway;
import org.camunda.bpm.model.bpmn.instance.Participant;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.bpmn.instance.ReceiveTask;
import org.camunda.bpm.model.bpmn.instance.ScriptTask;
import org.camunda.bpm.model.bpmn.instance.SendTask;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.bpmn.instance.ServiceTask;
import org.camunda.bpm.model.bpmn.instance.SignalEventDefinition;
import org.camunda.bpm.model.bpmn.instance.StartEvent;
import org.camunda.bpm.model.bpmn.instance.SubProcess;
import org.camunda.bpm.model.bpmn.instance.Task;
import org.camunda.bpm.model.bpmn.instance.TerminateEventDefinition;
import org.camunda.bpm.model.bpmn.instance.ThrowEvent;
import org.camunda.bpm.model.bpmn.instance.TimerEventDefinition;
import org.camunda.bpm.model.bpmn.instance.UserTask;
import org.processgraph.reasoning.snapshot.models.EdgeKind;
import org.processgraph.reasoning.snapshot.models.EventTrigger;
import org.processgraph.reasoning.snapshot.models.GraphEdge;
import org.processgraph.reasoning.snapshot.models.GraphNode;
import org.processgraph.reasoning.snapshot.models.NodeKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a Camunda {@link BpmnModelInstance} into a {@link GraphSnapshot}.
 * <p>
 * Participants become pools, top-level lanes of their process become lanes, and the
 * process' flow nodes, sequence flows, message flows and associations become nodes and
 * edges. A process that no participant references becomes an implicit pool of its own.
 * Embedded sub-processes are walked recursively. Nested child lane sets are not represented.
 */
@Slf4j
public class BpmnSnapshotBuilder {
    private static final String CAMUNDA_ASSIGNEE = "assignee";
    private static final String CAMUNDA_CANDIDATE_GROUPS = "candidateGroups";

    public static GraphSnapshot build(BpmnModelInstance modelInstance) {
        GraphSnapshotBuilder builder = new GraphSnapshotBuilder();
        Set<String> nodeIds = new HashSet<>();
        Set<String> processesWithPool = new HashSet<>();

        for (Participant participant : modelInstance.getModelElementsByType(Participant.class)) {
            Process process = participant.getProcess();
            if (process == null) {
                // collapsed (black-box) pool, nothing to reason about
                continue;
            }
            processesWithPool.add(process.getId());
            addProcess(builder, participant.getId(), participant.getName(), process, nodeIds);
        }

        for (Process process : modelInstance.getModelElementsByType(Process.class)) {
            if (!processesWithPool.contains(process.getId())) {
                addProcess(builder, process.getId(), process.getName(), process, nodeIds);
            }
        }

        for (MessageFlow messageFlow : modelInstance.getModelElementsByType(MessageFlow.class)) {
            InteractionNode source = messageFlow.getSource();
            InteractionNode target = messageFlow.getTarget();
            if (source != null && target != null
                    && nodeIds.contains(source.getId()) && nodeIds.contains(target.getId())) {
                builder.edge(new GraphEdge(messageFlow.getId(), EdgeKind.MESSAGE, source.getId(), target.getId(), false));
            }
        }

        return builder.build();
    }

    private static void addProcess(GraphSnapshotBuilder builder, String poolId, String poolName,
                                   Process process, Set<String> nodeIds) {
        builder.pool(poolId, poolName);

        List<String> processNodeIds = new ArrayList<>();
        List<SequenceFlow> sequenceFlows = new ArrayList<>();
        List<Association> associations = new ArrayList<>();

        for (FlowElement element : process.getFlowElements()) {
            if (element instanceof FlowNode) {
                FlowNode flowNode = (FlowNode) element;
                builder.node(toGraphNode(flowNode, null));
                processNodeIds.add(flowNode.getId());
                nodeIds.add(flowNode.getId());
                if (flowNode instanceof SubProcess) {
                    addSubProcess(builder, (SubProcess) flowNode, nodeIds, sequenceFlows, associations);
                }
            } else if (element instanceof SequenceFlow) {
                sequenceFlows.add((SequenceFlow) element);
            }
        }
        collectAssociations(process.getArtifacts(), associations);

        builder.place(poolId, processNodeIds.toArray(new String[0]));

        for (LaneSet laneSet : process.getLaneSets()) {
            for (Lane lane : laneSet.getLanes()) {
                builder.lane(lane.getId(), lane.getName(), poolId);
                List<String> refs = new ArrayList<>();
                for (FlowNode ref : lane.getFlowNodeRefs()) {
                    if (processNodeIds.contains(ref.getId())) {
                        refs.add(ref.getId());
                    }
                }
                builder.place(lane.getId(), refs.toArray(new String[0]));
                if (lane.getChildLaneSet() != null) {
                    log.debug("Ignoring child lanes of lane '{}'", lane.getId());
                }
            }
        }

        for (SequenceFlow flow : sequenceFlows) {
            if (flow.getSource() == null || flow.getTarget() == null) {
                log.warn("Skipping sequence flow '{}' without source or target", flow.getId());
                continue;
            }
            builder.edge(new GraphEdge(flow.getId(), EdgeKind.SEQUENCE,
                    flow.getSource().getId(), flow.getTarget().getId(), flow.getConditionExpression() != null));
        }

        for (Association association : associations) {
            BaseElement source = association.getSource();
            BaseElement target = association.getTarget();
            if (source != null && target != null
                    && nodeIds.contains(source.getId()) && nodeIds.contains(target.getId())) {
                builder.edge(new GraphEdge(association.getId(), EdgeKind.ASSOCIATION,
                        source.getId(), target.getId(), false));
            }
        }
    }

    /**
     * Adds the content of an embedded sub-process. Its nodes take part in the graph but
     * not in lane membership: they belong to the pool through the sub-process node.
     */
    private static void addSubProcess(GraphSnapshotBuilder builder, SubProcess subProcess, Set<String> nodeIds,
                                      List<SequenceFlow> sequenceFlows, List<Association> associations) {
        for (FlowElement element : subProcess.getFlowElements()) {
            if (element instanceof FlowNode) {
                FlowNode flowNode = (FlowNode) element;
                builder.node(toGraphNode(flowNode, subProcess.getId()));
                nodeIds.add(flowNode.getId());
                if (flowNode instanceof SubProcess) {
                    addSubProcess(builder, (SubProcess) flowNode, nodeIds, sequenceFlows, associations);
                }
            } else if (element instanceof SequenceFlow) {
                sequenceFlows.add((SequenceFlow) element);
            }
        }
        collectAssociations(subProcess.getArtifacts(), associations);
    }

    private static void collectAssociations(Collection<Artifact> artifacts, List<Association> associations) {
        for (Artifact artifact : artifacts) {
            if (artifact instanceof Association) {
                associations.add((Association) artifact);
            }
        }
    }

    static GraphNode toGraphNode(FlowNode flowNode, String parentNodeId) {
        NodeKind kind = kindOf(flowNode);
        Set<EventTrigger> triggers = EnumSet.noneOf(EventTrigger.class);
        String linkName = null;

        Collection<EventDefinition> definitions = eventDefinitions(flowNode);
        for (EventDefinition definition : definitions) {
            EventTrigger trigger = triggerOf(definition);
            if (trigger == null) {
                continue;
            }
            triggers.add(trigger);
            if (definition instanceof LinkEventDefinition) {
                linkName = ((LinkEventDefinition) definition).getName();
            }
        }

        return GraphNode.builder()
                .id(flowNode.getId())
                .kind(kind)
                .name(flowNode.getName())
                .role(extractPrimaryRole(flowNode))
                .triggers(triggers)
                .linkName(linkName)
                .parentNodeId(parentNodeId)
                .build();
    }

    /**
     * Maps a Camunda flow node to its {@link NodeKind}. Specific task types are checked
     * before the generic {@link Task} they all extend.
     */
    static NodeKind kindOf(FlowNode flowNode) {
        if (flowNode instanceof UserTask) return NodeKind.USER_TASK;
        if (flowNode instanceof ManualTask) return NodeKind.MANUAL_TASK;
        if (flowNode instanceof ServiceTask) return NodeKind.SERVICE_TASK;
        if (flowNode instanceof ScriptTask) return NodeKind.SCRIPT_TASK;
        if (flowNode instanceof BusinessRuleTask) return NodeKind.BUSINESS_RULE_TASK;
        if (flowNode instanceof SendTask) return NodeKind.SEND_TASK;
        if (flowNode instanceof ReceiveTask) return NodeKind.RECEIVE_TASK;
        if (flowNode instanceof Task) return NodeKind.TASK;
        if (flowNode instanceof CallActivity) return NodeKind.CALL_ACTIVITY;
        if (flowNode instanceof SubProcess) return NodeKind.SUB_PROCESS;

        if (flowNode instanceof ExclusiveGateway) return NodeKind.EXCLUSIVE_GATEWAY;
        if (flowNode instanceof ParallelGateway) return NodeKind.PARALLEL_GATEWAY;
        if (flowNode instanceof InclusiveGateway) return NodeKind.INCLUSIVE_GATEWAY;
        if (flowNode instanceof EventBasedGateway) return NodeKind.EVENT_BASED_GATEWAY;

        if (flowNode instanceof StartEvent) return NodeKind.START_EVENT;
        if (flowNode instanceof EndEvent) return NodeKind.END_EVENT;
        if (flowNode instanceof BoundaryEvent) return NodeKind.BOUNDARY_EVENT;
        if (flowNode instanceof IntermediateCatchEvent) return NodeKind.INTERMEDIATE_CATCH_EVENT;
        if (flowNode instanceof IntermediateThrowEvent) return NodeKind.INTERMEDIATE_THROW_EVENT;

        log.debug("Unsupported flow node type {} for '{}', mapping to OTHER",
                flowNode.getElementType().getTypeName(), flowNode.getId());
        return NodeKind.OTHER;
    }

    /**
     * Extracts the primary role (assignee or first candidate group) from a flow node.
     * Returns null when no role assignment is found.
     */
    static String extractPrimaryRole(FlowNode flowNode) {
        String assignee = flowNode.getAttributeValueNs(BpmnModelConstants.CAMUNDA_NS, CAMUNDA_ASSIGNEE);
        if (assignee != null && !assignee.trim().isEmpty()) {
            return assignee.trim();
        }
        String candidateGroups = flowNode.getAttributeValueNs(BpmnModelConstants.CAMUNDA_NS, CAMUNDA_CANDIDATE_GROUPS);
        if (candidateGroups != null) {
            String first = candidateGroups.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return null;
    }

    private static Collection<EventDefinition> eventDefinitions(FlowNode flowNode) {
        if (flowNode instanceof CatchEvent) {
            return ((CatchEvent) flowNode).getEventDefinitions();
        }
        if (flowNode instanceof ThrowEvent) {
            return ((ThrowEvent) flowNode).getEventDefinitions();
        }
        return List.of();
    }

    private static EventTrigger triggerOf(EventDefinition definition) {
        if (definition instanceof MessageEventDefinition) return EventTrigger.MESSAGE;
        if (definition instanceof TimerEventDefinition) return EventTrigger.TIMER;
        if (definition instanceof SignalEventDefinition) return EventTrigger.SIGNAL;
        if (definition instanceof ErrorEventDefinition) return EventTrigger.ERROR;
        if (definition instanceof EscalationEventDefinition) return EventTrigger.ESCALATION;
        if (definition instanceof ConditionalEventDefinition) return EventTrigger.CONDITIONAL;
        if (definition instanceof CompensateEventDefinition) return EventTrigger.COMPENSATE;
        if (definition instanceof LinkEventDefinition) return EventTrigger.LINK;
        if (definition instanceof TerminateEventDefinition) return EventTrigger.TERMINATE;
        if (definition instanceof CancelEventDefinition) return EventTrigger.CANCEL;
        return null;
    }
}
