package org.processgraph.reasoning.snapshot.models;

/**
 * Closed set of node kinds understood by the reasoning core.
 * Anything the BPMN adapter cannot map becomes {@link #OTHER}, which never votes and is
 * never treated as a task.
 */
public enum NodeKind {
    TASK(NodeFamily.TASK),
    USER_TASK(NodeFamily.TASK),
    MANUAL_TASK(NodeFamily.TASK),
    SERVICE_TASK(NodeFamily.TASK),
    SCRIPT_TASK(NodeFamily.TASK),
    BUSINESS_RULE_TASK(NodeFamily.TASK),
    SEND_TASK(NodeFamily.TASK),
    RECEIVE_TASK(NodeFamily.TASK),
    CALL_ACTIVITY(NodeFamily.TASK),
    SUB_PROCESS(NodeFamily.TASK),

    EXCLUSIVE_GATEWAY(NodeFamily.GATEWAY),
    PARALLEL_GATEWAY(NodeFamily.GATEWAY),
    INCLUSIVE_GATEWAY(NodeFamily.GATEWAY),
    EVENT_BASED_GATEWAY(NodeFamily.GATEWAY),

    START_EVENT(NodeFamily.EVENT),
    END_EVENT(NodeFamily.EVENT),
    INTERMEDIATE_CATCH_EVENT(NodeFamily.EVENT),
    INTERMEDIATE_THROW_EVENT(NodeFamily.EVENT),
    BOUNDARY_EVENT(NodeFamily.EVENT),

    OTHER(NodeFamily.OTHER);

    private final NodeFamily family;

    NodeKind(NodeFamily family) {
        this.family = family;
    }

    public NodeFamily family() {
        return family;
    }

    public boolean isGateway() {
        return family == NodeFamily.GATEWAY;
    }

    public boolean isFlowControl() {
        return family.isFlowControl();
    }

    /**
     * Tasks normally performed by a person.
     */
    public boolean isHumanTask() {
        return this == USER_TASK || this == MANUAL_TASK;
    }

    /**
     * Tasks normally performed by a system.
     */
    public boolean isAutomatedTask() {
        switch (this) {
            case SERVICE_TASK:
            case SCRIPT_TASK:
            case BUSINESS_RULE_TASK:
            case SEND_TASK:
            case RECEIVE_TASK:
            case CALL_ACTIVITY:
                return true;
            default:
                return false;
        }
    }
}
