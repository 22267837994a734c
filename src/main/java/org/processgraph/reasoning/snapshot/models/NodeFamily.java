package org.processgraph.reasoning.snapshot.models;

/**
 * Coarse grouping of {@link NodeKind}s.
 * Gateways and events are "flow control": they route tokens rather than perform work.
 */
public enum NodeFamily {
    TASK,
    GATEWAY,
    EVENT,
    OTHER;

    public boolean isFlowControl() {
        return this == GATEWAY || this == EVENT;
    }
}
