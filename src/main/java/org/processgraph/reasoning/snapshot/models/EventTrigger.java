package org.processgraph.reasoning.snapshot.models;

/**
 * Event definition attached to an event node (e.g. {@code <bpmn:compensateEventDefinition/>}).
 * An event without any definition is a "none" event and carries an empty trigger set.
 */
public enum EventTrigger {
    MESSAGE,
    TIMER,
    SIGNAL,
    ERROR,
    ESCALATION,
    CONDITIONAL,
    COMPENSATE,
    LINK,
    TERMINATE,
    CANCEL
}
