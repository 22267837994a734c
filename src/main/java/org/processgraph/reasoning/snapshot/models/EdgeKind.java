package org.processgraph.reasoning.snapshot.models;

public enum EdgeKind {
    SEQUENCE,
    MESSAGE,
    ASSOCIATION
}
