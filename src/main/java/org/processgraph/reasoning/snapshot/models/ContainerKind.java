package org.processgraph.reasoning.snapshot.models;

public enum ContainerKind {
    POOL,
    LANE
}
