package org.processgraph.reasoning.redistribution;

import org.processgraph.reasoning.redistribution.models.Move;

import java.util.List;

/**
 * Notified after moves were applied so that shapes can be laid out inside their new lanes.
 */
@FunctionalInterface
public interface RepositionListener {
    RepositionListener NONE = (poolId, moves) -> { };

    void repositionRequested(String poolId, List<Move> moves);
}
